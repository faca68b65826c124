package com.stagecraft.stagecraft_backend.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SandboxRunnerTest {

    @TempDir
    Path workDir;

    private SandboxRunner runner(String command, long timeoutSeconds) {
        return new SandboxRunner(command, "python:3.11-slim", "2g", "2", timeoutSeconds, workDir.toString());
    }

    @Test
    void buildsAnIsolatedDockerCommand() {
        assertThat(runner("docker", 300).buildCommand("script_1.py")).containsExactly(
                "docker", "run", "--rm",
                "-v", workDir.toAbsolutePath() + ":/code",
                "--network", "none",
                "--memory", "2g",
                "--cpus", "2",
                "python:3.11-slim",
                "python", "/code/script_1.py");
    }

    @Test
    void missingDockerBinaryIsReportedNotThrown() throws Exception {
        SandboxRunner.SandboxResult result = runner("stagecraft-no-such-binary", 5).run("print('hi')");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Failed to run code:");
        assertThat(listFiles()).isZero();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void zeroExitIsSuccess() throws Exception {
        SandboxRunner.SandboxResult result = runner("true", 5).run("print('hi')");

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEmpty();
        assertThat(result.error()).isNull();
        assertThat(listFiles()).isZero();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitCarriesTheStatus() {
        SandboxRunner.SandboxResult result = runner("false", 5).run("print('hi')");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("execution error: exit status 1");
    }

    private long listFiles() throws Exception {
        try (Stream<Path> files = Files.list(workDir)) {
            return files.count();
        }
    }
}
