package com.stagecraft.stagecraft_backend.config;

import com.stagecraft.stagecraft_backend.engine.SandboxRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Logs at startup how workflow runs will be sandboxed.
 * If the docker binary is not on PATH, /api/v1/workflow/run will report failures.
 */
@Slf4j
@Component
public class SandboxStartupLogger implements ApplicationRunner {

    private final Environment env;
    private final SandboxRunner sandboxRunner;

    public SandboxStartupLogger(Environment env, SandboxRunner sandboxRunner) {
        this.env = env;
        this.sandboxRunner = sandboxRunner;
    }

    @Override
    public void run(ApplicationArguments args) {
        String command = sandboxRunner.getDockerCommand();
        if (isOnPath(command, env.getProperty("PATH", ""))) {
            log.info("[SANDBOX] {} found. image={}, memory={}, cpus={}, timeout={}s",
                    command, sandboxRunner.getDockerImage(), sandboxRunner.getMemory(),
                    sandboxRunner.getCpus(), sandboxRunner.getTimeoutSeconds());
        } else {
            log.warn("[SANDBOX] '{}' not found on PATH. Workflow runs will fail until Docker is installed.", command);
        }
    }

    /** True when {@code binary} is an absolute executable or an executable in one of the PATH entries. */
    static boolean isOnPath(String binary, String pathVariable) {
        if (binary == null || binary.isBlank()) return false;
        Path direct = Paths.get(binary);
        if (direct.isAbsolute()) {
            return Files.isExecutable(direct);
        }
        if (pathVariable == null || pathVariable.isBlank()) return false;
        for (String dir : pathVariable.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            if (Files.isExecutable(Paths.get(dir, binary))) {
                return true;
            }
        }
        return false;
    }
}
