package com.stagecraft.stagecraft_backend.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs Python code in a throwaway Docker container.
 *
 * How it works:
 *   1. Write the code to a temp file inside the work directory
 *   2. Mount the work directory at /code, no network, capped memory and CPUs
 *   3. Run `python /code/<file>`, stdout and stderr go to temp files
 *   4. Wait up to the timeout; force-kill on timeout or interruption
 *   5. Delete the temp files
 *
 * A failed run always comes back with success=false and an error message, so it never
 * looks like a run that simply printed nothing.
 */
@Slf4j
@Service
public class SandboxRunner {

    private final String dockerCommand;
    private final String dockerImage;
    private final String memory;
    private final String cpus;
    private final long   timeoutSeconds;
    private final Path   workDir;

    public SandboxRunner(@Value("${stagecraft.sandbox.docker-command:docker}") String dockerCommand,
                         @Value("${stagecraft.sandbox.docker-image:python:3.11-slim}") String dockerImage,
                         @Value("${stagecraft.sandbox.memory:2g}") String memory,
                         @Value("${stagecraft.sandbox.cpus:2}") String cpus,
                         @Value("${stagecraft.sandbox.timeout-seconds:300}") long timeoutSeconds,
                         @Value("${stagecraft.sandbox.work-dir:${java.io.tmpdir}/code_execution}") String workDir) {
        this.dockerCommand = dockerCommand;
        this.dockerImage = dockerImage;
        this.memory = memory;
        this.cpus = cpus;
        this.timeoutSeconds = timeoutSeconds;
        this.workDir = Paths.get(workDir);
    }

    // ── Public API ────────────────────────────────────────────────────────────

    public SandboxResult run(String code) {
        Path scriptFile = null;
        Path stdoutFile = null;
        Path stderrFile = null;

        try {
            Files.createDirectories(workDir);
            scriptFile = Files.createTempFile(workDir, "script_", ".py");
            stdoutFile = Files.createTempFile("sandbox_out_", ".log");
            stderrFile = Files.createTempFile("sandbox_err_", ".log");
            Files.writeString(scriptFile, code, StandardCharsets.UTF_8);

            List<String> command = buildCommand(scriptFile.getFileName().toString());
            log.info("Sandbox run started: image={}, file={}", dockerImage, scriptFile.getFileName());

            Process process = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Sandbox run timed out after {}s: {}", timeoutSeconds, scriptFile.getFileName());
                return SandboxResult.failure(readQuietly(stderrFile),
                        "Execution timed out after " + timeoutSeconds + " seconds.");
            }

            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            log.info("Sandbox run finished: exitCode={}, file={}", exitCode, scriptFile.getFileName());

            if (exitCode != 0) {
                return SandboxResult.failure(stderr, "execution error: exit status " + exitCode);
            }
            String output = stderr.isEmpty() ? stdout : stdout + "\n[STDERR]\n" + stderr;
            return SandboxResult.ok(output);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SandboxResult.failure("", "Execution was interrupted.");
        } catch (IOException e) {
            log.error("Sandbox IO error: {}", e.getMessage(), e);
            return SandboxResult.failure("", "Failed to run code: " + e.getMessage());
        } finally {
            deleteQuietly(scriptFile);
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    /** docker run --rm -v <workDir>:/code --network none --memory 2g --cpus 2 <image> python /code/<file> */
    List<String> buildCommand(String fileName) {
        return List.of(
                dockerCommand, "run",
                "--rm",
                "-v", workDir.toAbsolutePath() + ":/code",
                "--network", "none",
                "--memory", memory,
                "--cpus", cpus,
                dockerImage,
                "python", "/code/" + fileName
        );
    }

    public String getDockerCommand() { return dockerCommand; }
    public String getDockerImage()   { return dockerImage; }
    public String getMemory()        { return memory; }
    public String getCpus()          { return cpus; }
    public long getTimeoutSeconds()  { return timeoutSeconds; }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String readQuietly(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read sandbox log {}: {}", path, e.getMessage());
            return "";
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete sandbox temp file {}: {}", path, e.getMessage());
        }
    }

    // ── Result type ───────────────────────────────────────────────────────────

    public record SandboxResult(boolean success, String output, String error) {
        static SandboxResult ok(String output)                     { return new SandboxResult(true,  output, null); }
        static SandboxResult failure(String output, String error)  { return new SandboxResult(false, output, error); }
    }
}
