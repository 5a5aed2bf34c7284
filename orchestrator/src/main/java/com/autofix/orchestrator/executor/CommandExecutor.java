package com.autofix.orchestrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (the agent CLI, git, gh) with a wall-clock bound.
 *
 * Standard output and error are redirected to temporary files rather than
 * read through pipes, so a chatty process can never block on a full pipe
 * buffer while we wait for it. On timeout the process is destroyed forcibly
 * and whatever it wrote so far is discarded by the caller.
 *
 * Calls block until the command exits or times out.
 */
@Component
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    /**
     * Run {@code command} in {@code workDir}.
     *
     * @throws ExecutorException if the process cannot be started or its output cannot be read
     */
    public ExecutionResult run(List<String> command, Path workDir, Duration timeout) {
        Path stdoutFile = null;
        Path stderrFile = null;
        long start = System.nanoTime();
        try {
            stdoutFile = Files.createTempFile("autofix-", ".out");
            stderrFile = Files.createTempFile("autofix-", ".err");

            ProcessBuilder pb = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());

            log.debug("Running {} in {} (timeout {}s)", command.get(0), workDir, timeout.toSeconds());
            Process process = pb.start();
            process.getOutputStream().close();   // no stdin for any command we run

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(10, TimeUnit.SECONDS);
                log.warn("{} exceeded {}s and was killed", command.get(0), timeout.toSeconds());
                return new ExecutionResult(-1, "", "", elapsed, true);
            }

            return new ExecutionResult(
                    process.exitValue(),
                    Files.readString(stdoutFile, StandardCharsets.UTF_8),
                    Files.readString(stderrFile, StandardCharsets.UTF_8),
                    elapsed,
                    false);

        } catch (IOException e) {
            throw new ExecutorException("Could not run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException("Interrupted while waiting for " + command.get(0), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
