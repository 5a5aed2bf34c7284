package com.autofix.orchestrator.claude;

import com.autofix.orchestrator.config.AutofixProperties;
import com.autofix.orchestrator.executor.CommandExecutor;
import com.autofix.orchestrator.executor.ExecutionResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Invokes the agent CLI in non-interactive mode and captures its event stream.
 *
 * This is the only suspension point of the pipeline: the call blocks until
 * the process exits or its timeout fires. A timeout is raised as
 * {@link ClaudeTimeoutException}; partial output is never salvaged.
 *
 * The CLI is started as
 * <pre>
 *   claude --dangerously-skip-permissions --verbose --output-format stream-json --print &lt;prompt&gt;
 * </pre>
 * so stdout is one JSON event record per line.
 */
@Component
public class ClaudeRunner {

    private static final Logger log = LoggerFactory.getLogger(ClaudeRunner.class);

    private final CommandExecutor executor;
    private final ObjectMapper    json;
    private final String          cliPath;

    public ClaudeRunner(CommandExecutor executor, ObjectMapper objectMapper, AutofixProperties properties) {
        this.executor = executor;
        this.json     = objectMapper;
        this.cliPath  = properties.claudePath();
    }

    /**
     * Run one prompt to completion.
     *
     * @param logFile if non-null, receives the raw stdout (written even on failure)
     * @throws ClaudeTimeoutException if the process outlives {@code timeout}
     */
    public ClaudeResult run(String prompt, Path workDir, Duration timeout, Path logFile) {
        List<String> command = List.of(
                cliPath,
                "--dangerously-skip-permissions",
                "--verbose",
                "--output-format", "stream-json",
                "--print",
                prompt);

        ExecutionResult result = executor.run(command, workDir, timeout);
        if (result.timedOut()) {
            throw new ClaudeTimeoutException(timeout);
        }

        String output = result.stdout() == null ? "" : result.stdout();
        if (logFile != null) {
            writeLog(logFile, output);
        }

        long   durationMs = 0;
        double costUsd    = 0.0;
        for (String line : output.split("\n")) {
            JsonNode event = parseEvent(line);
            if (event != null && "result".equals(event.path("type").asText())) {
                durationMs = event.path("duration_ms").asLong(0);
                costUsd    = event.path("total_cost_usd").asDouble(0.0);
            }
        }

        boolean ok = result.exitCode() == 0;
        if (!ok) {
            log.warn("Agent CLI exited with code {}", result.exitCode());
        }
        return new ClaudeResult(
                ok,
                output,
                ok ? "" : errorText(result),
                durationMs,
                costUsd);
    }

    private JsonNode parseEvent(String line) {
        if (line.isBlank()) {
            return null;
        }
        try {
            return json.readTree(line);
        } catch (IOException e) {
            return null;   // not an event record
        }
    }

    private static String errorText(ExecutionResult result) {
        String stderr = result.stderr() == null ? "" : result.stderr().strip();
        return stderr.isEmpty() ? "Agent CLI exited with code " + result.exitCode() : stderr;
    }

    private static void writeLog(Path logFile, String output) {
        try {
            Files.writeString(logFile, output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not write agent log {}: {}", logFile, e.getMessage());
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeTimeoutException extends RuntimeException {
        private final Duration timeout;
        public ClaudeTimeoutException(Duration timeout) {
            super("Claude timed out after %ds".formatted(timeout.toSeconds()));
            this.timeout = timeout;
        }
        public Duration timeout() { return timeout; }
    }
}
