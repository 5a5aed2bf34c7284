package com.autofix.orchestrator.claude;

/**
 * Outcome of one agent CLI invocation.
 *
 * @param output     raw standard output: newline-delimited stream-json event records
 * @param error      captured standard error when the process exited non-zero, else empty
 * @param durationMs reported by the CLI's final result event (0 if absent)
 * @param costUsd    reported by the CLI's final result event (0 if absent)
 */
public record ClaudeResult(
        boolean success,
        String output,
        String error,
        long durationMs,
        double costUsd) {
}
