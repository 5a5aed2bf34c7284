package com.autofix.orchestrator.executor;

/**
 * Captured outcome of one external command.
 *
 * @param exitCode   process exit status; -1 when the command was killed on timeout
 * @param elapsedSec wall-clock duration
 * @param timedOut   true if the command exceeded its bound and was destroyed
 */
public record ExecutionResult(
        int exitCode,
        String stdout,
        String stderr,
        double elapsedSec,
        boolean timedOut) {

    /** True if the command finished in time with exit status 0. */
    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    /** Trimmed standard output. */
    public String out() {
        return stdout == null ? "" : stdout.strip();
    }

    /** Short description for error messages: stderr if present, else stdout. */
    public String describeFailure() {
        if (timedOut) {
            return "timed out after %.0fs".formatted(elapsedSec);
        }
        String detail = stderr != null && !stderr.isBlank() ? stderr.strip() : out();
        return "exit code " + exitCode + (detail.isEmpty() ? "" : ": " + detail);
    }
}
