package com.autofix.orchestrator.model;

/**
 * Overall status of one pipeline run.
 *
 * Transitions:
 *   RUNNING → SUCCESS   (review approved the change set)
 *   RUNNING → SKIPPED   (triage non-actionable, or the first fix changed nothing)
 *   RUNNING → FAILED    (a stage timed out or its process failed)
 *   RUNNING → BLOCKED   (review blocked, or the revision budget ran out)
 *
 * Every state other than RUNNING is terminal.
 */
public enum PipelineStatus {
    RUNNING,
    SUCCESS,
    SKIPPED,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
