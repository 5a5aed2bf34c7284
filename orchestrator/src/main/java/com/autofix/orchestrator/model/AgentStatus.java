package com.autofix.orchestrator.model;

/**
 * Outcome of a single agent invocation.
 *
 * SKIPPED is a semantic result, not an error: the agent ran but its own
 * judgement halts forward progress (non-actionable issue, no changes made,
 * review did not approve).
 */
public enum AgentStatus {
    SUCCESS,
    SKIPPED,
    FAILED
}
