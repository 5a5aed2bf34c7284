package com.autofix.orchestrator.model;

/**
 * The four stage roles of the pipeline, in execution order.
 *
 * The lower-case key is used for state file names, the completed-stages log
 * and the confidence weight table.
 */
public enum AgentRole {
    TRIAGE("triage"),       // Decides whether the issue is auto-fixable
    RESEARCH("research"),   // Root-cause analysis of the codebase
    FIX("fix"),             // Edits the working tree
    REVIEW("review");       // Reviews the change set and issues a verdict

    private final String key;

    AgentRole(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
