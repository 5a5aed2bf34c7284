package com.autofix.orchestrator.model;

import java.util.Locale;

/**
 * Classifications the triage agent may assign to an issue.
 */
public enum TriageClassification {
    FIXABLE_CODE,
    FIXABLE_CONFIG,
    NEEDS_HUMAN,
    NEEDS_CLARIFICATION,
    OUT_OF_SCOPE,
    DUPLICATE;

    public boolean isFixable() {
        return this == FIXABLE_CODE || this == FIXABLE_CONFIG;
    }

    /** Unknown or missing values are treated as NEEDS_CLARIFICATION. */
    public static TriageClassification parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEEDS_CLARIFICATION;
        }
        try {
            return valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NEEDS_CLARIFICATION;
        }
    }
}
