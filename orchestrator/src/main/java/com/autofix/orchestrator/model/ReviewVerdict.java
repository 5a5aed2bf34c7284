package com.autofix.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Categorical outcome of the review stage.
 */
public enum ReviewVerdict {
    APPROVE,
    REQUEST_CHANGES,    // revisable: the fix stage runs again with the feedback
    BLOCK;              // terminal

    /**
     * Parse a verdict string as written by the review agent.
     * Accepts the canonical names plus the spellings agents drift into.
     */
    public static Optional<ReviewVerdict> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.strip().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return switch (normalized) {
            case "APPROVE", "APPROVED", "LGTM" -> Optional.of(APPROVE);
            case "REQUEST_CHANGES", "CHANGES_REQUESTED", "NEEDS_CHANGES" -> Optional.of(REQUEST_CHANGES);
            case "BLOCK", "BLOCKED", "REJECT", "REJECTED" -> Optional.of(BLOCK);
            default -> Optional.empty();
        };
    }
}
