package com.autofix.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one agent invocation: status, confidence and the agent's
 * structured payload.
 *
 * Created exactly once per invocation and never mutated. A revision of the
 * fix stage produces a new AgentState that replaces the previous one in the
 * pipeline's latest-state lookup; the earlier one survives only in its
 * persisted file.
 *
 * @param agent       stage label, e.g. "triage" or "fix-revision-2"
 * @param confidence  in [0, 1]
 * @param data        agent-specific payload (snake_case keys, JSON-compatible values)
 * @param error       set only for FAILED states
 */
public record AgentState(
        String agent,
        AgentStatus status,
        double confidence,
        Map<String, Object> data,
        String error,
        Instant startedAt,
        Instant completedAt) {

    public AgentState {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(status, "status");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        data = data == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static AgentState success(String agent, double confidence, Map<String, Object> data,
                                     Instant startedAt, Instant completedAt) {
        return new AgentState(agent, AgentStatus.SUCCESS, confidence, data, null, startedAt, completedAt);
    }

    public static AgentState skipped(String agent, double confidence, Map<String, Object> data,
                                     Instant startedAt, Instant completedAt) {
        return new AgentState(agent, AgentStatus.SKIPPED, confidence, data, null, startedAt, completedAt);
    }

    public static AgentState failed(String agent, String error, Map<String, Object> data,
                                    Instant startedAt, Instant completedAt) {
        return new AgentState(agent, AgentStatus.FAILED, 0.0, data, error, startedAt, completedAt);
    }

    // ------------------------------------------------------------------
    // Payload accessors
    // ------------------------------------------------------------------

    /** String value of a payload key, or {@code fallback} if absent or null. */
    public String text(String key, String fallback) {
        Object value = data.get(key);
        return value == null ? fallback : value.toString();
    }

    /** List value of a payload key rendered as strings; empty if absent or not a list. */
    public List<String> textList(String key) {
        Object value = data.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).map(Object::toString).toList();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == AgentStatus.SUCCESS;
    }
}
