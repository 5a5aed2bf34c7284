package com.autofix.orchestrator.pipeline;

import com.autofix.orchestrator.agent.Agent;

import java.util.Objects;

/**
 * The agents the state machine drives. {@code fixRevision} runs on the
 * second and later fix-review rounds.
 */
public record StageAgents(Agent triage, Agent research, Agent fix, Agent fixRevision, Agent review) {

    public StageAgents {
        Objects.requireNonNull(triage, "triage");
        Objects.requireNonNull(research, "research");
        Objects.requireNonNull(fix, "fix");
        Objects.requireNonNull(fixRevision, "fixRevision");
        Objects.requireNonNull(review, "review");
    }
}
