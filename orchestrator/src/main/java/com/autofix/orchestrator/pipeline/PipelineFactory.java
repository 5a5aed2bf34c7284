package com.autofix.orchestrator.pipeline;

import com.autofix.orchestrator.agent.FixAgent;
import com.autofix.orchestrator.agent.FixRevisionAgent;
import com.autofix.orchestrator.agent.ResearchAgent;
import com.autofix.orchestrator.agent.ReviewAgent;
import com.autofix.orchestrator.agent.TriageAgent;
import com.autofix.orchestrator.config.AutofixProperties;
import com.autofix.orchestrator.model.Issue;
import com.autofix.orchestrator.store.RunDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds a fresh {@link PipelineStateMachine} per issue from the singleton agents
 * and the configured settings.
 */
@Component
public class PipelineFactory {

    private final StageAgents       agents;
    private final PipelineSettings  settings;
    private final AutofixProperties properties;
    private final Clock             clock;
    private final MeterRegistry     meterRegistry;

    public PipelineFactory(TriageAgent triage, ResearchAgent research, FixAgent fix,
                           FixRevisionAgent fixRevision, ReviewAgent review,
                           AutofixProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.agents        = new StageAgents(triage, research, fix, fixRevision, review);
        this.settings      = PipelineSettings.from(properties.pipeline());
        this.properties    = properties;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    public PipelineStateMachine create(Issue issue, RunDirectory run) {
        return new PipelineStateMachine(agents, settings, run, issue,
                properties.projectDir(), properties.timeouts(), clock, meterRegistry);
    }

    public PipelineSettings settings() {
        return settings;
    }
}
