package com.autofix.orchestrator.pipeline;

import com.autofix.orchestrator.agent.Agent;
import com.autofix.orchestrator.agent.AgentContext;
import com.autofix.orchestrator.config.AutofixProperties.Timeouts;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.AgentStatus;
import com.autofix.orchestrator.model.Issue;
import com.autofix.orchestrator.model.PipelineState;
import com.autofix.orchestrator.model.PipelineStatus;
import com.autofix.orchestrator.model.ReviewVerdict;
import com.autofix.orchestrator.store.RunDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one issue through triage, research and the bounded fix-review loop.
 *
 * <pre>
 *   RUNNING ──triage──research──┬─fix──review─┬─APPROVE──────────▶ SUCCESS
 *                               │             ├─REQUEST_CHANGES──▶ next round (revision)
 *                               │             └─BLOCK────────────▶ BLOCKED
 *                               └─ after maxIterations rounds of REQUEST_CHANGES ▶ BLOCKED
 * </pre>
 * A FAILED stage fails the run. A skipped triage or a first fix that changed
 * nothing skips it. A revision that applied nothing blocks it.
 *
 * This class is the only place stage outcomes become a pipeline status. After
 * every transition the full {@link PipelineState} is written to the run
 * directory before anything else happens, and nothing is written once the
 * state is terminal.
 *
 * Two views of stage results are kept apart: {@link #agentStates()} is the
 * latest state per role used for decisions (a revision replaces the previous
 * fix), while {@link #history()} is an append-only record of every invocation.
 *
 * Single-use and single-threaded: call {@link #run()} once.
 */
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private final StageAgents      agents;
    private final PipelineSettings settings;
    private final RunDirectory     run;
    private final Issue            issue;
    private final Path             workDir;
    private final Timeouts         timeouts;
    private final Clock            clock;
    private final MeterRegistry    meterRegistry;

    private final Map<AgentRole, AgentState> latest  = new EnumMap<>(AgentRole.class);
    private final List<AgentState>           history = new ArrayList<>();

    private PipelineState state;
    private int           iterations;

    public PipelineStateMachine(StageAgents agents, PipelineSettings settings, RunDirectory run,
                                Issue issue, Path workDir, Timeouts timeouts,
                                Clock clock, MeterRegistry meterRegistry) {
        this.agents        = agents;
        this.settings      = settings;
        this.run           = run;
        this.issue         = issue;
        this.workDir       = workDir;
        this.timeouts      = timeouts;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run the pipeline to a terminal status.
     *
     * @throws IllegalStateException if called twice
     * @throws com.autofix.orchestrator.store.StateStoreException if a snapshot cannot be written
     */
    public PipelineState run() {
        if (state != null) {
            throw new IllegalStateException("Pipeline for issue #" + issue.number() + " already ran");
        }
        state = new PipelineState(issue.number(), clock.instant());

        MDC.put("issue", String.valueOf(issue.number()));
        try {
            log.info("Starting pipeline for issue #{}: {}", issue.number(), issue.title());
            checkpoint();
            drive();

            meterRegistry.counter("autofix.pipeline.runs", "status", state.getStatus().name()).increment();
            logSummary();
            return state;
        } finally {
            MDC.remove("stage");
            MDC.remove("issue");
        }
    }

    /** Latest state per role; a fix revision replaces the earlier fix. */
    public Map<AgentRole, AgentState> agentStates() {
        return Collections.unmodifiableMap(latest);
    }

    /** Every invocation in execution order, including superseded fixes and reviews. */
    public List<AgentState> history() {
        return Collections.unmodifiableList(history);
    }

    /** Fix-review rounds started. */
    public int iterations() {
        return iterations;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    private void drive() {
        AgentState triage = runStage(agents.triage(), "triage", 1);
        switch (triage.status()) {
            case FAILED -> {
                fail("triage", "Triage failed: " + triage.error());
                return;
            }
            case SKIPPED -> {
                state.recordStage("triage:skipped");
                finish(PipelineStatus.SKIPPED, triage.text("classification", "NOT_FIXABLE"));
                return;
            }
            case SUCCESS -> state.recordStage("triage");
        }
        checkpoint();

        AgentState research = runStage(agents.research(), "research", 1);
        if (research.status() == AgentStatus.FAILED) {
            fail("research", "Research failed: " + research.error());
            return;
        }
        state.recordStage("research");
        checkpoint();

        for (int iteration = 1; iteration <= settings.maxIterations(); iteration++) {
            iterations = iteration;
            boolean revision  = iteration > 1;
            String  fixLabel  = revision ? "fix-revision-" + iteration : "fix";
            Agent   fixAgent  = revision ? agents.fixRevision() : agents.fix();

            AgentState fix = runStage(fixAgent, fixLabel, iteration);
            if (fix.status() == AgentStatus.FAILED) {
                fail(fixLabel, (revision ? "Fix revision " + iteration : "Fix") + " failed: " + fix.error());
                return;
            }
            if (fix.status() == AgentStatus.SKIPPED) {
                state.recordStage(fixLabel + ":skipped");
                if (revision) {
                    finish(PipelineStatus.BLOCKED, "Fix revision " + iteration + " applied no changes");
                } else {
                    finish(PipelineStatus.SKIPPED, "Fix made no changes");
                }
                return;
            }
            state.recordStage(fixLabel);
            checkpoint();

            // review-N names the round's artifacts; the completed-stages log always says "review"
            String     reviewLabel = revision ? "review-" + iteration : "review";
            AgentState review      = runStage(agents.review(), reviewLabel, iteration);
            if (review.status() == AgentStatus.FAILED) {
                fail("review", "Review failed: " + review.error());
                return;
            }
            if (review.status() == AgentStatus.SUCCESS) {
                state.recordStage("review");
                succeed();
                return;
            }

            state.recordStage("review:skipped");
            ReviewVerdict verdict = ReviewVerdict.parse(review.text("verdict", null))
                    .orElse(ReviewVerdict.REQUEST_CHANGES);
            if (verdict == ReviewVerdict.BLOCK) {
                finish(PipelineStatus.BLOCKED, "Review blocked the fix: " + review.text("summary", ""));
                return;
            }
            if (iteration == settings.maxIterations()) {
                finish(PipelineStatus.BLOCKED,
                        "Review still requested changes after " + iteration + " iterations");
                return;
            }
            log.info("Review requested changes, starting revision {}", iteration + 1);
            checkpoint();
        }
    }

    private AgentState runStage(Agent agent, String label, int iteration) {
        MDC.put("stage", label);
        try {
            state.setCurrentAgent(label);
            checkpoint();

            log.info("Stage {} starting", label);
            AgentContext ctx = new AgentContext(issue, latest, run, workDir, timeouts, label, iteration);

            Timer.Sample sample = Timer.start(meterRegistry);
            AgentState result;
            try {
                result = agent.execute(ctx);
            } finally {
                sample.stop(meterRegistry.timer("autofix.stage.duration", "stage", agent.role().key()));
            }
            meterRegistry.counter("autofix.stage.outcomes",
                    "stage", agent.role().key(),
                    "status", result.status().name()).increment();

            latest.put(agent.role(), result);
            history.add(result);
            state.putAgentState(agent.role().key(), result);
            run.writeAgentState(label, result);

            switch (result.status()) {
                case SUCCESS -> log.info("Stage {} completed (confidence: {})", label, result.confidence());
                case SKIPPED -> log.warn("Stage {} skipped", label);
                case FAILED  -> log.error("Stage {} failed: {}", label, result.error());
            }
            return result;
        } finally {
            MDC.remove("stage");
        }
    }

    private void succeed() {
        Map<AgentRole, Double> confidences = new EnumMap<>(AgentRole.class);
        latest.forEach((role, agentState) -> confidences.put(role, agentState.confidence()));
        ConfidenceWeights.Aggregate aggregate = settings.weights().aggregate(confidences);

        state.succeed(aggregate.value(), aggregate.breakdown(), clock.instant());
        checkpoint();
    }

    private void fail(String label, String reason) {
        state.recordStage(label + ":failed");
        finish(PipelineStatus.FAILED, reason);
    }

    private void finish(PipelineStatus terminal, String reason) {
        state.finish(terminal, reason, clock.instant());
        checkpoint();
    }

    private void checkpoint() {
        run.writePipelineState(state);
    }

    private void logSummary() {
        String rounds = iterations > 1 ? " after " + iterations + " iterations" : "";
        if (state.getStatus() == PipelineStatus.SUCCESS) {
            log.info("Pipeline SUCCESS{} (confidence: {}, duration: {}s)",
                    rounds, state.getAggregateConfidence(), state.getDurationSeconds());
        } else {
            log.warn("Pipeline {}{}: {} (duration: {}s)",
                    state.getStatus(), rounds, state.getFailureReason(), state.getDurationSeconds());
        }
    }
}
