package com.autofix.orchestrator.pipeline;

import com.autofix.orchestrator.agent.Agent;
import com.autofix.orchestrator.agent.AgentContext;
import com.autofix.orchestrator.claude.ClaudeResult;
import com.autofix.orchestrator.claude.ClaudeRunner;
import com.autofix.orchestrator.config.TestProperties;
import com.autofix.orchestrator.executor.CommandExecutor;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.AgentStatus;
import com.autofix.orchestrator.model.Issue;
import com.autofix.orchestrator.model.PipelineState;
import com.autofix.orchestrator.model.PipelineStatus;
import com.autofix.orchestrator.store.RunDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * State machine driven by scripted agents: each fake returns the next
 * scripted outcome without starting any process.
 */
class PipelineStateMachineTest {

    private static final Instant T0    = Instant.parse("2025-06-01T10:00:00Z");
    private static final Clock   CLOCK = Clock.fixed(T0, ZoneOffset.UTC);
    private static final Issue   ISSUE = new Issue(7, "Broken save", "body", List.of(), "");

    @TempDir Path dir;

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();

    // ------------------------------------------------------------------
    // Fakes
    // ------------------------------------------------------------------

    /** Returns an empty successful CLI run; the scripted agent ignores the output anyway. */
    static class SilentClaude extends ClaudeRunner {
        SilentClaude() {
            super(new CommandExecutor(), new ObjectMapper(), TestProperties.defaults());
        }

        @Override
        public ClaudeResult run(String prompt, Path workDir, Duration timeout, Path logFile) {
            return new ClaudeResult(true, "", "", 0, 0.0);
        }
    }

    record Step(AgentStatus status, double confidence, Map<String, Object> data) {}

    static Step ok(double confidence)                  { return new Step(AgentStatus.SUCCESS, confidence, Map.of()); }
    static Step ok(double confidence, Map<String, Object> data) { return new Step(AgentStatus.SUCCESS, confidence, data); }
    static Step skipped(Map<String, Object> data)      { return new Step(AgentStatus.SKIPPED, 0.5, data); }
    static Step failed()                               { return new Step(AgentStatus.FAILED, 0.0, Map.of()); }

    static Step requestChanges() { return skipped(Map.of("verdict", "REQUEST_CHANGES", "summary", "needs work")); }
    static Step block()          { return skipped(Map.of("verdict", "BLOCK", "summary", "wrong approach")); }

    static class ScriptedAgent extends Agent {
        private final AgentRole          role;
        private final Deque<Step>        script;
        private final List<AgentContext> calls = new ArrayList<>();

        ScriptedAgent(AgentRole role, Step... steps) {
            super(new SilentClaude(), null, CLOCK);
            this.role   = role;
            this.script = new ArrayDeque<>(List.of(steps));
        }

        int calls() {
            return calls.size();
        }

        List<AgentContext> contexts() {
            return calls;
        }

        @Override
        public AgentRole role() {
            return role;
        }

        @Override
        protected List<String> requiredFields() {
            return List.of("anything");
        }

        @Override
        protected String buildPrompt(AgentContext ctx) {
            calls.add(ctx);
            return "prompt for " + ctx.label();
        }

        @Override
        protected Outcome interpret(Optional<Map<String, Object>> payload, AgentContext ctx) {
            if (script.isEmpty()) {
                throw new AssertionError(role + " called more often than scripted");
            }
            Step step = script.pop();
            return switch (step.status()) {
                case SUCCESS -> Outcome.success(step.confidence(), step.data());
                case SKIPPED -> Outcome.skipped(step.confidence(), step.data());
                case FAILED  -> Outcome.failed("scripted failure", step.data());
            };
        }
    }

    /** Records every pipeline snapshot as (status, completedAt) at write time. */
    static class RecordingRunDirectory extends RunDirectory {
        record Snapshot(PipelineStatus status, Instant completedAt, List<String> stages) {}

        final List<Snapshot> snapshots = new ArrayList<>();

        RecordingRunDirectory(Path dir) {
            super(dir, new ObjectMapper());
        }

        @Override
        public void writePipelineState(PipelineState state) {
            snapshots.add(new Snapshot(state.getStatus(), state.getCompletedAt(), List.copyOf(state.getAgentsCompleted())));
            super.writePipelineState(state);
        }
    }

    private ScriptedAgent triage      = new ScriptedAgent(AgentRole.TRIAGE, ok(0.9, Map.of("classification", "FIXABLE_CODE")));
    private ScriptedAgent research    = new ScriptedAgent(AgentRole.RESEARCH, ok(0.8));
    private ScriptedAgent fix         = new ScriptedAgent(AgentRole.FIX, ok(0.7, Map.of("files_changed", List.of("a.py"))));
    private ScriptedAgent fixRevision = new ScriptedAgent(AgentRole.FIX);
    private ScriptedAgent review      = new ScriptedAgent(AgentRole.REVIEW, ok(0.85, Map.of("verdict", "APPROVE")));

    private RecordingRunDirectory run;

    private PipelineStateMachine machine(int maxIterations) {
        run = new RecordingRunDirectory(dir);
        return new PipelineStateMachine(
                new StageAgents(triage, research, fix, fixRevision, review),
                new PipelineSettings(maxIterations, ConfidenceWeights.DEFAULT),
                run, ISSUE, dir, TestProperties.defaults().timeouts(), CLOCK, meters);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void allStagesSucceed_successWithAggregateConfidence() {
        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.SUCCESS);
        assertThat(state.getAggregateConfidence()).isEqualTo(0.79);
        assertThat(state.getConfidenceBreakdown()).containsEntry("fix", 0.7).containsEntry("review", 0.85);
        assertThat(state.getAgentsCompleted()).containsExactly("triage", "research", "fix", "review");
        assertThat(state.getCompletedAt()).isNotNull();
        assertThat(state.getFailureReason()).isNull();
        assertThat(run.stateFile("triage")).exists();
        assertThat(run.stateFile("review")).exists();
        assertThat(run.pipelineStateFile()).exists();
        assertThat(run.pipelineStateFile()).content().contains("\"agent_states\"");
    }

    @Test
    void metrics_recordStageOutcomesAndRunStatus() {
        machine(3).run();

        assertThat(meters.counter("autofix.pipeline.runs", "status", "SUCCESS").count()).isEqualTo(1.0);
        assertThat(meters.counter("autofix.stage.outcomes", "stage", "fix", "status", "SUCCESS").count()).isEqualTo(1.0);
        assertThat(meters.timer("autofix.stage.duration", "stage", "review").count()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Early exits
    // ------------------------------------------------------------------

    @Test
    void triageSkipped_pipelineSkippedWithClassification() {
        triage = new ScriptedAgent(AgentRole.TRIAGE, skipped(Map.of("classification", "NEEDS_HUMAN")));

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.SKIPPED);
        assertThat(state.getFailureReason()).isEqualTo("NEEDS_HUMAN");
        assertThat(state.getAgentsCompleted()).containsExactly("triage:skipped");
        assertThat(state.getAggregateConfidence()).isNull();
        assertThat(research.calls()).isZero();
    }

    @Test
    void triageFailed_pipelineFailed() {
        triage = new ScriptedAgent(AgentRole.TRIAGE, failed());

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(state.getFailureReason()).isEqualTo("Triage failed: scripted failure");
        assertThat(state.getAgentsCompleted()).containsExactly("triage:failed");
    }

    @Test
    void researchFailed_pipelineFailedBeforeFix() {
        research = new ScriptedAgent(AgentRole.RESEARCH, failed());

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(state.getAgentsCompleted()).containsExactly("triage", "research:failed");
        assertThat(fix.calls()).isZero();
    }

    @Test
    void fixChangedNothing_skippedWithoutReview() {
        fix = new ScriptedAgent(AgentRole.FIX, skipped(Map.of("files_changed", List.of())));

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.SKIPPED);
        assertThat(state.getFailureReason()).isEqualTo("Fix made no changes");
        assertThat(state.getAgentsCompleted()).containsExactly("triage", "research", "fix:skipped");
        assertThat(review.calls()).isZero();
    }

    @Test
    void fixFailed_pipelineFailed() {
        fix = new ScriptedAgent(AgentRole.FIX, failed());

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(state.getAgentsCompleted()).last().isEqualTo("fix:failed");
        assertThat(review.calls()).isZero();
    }

    @Test
    void reviewFailed_pipelineFailed() {
        review = new ScriptedAgent(AgentRole.REVIEW, failed());

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(state.getFailureReason()).startsWith("Review failed");
        assertThat(fixRevision.calls()).isZero();
    }

    // ------------------------------------------------------------------
    // Fix-review loop
    // ------------------------------------------------------------------

    @Test
    void blockOnFirstReview_blockedWithoutRevision() {
        review = new ScriptedAgent(AgentRole.REVIEW, block());

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.BLOCKED);
        assertThat(state.getFailureReason()).contains("wrong approach");
        assertThat(fix.calls()).isEqualTo(1);
        assertThat(fixRevision.calls()).isZero();
        assertThat(review.calls()).isEqualTo(1);
    }

    @Test
    void reviewAlwaysRequestsChanges_blockedAfterExactlyTheBound() {
        fixRevision = new ScriptedAgent(AgentRole.FIX,
                ok(0.75, Map.of("files_changed", List.of("b.py"))),
                ok(0.8, Map.of("files_changed", List.of("c.py"))));
        review = new ScriptedAgent(AgentRole.REVIEW, requestChanges(), requestChanges(), requestChanges());

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.BLOCKED);
        assertThat(state.getFailureReason()).contains("after 3 iterations");
        assertThat(fix.calls() + fixRevision.calls()).isEqualTo(3);
        assertThat(review.calls()).isEqualTo(3);
        assertThat(state.getAgentsCompleted()).containsExactly(
                "triage", "research",
                "fix", "review:skipped",
                "fix-revision-2", "review:skipped",
                "fix-revision-3", "review:skipped");
        assertThat(run.stateFile("fix-revision-2")).exists();
        assertThat(run.stateFile("fix-revision-3")).exists();
    }

    @Test
    void customBoundOfOne_blockedAfterFirstRequestForChanges() {
        review = new ScriptedAgent(AgentRole.REVIEW, requestChanges());

        PipelineState state = machine(1).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.BLOCKED);
        assertThat(fixRevision.calls()).isZero();
    }

    @Test
    void approvedOnSecondRound_successUsingLatestFixConfidence() {
        fixRevision = new ScriptedAgent(AgentRole.FIX, ok(0.9, Map.of("files_changed", List.of("b.py"))));
        review = new ScriptedAgent(AgentRole.REVIEW, requestChanges(), ok(1.0, Map.of("verdict", "APPROVE")));

        PipelineStateMachine machine = machine(3);
        PipelineState state = machine.run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.SUCCESS);
        assertThat(state.getConfidenceBreakdown()).containsEntry("fix", 0.9);
        // 0.15*0.9 + 0.20*0.8 + 0.35*0.9 + 0.30*1.0 = 0.91
        assertThat(state.getAggregateConfidence()).isEqualTo(0.91);
        assertThat(machine.iterations()).isEqualTo(2);
        assertThat(machine.agentStates().get(AgentRole.FIX).agent()).isEqualTo("fix-revision-2");
        assertThat(state.getAgentStates()).containsOnlyKeys("triage", "research", "fix", "review");
        assertThat(state.getAgentStates().get("fix").agent()).isEqualTo("fix-revision-2");
        assertThat(state.getAgentStates().get("review").agent()).isEqualTo("review-2");
        assertThat(machine.history()).extracting(AgentState::agent).containsExactly(
                "triage", "research", "fix", "review", "fix-revision-2", "review-2");
        assertThat(state.getAgentsCompleted()).containsExactly(
                "triage", "research", "fix", "review:skipped", "fix-revision-2", "review");
        assertThat(run.stateFile("review-2")).exists();
    }

    @Test
    void reviewFailsInLaterRound_markerUsesPlainStageName() {
        fixRevision = new ScriptedAgent(AgentRole.FIX, ok(0.9, Map.of("files_changed", List.of("b.py"))));
        review = new ScriptedAgent(AgentRole.REVIEW, requestChanges(), failed());

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(state.getAgentsCompleted()).containsExactly(
                "triage", "research", "fix", "review:skipped", "fix-revision-2", "review:failed");
        assertThat(run.stateFile("review-2")).exists();
    }

    @Test
    void revisionSeesPreviousReviewAndFix() {
        fixRevision = new ScriptedAgent(AgentRole.FIX, ok(0.9, Map.of("files_changed", List.of("b.py"))));
        review = new ScriptedAgent(AgentRole.REVIEW, requestChanges(), ok(1.0, Map.of("verdict", "APPROVE")));

        machine(3).run();

        AgentContext ctx = fixRevision.contexts().get(0);
        assertThat(ctx.iteration()).isEqualTo(2);
        assertThat(ctx.label()).isEqualTo("fix-revision-2");
        assertThat(ctx.previous(AgentRole.REVIEW)).hasValueSatisfying(
                s -> assertThat(s.data()).containsEntry("verdict", "REQUEST_CHANGES"));
        assertThat(ctx.previous(AgentRole.FIX)).hasValueSatisfying(s -> assertThat(s.agent()).isEqualTo("fix"));
    }

    @Test
    void revisionAppliedNothing_blocked() {
        fixRevision = new ScriptedAgent(AgentRole.FIX,
                skipped(Map.of("files_changed", List.of(), "fix_applied", false)));
        review = new ScriptedAgent(AgentRole.REVIEW, requestChanges());

        PipelineState state = machine(3).run();

        assertThat(state.getStatus()).isEqualTo(PipelineStatus.BLOCKED);
        assertThat(state.getFailureReason()).isEqualTo("Fix revision 2 applied no changes");
        assertThat(state.getAgentsCompleted()).last().isEqualTo("fix-revision-2:skipped");
        assertThat(review.calls()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    @Test
    void snapshots_areMonotonicWithExactlyOneTerminalWriteAtTheEnd() {
        fixRevision = new ScriptedAgent(AgentRole.FIX, ok(0.9, Map.of("files_changed", List.of("b.py"))));
        review = new ScriptedAgent(AgentRole.REVIEW, requestChanges(), requestChanges());

        machine(2).run();

        List<RecordingRunDirectory.Snapshot> snapshots = run.snapshots;
        assertThat(snapshots).hasSizeGreaterThan(2);
        RecordingRunDirectory.Snapshot last = snapshots.get(snapshots.size() - 1);
        assertThat(last.status()).isEqualTo(PipelineStatus.BLOCKED);
        assertThat(last.completedAt()).isNotNull();
        assertThat(snapshots.subList(0, snapshots.size() - 1)).allSatisfy(s -> {
            assertThat(s.status()).isEqualTo(PipelineStatus.RUNNING);
            assertThat(s.completedAt()).isNull();
        });
        for (int i = 1; i < snapshots.size(); i++) {
            List<String> before = snapshots.get(i - 1).stages();
            List<String> after  = snapshots.get(i).stages();
            assertThat(after).hasSizeGreaterThanOrEqualTo(before.size());
            assertThat(after.subList(0, before.size())).isEqualTo(before);
        }
    }

    @Test
    void run_twice_rejected() {
        PipelineStateMachine machine = machine(3);
        machine.run();

        assertThatThrownBy(machine::run).isInstanceOf(IllegalStateException.class);
    }
}
