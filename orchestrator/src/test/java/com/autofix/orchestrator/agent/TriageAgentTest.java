package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.claude.ClaudeResult;
import com.autofix.orchestrator.claude.ClaudeRunner;
import com.autofix.orchestrator.claude.ClaudeRunner.ClaudeTimeoutException;
import com.autofix.orchestrator.config.TestProperties;
import com.autofix.orchestrator.executor.ExecutorException;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.AgentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static com.autofix.orchestrator.agent.AgentFixtures.CLOCK;
import static com.autofix.orchestrator.agent.AgentFixtures.answered;
import static com.autofix.orchestrator.agent.AgentFixtures.answeredJson;
import static com.autofix.orchestrator.agent.AgentFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Triage agent, plus the template-method behavior every agent shares
 * (prompt artifact, timeout and exit-code handling, cost metadata).
 */
@ExtendWith(MockitoExtension.class)
class TriageAgentTest {

    @Mock ClaudeRunner claude;

    @TempDir Path dir;

    TriageAgent agent;

    @BeforeEach
    void setUp() {
        agent = new TriageAgent(claude, new PromptTemplates(dir.resolve("no-overrides")), CLOCK,
                TestProperties.defaults());
    }

    private AgentState execute() {
        return agent.execute(context(dir, Map.of(), "triage", 1));
    }

    @Test
    void fixableAndConfident_succeeds() {
        when(claude.run(anyString(), any(), any(), any())).thenReturn(answeredJson(
                "{\"classification\": \"FIXABLE_CODE\", \"confidence\": 0.9, \"summary\": \"Null check\", \"complexity\": \"low\"}"));

        AgentState state = execute();

        assertThat(state.status()).isEqualTo(AgentStatus.SUCCESS);
        assertThat(state.agent()).isEqualTo("triage");
        assertThat(state.confidence()).isEqualTo(0.9);
        assertThat(state.data()).containsEntry("classification", "FIXABLE_CODE")
                                .containsEntry("should_proceed", true)
                                .containsEntry("complexity", "low");
    }

    @Test
    void fixableButBelowThreshold_skipped() {
        when(claude.run(anyString(), any(), any(), any())).thenReturn(answeredJson(
                "{\"classification\": \"FIXABLE_CONFIG\", \"confidence\": 0.55}"));

        AgentState state = execute();

        assertThat(state.status()).isEqualTo(AgentStatus.SKIPPED);
        assertThat(state.data()).containsEntry("should_proceed", false);
    }

    @Test
    void notFixable_skippedWithClassificationAndQuestions() {
        when(claude.run(anyString(), any(), any(), any())).thenReturn(answeredJson("""
                {"classification": "NEEDS_CLARIFICATION", "confidence": {"overall": 0.95},
                 "questions_if_unclear": ["Which browser?"]}"""));

        AgentState state = execute();

        assertThat(state.status()).isEqualTo(AgentStatus.SKIPPED);
        assertThat(state.confidence()).isEqualTo(0.95);
        assertThat(state.data()).containsEntry("classification", "NEEDS_CLARIFICATION");
        assertThat(state.textList("questions")).containsExactly("Which browser?");
    }

    @Test
    void noStructuredOutput_conservativeDefault() {
        when(claude.run(anyString(), any(), any(), any())).thenReturn(answered("I could not decide."));

        AgentState state = execute();

        assertThat(state.status()).isEqualTo(AgentStatus.SKIPPED);
        assertThat(state.confidence()).isEqualTo(0.3);
        assertThat(state.data()).containsEntry("classification", "NEEDS_CLARIFICATION")
                                .containsEntry("summary", "Could not parse issue automatically");
    }

    // ------------------------------------------------------------------
    // Shared template-method behavior
    // ------------------------------------------------------------------

    @Test
    void execute_writesRenderedPromptAndUsesStageTimeout() throws IOException {
        when(claude.run(anyString(), any(), any(), any())).thenReturn(answered("nothing"));

        execute();

        String prompt = Files.readString(dir.resolve("triage.prompt.md"));
        assertThat(prompt).contains("NPE when saving empty form").contains("#101").doesNotContain("${ISSUE_TITLE}");
        verify(claude).run(eq(prompt), eq(dir), eq(Duration.ofSeconds(180)), eq(dir.resolve("triage.log")));
    }

    @Test
    void execute_copiesDurationAndCostIntoPayload() {
        when(claude.run(anyString(), any(), any(), any())).thenReturn(answeredJson(
                "{\"classification\": \"FIXABLE_CODE\", \"confidence\": 0.9}"));

        AgentState state = execute();

        assertThat(state.data()).containsEntry("duration_ms", 2500L).containsEntry("cost_usd", 0.04);
    }

    @Test
    void execute_timeout_failedWithMessage() {
        when(claude.run(anyString(), any(), any(), any()))
                .thenThrow(new ClaudeTimeoutException(Duration.ofSeconds(180)));

        AgentState state = execute();

        assertThat(state.status()).isEqualTo(AgentStatus.FAILED);
        assertThat(state.error()).isEqualTo("Claude timed out after 180s");
        assertThat(state.confidence()).isZero();
    }

    @Test
    void execute_nonZeroExit_failedWithProcessError() {
        when(claude.run(anyString(), any(), any(), any()))
                .thenReturn(new ClaudeResult(false, "", "overloaded", 0, 0.0));

        AgentState state = execute();

        assertThat(state.status()).isEqualTo(AgentStatus.FAILED);
        assertThat(state.error()).isEqualTo("Claude failed: overloaded");
    }

    @Test
    void execute_launcherError_failed() {
        when(claude.run(anyString(), any(), any(), any()))
                .thenThrow(new ExecutorException("Could not run claude: No such file"));

        assertThat(execute().error()).contains("No such file");
    }
}
