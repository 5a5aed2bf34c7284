package com.autofix.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Value-type rules of the model package.
 */
class ModelTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void agentState_confidenceOutOfRange_rejected() {
        assertThatThrownBy(() -> AgentState.success("fix", 1.2, Map.of(), T0, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void agentState_dataIsACopy() {
        Map<String, Object> data = new HashMap<>();
        data.put("summary", "before");
        AgentState state = AgentState.success("fix", 0.5, data, T0, T0);
        data.put("summary", "after");

        assertThat(state.text("summary", "")).isEqualTo("before");
        assertThatThrownBy(() -> state.data().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void agentState_failedHasZeroConfidenceAndError() {
        AgentState state = AgentState.failed("fix", "Claude timed out after 900s", Map.of(), T0, T0);

        assertThat(state.status()).isEqualTo(AgentStatus.FAILED);
        assertThat(state.confidence()).isZero();
        assertThat(state.error()).contains("timed out");
        assertThat(state.isSuccess()).isFalse();
    }

    @Test
    void agentState_textList_rendersListValues() {
        AgentState state = AgentState.success("review", 0.5,
                Map.of("concerns", List.of("a", "b"), "summary", "s"), T0, T0);

        assertThat(state.textList("concerns")).containsExactly("a", "b");
        assertThat(state.textList("summary")).isEmpty();
        assertThat(state.text("missing", "dflt")).isEqualTo("dflt");
    }

    @Test
    void reviewVerdict_parsesAliases() {
        assertThat(ReviewVerdict.parse("approved")).contains(ReviewVerdict.APPROVE);
        assertThat(ReviewVerdict.parse("changes requested")).contains(ReviewVerdict.REQUEST_CHANGES);
        assertThat(ReviewVerdict.parse("Request-Changes")).contains(ReviewVerdict.REQUEST_CHANGES);
        assertThat(ReviewVerdict.parse("BLOCKED")).contains(ReviewVerdict.BLOCK);
        assertThat(ReviewVerdict.parse("maybe")).isEmpty();
        assertThat(ReviewVerdict.parse(null)).isEmpty();
    }

    @Test
    void triageClassification_unknownDefaultsToNeedsClarification() {
        assertThat(TriageClassification.parse("fixable_code")).isEqualTo(TriageClassification.FIXABLE_CODE);
        assertThat(TriageClassification.parse("banana")).isEqualTo(TriageClassification.NEEDS_CLARIFICATION);
        assertThat(TriageClassification.FIXABLE_CONFIG.isFixable()).isTrue();
        assertThat(TriageClassification.DUPLICATE.isFixable()).isFalse();
    }

    @Test
    void issue_nullsBecomeEmpty() {
        Issue issue = new Issue(1, "t", null, null, null);

        assertThat(issue.body()).isEmpty();
        assertThat(issue.labels()).isEmpty();
        assertThat(issue.url()).isEmpty();
    }
}
