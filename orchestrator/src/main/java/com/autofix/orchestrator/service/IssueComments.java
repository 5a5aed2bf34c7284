package com.autofix.orchestrator.service;

import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.Issue;
import com.autofix.orchestrator.model.PipelineState;
import com.autofix.orchestrator.model.TriageClassification;
import com.autofix.orchestrator.tracker.ChangeRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Markdown bodies for issue comments and change requests.
 */
@Component
public class IssueComments {

    static final int MAX_FILES = 5;
    static final int MAX_NOTES = 3;

    private static final String FOOTER = "\n---\n*Generated by the autofix orchestrator*";

    private final ObjectMapper json;

    public IssueComments(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Success
    // ------------------------------------------------------------------

    public String changeRequestBody(Issue issue, PipelineState state) {
        return """
                ## Summary
                Automated fix for issue #%d

                ## Confidence
                - Aggregate: %s
                - Breakdown:
                ```json
                %s
                ```

                ## Test Plan
                - Review the changes
                - Run tests
                - Verify the fix addresses the issue
                """.formatted(issue.number(), state.getAggregateConfidence(), breakdown(state))
                + FOOTER;
    }

    public String fixCreated(ChangeRequest changeRequest, Map<AgentRole, AgentState> states, double confidence) {
        AgentState fix      = states.get(AgentRole.FIX);
        AgentState research = states.get(AgentRole.RESEARCH);

        List<String> files = fix == null ? List.of() : filesOf(fix);
        String fileList = files.isEmpty()
                ? "See PR"
                : files.stream().limit(MAX_FILES).map(f -> "`" + f + "`").collect(Collectors.joining(", "));

        StringBuilder sb = new StringBuilder();
        sb.append("**Automated Fix Created**\n\n");
        sb.append("**PR:** ").append(changeRequest.url()).append("\n\n");
        sb.append("**Files changed:** ").append(fileList).append('\n');

        String rootCause = research == null ? "" : research.text("root_cause", "");
        if (!rootCause.isBlank()) {
            sb.append("\n**Root cause:** ").append(rootCause).append('\n');
        }
        if (fix != null) {
            appendList(sb, "Caveats", fix.textList("caveats"), MAX_NOTES);
            appendList(sb, "Testing notes", fix.textList("testing_notes"), MAX_NOTES);
        }
        sb.append("\n**Confidence:** ").append(percent(confidence)).append("\n\n");
        sb.append("Please review the PR before merging.\n");
        sb.append(FOOTER);
        return sb.toString();
    }

    public String noCodeChanges(PipelineState state) {
        return "Pipeline completed but no code changes were made.\n\n"
                + "Aggregate confidence: " + state.getAggregateConfidence();
    }

    // ------------------------------------------------------------------
    // Skips
    // ------------------------------------------------------------------

    /** The issue looked fixable but the fix stage changed nothing. */
    public String fixMadeNoChanges(Map<AgentRole, AgentState> states) {
        StringBuilder sb = new StringBuilder();
        sb.append("**Auto-Fix Analysis Complete**\n\n");
        sb.append("The issue was analyzed and deemed fixable, but the fix agent was unable to make any code changes.\n");

        AgentState triage = states.get(AgentRole.TRIAGE);
        if (triage != null && !triage.text("summary", "").isBlank()) {
            sb.append("\n## Triage Analysis\n").append(triage.text("summary", "")).append('\n');
        }
        AgentState research = states.get(AgentRole.RESEARCH);
        if (research != null && !research.text("summary", "").isBlank()) {
            sb.append("\n## Research Findings\n").append(research.text("summary", "")).append('\n');
        }
        sb.append("""

                ## Next Steps
                - A human developer should review this issue
                - The automated analysis above may provide useful context
                - Consider if the issue requires architectural changes beyond simple fixes
                """);
        sb.append(FOOTER);
        return sb.toString();
    }

    /** Triage decided not to attempt the issue. */
    public String notAttempted(AgentState triage) {
        TriageClassification classification = TriageClassification.parse(triage.text("classification", null));
        List<String> questions = triage.textList("questions");

        StringBuilder sb = new StringBuilder();
        sb.append("**Auto-Fix Analysis Complete**\n\n");
        sb.append(intro(classification)).append("\n\n");
        sb.append("**Classification:** `").append(classification.name()).append("`\n");
        sb.append("\n## Analysis Summary\n\n");
        sb.append("**Summary:** ").append(triage.text("summary", "")).append("\n\n");
        sb.append("**Reasoning:** ").append(triage.text("reasoning", "")).append('\n');

        switch (classification) {
            case NEEDS_HUMAN -> {
                appendList(sb, "Risks", triage.textList("risks"), Integer.MAX_VALUE);
                String approach = triage.text("suggested_approach", "");
                if (!approach.isBlank()) {
                    sb.append("\n**Suggested Approach:** ").append(approach).append('\n');
                }
                appendList(sb, "Questions for Clarification", questions, Integer.MAX_VALUE);
            }
            case NEEDS_CLARIFICATION -> appendList(sb, "Please provide clarification on", questions, Integer.MAX_VALUE);
            case OUT_OF_SCOPE -> sb.append("\n**Why this is out of scope:** This issue does not appear to be a bug "
                    + "or configuration issue that can be addressed through code changes. It may be a feature "
                    + "request, documentation issue, or external dependency problem.\n");
            case DUPLICATE -> sb.append("\n**Note:** This issue appears to be a duplicate. Please check for "
                    + "related issues that may already address this problem.\n");
            default -> { }
        }
        sb.append(FOOTER);
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static String intro(TriageClassification classification) {
        return switch (classification) {
            case NEEDS_HUMAN         -> "This issue requires human review due to its complexity or risk level.";
            case NEEDS_CLARIFICATION -> "This issue needs more information before it can be addressed.";
            case OUT_OF_SCOPE        -> "This issue is outside the scope of automated fixes.";
            case DUPLICATE           -> "This issue appears to be a duplicate of an existing issue.";
            default                  -> "This issue was analyzed but cannot be auto-fixed.";
        };
    }

    static String percent(double confidence) {
        return String.format(Locale.ROOT, "%.0f%%", confidence * 100);
    }

    private static List<String> filesOf(AgentState fix) {
        List<String> all = fix.textList("all_files_changed");
        return all.isEmpty() ? fix.textList("files_changed") : all;
    }

    private static void appendList(StringBuilder sb, String title, List<String> items, int limit) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("\n**").append(title).append(":**\n");
        items.stream().limit(limit).forEach(item -> sb.append("- ").append(item).append('\n'));
    }

    private String breakdown(PipelineState state) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(state.getConfidenceBreakdown());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Confidence breakdown is not serializable", e);
        }
    }
}
