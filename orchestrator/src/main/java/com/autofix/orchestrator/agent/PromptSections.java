package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.model.AgentState;

import java.util.List;

/**
 * Markdown fragments describing earlier stages, substituted into later prompts.
 */
final class PromptSections {

    private PromptSections() {}

    static String triage(AgentState triage) {
        return """
                **Classification:** %s
                **Complexity:** %s
                **Summary:** %s
                """.formatted(
                triage.text("classification", "unknown"),
                triage.text("complexity", "unknown"),
                triage.text("summary", ""));
    }

    static String research(AgentState research) {
        return """
                ## Research Findings

                **Root Cause:** %s
                **Proposed Fix:** %s
                **Affected Areas:** %s
                **Test Strategy:** %s

                Files to modify:
                %s

                Patterns to follow:
                %s
                """.formatted(
                research.text("root_cause", ""),
                research.text("proposed_fix", ""),
                String.join(", ", research.textList("affected_areas")),
                research.text("test_strategy", ""),
                Agent.bullets(research.textList("files_analyzed")),
                Agent.bullets(research.textList("patterns_to_follow")));
    }

    static String fix(AgentState fix) {
        return """
                **Summary:** %s
                **Confidence:** %s

                Files changed:
                %s

                Tests added:
                %s
                """.formatted(
                fix.text("summary", ""),
                fix.confidence(),
                Agent.bullets(filesOf(fix)),
                Agent.bullets(fix.textList("tests_added")));
    }

    /** Cumulative files of a fix state: a revision's union if present, else its own list. */
    static List<String> filesOf(AgentState fix) {
        List<String> all = fix.textList("all_files_changed");
        return all.isEmpty() ? fix.textList("files_changed") : all;
    }
}
