package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.claude.ClaudeRunner;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * First attempt at the code change, driven by the research findings.
 * SKIPPED means the agent ran but changed nothing.
 */
@Component
public class FixAgent extends Agent {

    static final double DEFAULT_CONFIDENCE = 0.5;

    static final List<String> FIX_FIELDS = List.of("fix_applied", "files_modified", "files_changed");

    public FixAgent(ClaudeRunner claude, PromptTemplates prompts, Clock clock) {
        super(claude, prompts, clock);
    }

    @Override
    public AgentRole role() {
        return AgentRole.FIX;
    }

    @Override
    protected List<String> requiredFields() {
        return FIX_FIELDS;
    }

    @Override
    protected Optional<String> unmetPrecondition(AgentContext ctx) {
        return ResearchAgent.completed(ctx) ? Optional.empty() : Optional.of("Research not completed");
    }

    @Override
    protected String buildPrompt(AgentContext ctx) {
        AgentState research = ctx.previous(AgentRole.RESEARCH).orElseThrow();
        Map<String, String> values = issueValues(ctx.issue());
        values.put("RESEARCH_SUMMARY", PromptSections.research(research)
                + "\nFull research:\n```json\n" + toJson(research.data().get("full_analysis")) + "\n```\n");
        return prompts.render("fix", values);
    }

    @Override
    protected Outcome interpret(Optional<Map<String, Object>> payload, AgentContext ctx) {
        Map<String, Object> raw = payload.orElseGet(() -> {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("confidence", DEFAULT_CONFIDENCE);
            fallback.put("summary", "Fix completed but no structured output");
            return fallback;
        });

        double       confidence = PayloadNormalizer.confidence(raw, DEFAULT_CONFIDENCE);
        List<String> files      = PayloadNormalizer.changedFiles(raw);
        log.info("Fix complete (confidence: {}), files changed: {}", confidence, files.size());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("confidence", confidence);
        data.put("files_changed", files);
        if (files.isEmpty()) {
            log.warn("No files were changed");
            data.put("summary", "No changes made");
            data.put("tests_added", List.of());
            return Outcome.skipped(confidence, data);
        }
        data.put("summary", PayloadNormalizer.text(raw.get("summary")));
        data.put("tests_added", PayloadNormalizer.textList(raw.get("tests_added")));
        data.put("caveats", PayloadNormalizer.textList(raw.get("caveats")));
        data.put("testing_notes", PayloadNormalizer.textList(raw.get("testing_notes")));
        data.put("full_result", raw);
        return Outcome.success(confidence, data);
    }
}
