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
 * Locates the root cause and proposes a fix. Never skips: the stage either
 * produces findings (possibly the low-confidence default) or fails.
 */
@Component
public class ResearchAgent extends Agent {

    static final double DEFAULT_CONFIDENCE = 0.3;
    static final double LOW_CONFIDENCE     = 0.4;

    public ResearchAgent(ClaudeRunner claude, PromptTemplates prompts, Clock clock) {
        super(claude, prompts, clock);
    }

    @Override
    public AgentRole role() {
        return AgentRole.RESEARCH;
    }

    @Override
    protected List<String> requiredFields() {
        return List.of("root_cause", "proposed_fix", "files_analyzed");
    }

    @Override
    protected String buildPrompt(AgentContext ctx) {
        Map<String, String> values = issueValues(ctx.issue());
        values.put("TRIAGE_SUMMARY", ctx.previous(AgentRole.TRIAGE)
                .map(PromptSections::triage)
                .orElse("(no triage available)"));
        return prompts.render("research", values);
    }

    @Override
    protected Outcome interpret(Optional<Map<String, Object>> payload, AgentContext ctx) {
        Map<String, Object> raw = payload.orElseGet(ResearchAgent::defaultPayload);
        double confidence = PayloadNormalizer.confidence(raw, DEFAULT_CONFIDENCE);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("confidence", confidence);
        data.put("root_cause", PayloadNormalizer.text(raw.get("root_cause")));
        data.put("proposed_fix", PayloadNormalizer.text(raw.get("proposed_fix")));
        data.put("files_analyzed", PayloadNormalizer.textList(raw.get("files_analyzed")));
        data.put("affected_areas", PayloadNormalizer.textList(raw.get("affected_areas")));
        data.put("test_strategy", PayloadNormalizer.text(raw.get("test_strategy")));
        data.put("patterns_to_follow", PayloadNormalizer.textList(raw.get("patterns_to_follow")));
        data.put("summary", PayloadNormalizer.text(raw.get("summary")));
        data.put("full_analysis", raw);

        log.info("Research complete (confidence: {})", confidence);
        if (confidence < LOW_CONFIDENCE) {
            log.warn("Low research confidence ({}) for issue #{}", confidence, ctx.issue().number());
        }
        return Outcome.success(confidence, data);
    }

    private static Map<String, Object> defaultPayload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("confidence", DEFAULT_CONFIDENCE);
        data.put("root_cause", "Could not determine root cause automatically");
        data.put("summary", "Research completed but no structured output");
        return data;
    }

    static boolean completed(AgentContext ctx) {
        return ctx.previous(AgentRole.RESEARCH).filter(AgentState::isSuccess).isPresent();
    }
}
