package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.claude.ClaudeRunner;
import com.autofix.orchestrator.config.AutofixProperties;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.TriageClassification;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether an issue is something the pipeline should attempt.
 *
 * SKIPPED carries the classification in the payload; SUCCESS means the issue
 * is fixable and the agent was confident enough.
 */
@Component
public class TriageAgent extends Agent {

    static final double DEFAULT_CONFIDENCE = 0.3;

    private final double minConfidence;

    public TriageAgent(ClaudeRunner claude, PromptTemplates prompts, Clock clock, AutofixProperties properties) {
        super(claude, prompts, clock);
        this.minConfidence = properties.pipeline().minTriageConfidence();
    }

    @Override
    public AgentRole role() {
        return AgentRole.TRIAGE;
    }

    @Override
    protected List<String> requiredFields() {
        return List.of("classification");
    }

    @Override
    protected String buildPrompt(AgentContext ctx) {
        return prompts.render("triage", issueValues(ctx.issue()));
    }

    @Override
    protected Outcome interpret(Optional<Map<String, Object>> payload, AgentContext ctx) {
        Map<String, Object> raw = payload.orElseGet(TriageAgent::defaultPayload);

        TriageClassification classification =
                TriageClassification.parse(PayloadNormalizer.text(raw.get("classification")));
        double  confidence = PayloadNormalizer.confidence(raw, DEFAULT_CONFIDENCE);
        boolean proceed    = classification.isFixable() && confidence >= minConfidence;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("classification", classification.name());
        data.put("confidence", confidence);
        data.put("should_proceed", proceed);
        data.put("summary", PayloadNormalizer.text(raw.get("summary")));
        data.put("complexity", PayloadNormalizer.text(raw.get("complexity")));
        data.put("reasoning", PayloadNormalizer.text(raw.get("reasoning")));
        data.put("risks", PayloadNormalizer.textList(raw.get("risks")));
        data.put("suggested_approach", PayloadNormalizer.text(raw.get("suggested_approach")));
        data.put("questions", PayloadNormalizer.textList(
                raw.containsKey("questions_if_unclear") ? raw.get("questions_if_unclear") : raw.get("questions")));
        data.put("full_analysis", raw);

        log.info("Classification: {} (confidence: {})", classification, confidence);
        if (!proceed) {
            log.warn("Issue #{} will not be attempted: {} below threshold or not fixable",
                    ctx.issue().number(), classification);
            return Outcome.skipped(confidence, data);
        }
        return Outcome.success(confidence, data);
    }

    private static Map<String, Object> defaultPayload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("classification", TriageClassification.NEEDS_CLARIFICATION.name());
        data.put("confidence", DEFAULT_CONFIDENCE);
        data.put("summary", "Could not parse issue automatically");
        return data;
    }
}
