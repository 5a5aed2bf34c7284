package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.claude.ClaudeRunner;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.ReviewVerdict;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reviews the current change set.
 *
 * SUCCESS means APPROVE. REQUEST_CHANGES and BLOCK both come back SKIPPED and
 * are told apart by the {@code verdict} field. Unlike the other stages there is
 * no default payload: without an extractable verdict the stage FAILS.
 */
@Component
public class ReviewAgent extends Agent {

    static final double DEFAULT_CONFIDENCE = 0.5;

    public ReviewAgent(ClaudeRunner claude, PromptTemplates prompts, Clock clock) {
        super(claude, prompts, clock);
    }

    @Override
    public AgentRole role() {
        return AgentRole.REVIEW;
    }

    @Override
    protected List<String> requiredFields() {
        return List.of("verdict", "approved");
    }

    @Override
    protected Optional<String> unmetPrecondition(AgentContext ctx) {
        boolean fixed = ctx.previous(AgentRole.FIX).filter(AgentState::isSuccess).isPresent();
        return fixed ? Optional.empty() : Optional.of("No successful fix to review");
    }

    @Override
    protected String buildPrompt(AgentContext ctx) {
        AgentState fix = ctx.previous(AgentRole.FIX).orElseThrow();

        Map<String, String> values = issueValues(ctx.issue());
        values.put("ITERATION", String.valueOf(ctx.iteration()));
        values.put("RESEARCH_SUMMARY", ctx.previous(AgentRole.RESEARCH)
                .map(PromptSections::research)
                .orElse("(no research available)"));
        values.put("FIX_SUMMARY", PromptSections.fix(fix));
        values.put("FILES_CHANGED", bullets(PromptSections.filesOf(fix)));
        return prompts.render("review", values);
    }

    @Override
    protected Outcome interpret(Optional<Map<String, Object>> payload, AgentContext ctx) {
        if (payload.isEmpty()) {
            return Outcome.failed("Could not extract review verdict", Map.of());
        }
        Map<String, Object> raw = payload.get();

        Optional<ReviewVerdict> verdict = ReviewVerdict.parse(PayloadNormalizer.text(raw.get("verdict")))
                .or(() -> inferFromApproved(raw));
        if (verdict.isEmpty()) {
            return Outcome.failed("Review output has neither a recognizable verdict nor an approved flag",
                    Map.of("full_review", raw));
        }

        double confidence = PayloadNormalizer.confidence(raw, DEFAULT_CONFIDENCE);
        boolean approved  = verdict.get() == ReviewVerdict.APPROVE;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("verdict", verdict.get().name());
        data.put("approved", approved);
        data.put("confidence", confidence);
        data.put("concerns", PayloadNormalizer.textList(raw.get("concerns")));
        data.put("suggestions", PayloadNormalizer.textList(raw.get("suggestions")));
        data.put("summary", PayloadNormalizer.text(raw.get("summary")));
        data.put("full_review", raw);

        log.info("Review verdict: {} (confidence: {})", verdict.get(), confidence);
        return approved ? Outcome.success(confidence, data) : Outcome.skipped(confidence, data);
    }

    private static Optional<ReviewVerdict> inferFromApproved(Map<String, Object> raw) {
        Boolean approved = PayloadNormalizer.flag(raw.get("approved"));
        if (approved == null) {
            return Optional.empty();
        }
        return Optional.of(approved ? ReviewVerdict.APPROVE : ReviewVerdict.REQUEST_CHANGES);
    }
}
