package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.claude.ClaudeRunner;
import com.autofix.orchestrator.config.AutofixProperties;
import com.autofix.orchestrator.executor.ExecutorException;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.vcs.VersionControl;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Second and later fix attempts, driven by the last review's feedback.
 *
 * Besides the research findings the prompt carries the review verdict,
 * concerns and suggestions, the files touched so far and the current diff
 * (against HEAD, or against the remote base branch when the work is already
 * committed).
 *
 * SKIPPED only when the agent changed nothing and said so with
 * {@code fix_applied: false}; the state machine treats that as terminal.
 */
@Component
public class FixRevisionAgent extends Agent {

    static final int MAX_DIFF_CHARS = 40_000;

    private final VersionControl vcs;
    private final String         baseRef;

    public FixRevisionAgent(ClaudeRunner claude, PromptTemplates prompts, Clock clock,
                            VersionControl vcs, AutofixProperties properties) {
        super(claude, prompts, clock);
        this.vcs     = vcs;
        this.baseRef = properties.remote() + "/" + properties.baseBranch();
    }

    @Override
    public AgentRole role() {
        return AgentRole.FIX;
    }

    @Override
    protected List<String> requiredFields() {
        return FixAgent.FIX_FIELDS;
    }

    @Override
    protected Optional<String> unmetPrecondition(AgentContext ctx) {
        if (!ResearchAgent.completed(ctx)) {
            return Optional.of("Research not completed");
        }
        if (ctx.previous(AgentRole.REVIEW).isEmpty()) {
            return Optional.of("No review feedback to revise against");
        }
        if (ctx.previous(AgentRole.FIX).isEmpty()) {
            return Optional.of("No previous fix to revise");
        }
        return Optional.empty();
    }

    @Override
    protected String buildPrompt(AgentContext ctx) {
        AgentState research = ctx.previous(AgentRole.RESEARCH).orElseThrow();
        AgentState review   = ctx.previous(AgentRole.REVIEW).orElseThrow();
        AgentState fix      = ctx.previous(AgentRole.FIX).orElseThrow();

        Map<String, String> values = issueValues(ctx.issue());
        values.put("ITERATION", String.valueOf(ctx.iteration()));
        values.put("REVIEW_VERDICT", review.text("verdict", "REQUEST_CHANGES"));
        values.put("REVIEW_CONFIDENCE", String.valueOf(review.confidence()));
        values.put("REVIEW_SUMMARY", review.text("summary", ""));
        values.put("REVIEW_CONCERNS", bullets(review.textList("concerns")));
        values.put("REVIEW_SUGGESTIONS", bullets(review.textList("suggestions")));
        values.put("PREVIOUS_FILES", bullets(PromptSections.filesOf(fix)));
        values.put("CURRENT_DIFF", currentDiff());
        values.put("ROOT_CAUSE", research.text("root_cause", ""));
        values.put("PATTERNS_TO_FOLLOW", bullets(research.textList("patterns_to_follow")));
        values.put("RESEARCH_SUMMARY", PromptSections.research(research));
        return prompts.render("fix-revision", values);
    }

    @Override
    protected Outcome interpret(Optional<Map<String, Object>> payload, AgentContext ctx) {
        Map<String, Object> raw = payload.orElseGet(() -> {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("confidence", FixAgent.DEFAULT_CONFIDENCE);
            fallback.put("summary", "Revision completed but no structured output");
            return fallback;
        });

        double       confidence = PayloadNormalizer.confidence(raw, FixAgent.DEFAULT_CONFIDENCE);
        List<String> files      = PayloadNormalizer.changedFiles(raw);
        Boolean      applied    = PayloadNormalizer.flag(raw.get("fix_applied"));
        List<String> previous   = ctx.previous(AgentRole.FIX).map(PromptSections::filesOf).orElse(List.of());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("confidence", confidence);
        data.put("files_changed", files);
        data.put("all_files_changed", PayloadNormalizer.union(previous, files));
        data.put("fix_applied", applied);
        data.put("iteration", ctx.iteration());
        data.put("summary", PayloadNormalizer.text(raw.get("summary")));
        data.put("tests_added", PayloadNormalizer.textList(raw.get("tests_added")));
        data.put("caveats", PayloadNormalizer.textList(raw.get("caveats")));
        data.put("testing_notes", PayloadNormalizer.textList(raw.get("testing_notes")));
        data.put("full_result", raw);

        log.info("Revision {} complete (confidence: {}), files changed: {}",
                ctx.iteration(), confidence, files.size());
        if (files.isEmpty() && Boolean.FALSE.equals(applied)) {
            log.warn("Revision {} applied no changes", ctx.iteration());
            return Outcome.skipped(confidence, data);
        }
        return Outcome.success(confidence, data);
    }

    private String currentDiff() {
        String diff;
        try {
            diff = vcs.diff("HEAD");
            if (diff.isBlank()) {
                diff = vcs.diff(baseRef);
            }
        } catch (ExecutorException e) {
            log.warn("Could not compute diff: {}", e.getMessage());
            return "(diff unavailable: " + e.getMessage() + ")";
        }
        return truncate(diff.isBlank() ? "(no diff)" : diff);
    }

    static String truncate(String diff) {
        if (diff.length() <= MAX_DIFF_CHARS) {
            return diff;
        }
        return diff.substring(0, MAX_DIFF_CHARS)
                + "\n... [diff truncated, " + (diff.length() - MAX_DIFF_CHARS) + " more characters]";
    }
}
