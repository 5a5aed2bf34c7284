package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.claude.ClaudeResult;
import com.autofix.orchestrator.claude.ClaudeRunner;
import com.autofix.orchestrator.claude.ClaudeRunner.ClaudeTimeoutException;
import com.autofix.orchestrator.executor.ExecutorException;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.AgentStatus;
import com.autofix.orchestrator.model.Issue;
import com.autofix.orchestrator.store.StateStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One pipeline stage backed by an agent CLI invocation.
 *
 * {@link #execute} is a template method: check preconditions, render and save
 * the prompt, run the agent process under the stage timeout, extract the
 * structured payload, then let the subclass turn it into a status.
 *
 * Nothing thrown below this method escapes it. Timeouts, non-zero exits and
 * launcher errors come back as FAILED states carrying the error text; a
 * missing payload is handed to the subclass as {@code Optional.empty()} so it
 * can substitute its conservative default.
 */
public abstract class Agent {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ClaudeRunner    claude;
    protected final PromptTemplates prompts;
    private final Clock           clock;

    protected Agent(ClaudeRunner claude, PromptTemplates prompts, Clock clock) {
        this.claude  = claude;
        this.prompts = prompts;
        this.clock   = clock;
    }

    /** Role this agent fills; the fix revision shares FIX. */
    public abstract AgentRole role();

    /** Marker field names tried in order when extracting the payload. */
    protected abstract List<String> requiredFields();

    /** Render the prompt for this invocation. */
    protected abstract String buildPrompt(AgentContext ctx);

    /** Map the extracted payload (or its absence) to a stage outcome. */
    protected abstract Outcome interpret(Optional<Map<String, Object>> payload, AgentContext ctx);

    /** Reason the stage cannot run, if any. Checked before any process is started. */
    protected Optional<String> unmetPrecondition(AgentContext ctx) {
        return Optional.empty();
    }

    /**
     * Status, confidence and payload decided by a subclass.
     * {@code error} is only meaningful for FAILED.
     */
    protected record Outcome(AgentStatus status, double confidence, Map<String, Object> data, String error) {

        public static Outcome success(double confidence, Map<String, Object> data) {
            return new Outcome(AgentStatus.SUCCESS, confidence, data, null);
        }

        public static Outcome skipped(double confidence, Map<String, Object> data) {
            return new Outcome(AgentStatus.SKIPPED, confidence, data, null);
        }

        public static Outcome failed(String error, Map<String, Object> data) {
            return new Outcome(AgentStatus.FAILED, 0.0, data, error);
        }
    }

    // ------------------------------------------------------------------
    // Template method
    // ------------------------------------------------------------------

    public final AgentState execute(AgentContext ctx) {
        Instant started = clock.instant();
        String  label   = ctx.label();

        Optional<String> unmet = unmetPrecondition(ctx);
        if (unmet.isPresent()) {
            log.error("{}: {}", label, unmet.get());
            return failed(label, unmet.get(), started);
        }

        String prompt;
        try {
            prompt = buildPrompt(ctx);
            ctx.run().writePrompt(label, prompt);
        } catch (StateStoreException | IllegalArgumentException | UncheckedIOException e) {
            log.error("{}: could not prepare prompt: {}", label, e.getMessage());
            return failed(label, "Could not prepare prompt: " + e.getMessage(), started);
        }

        log.info("Running Claude for {} (timeout: {}s)...", label, ctx.timeoutFor(role()).toSeconds());
        ClaudeResult result;
        try {
            result = claude.run(prompt, ctx.workDir(), ctx.timeoutFor(role()), ctx.run().logFile(label));
        } catch (ClaudeTimeoutException | ExecutorException e) {
            log.error("{}: {}", label, e.getMessage());
            return failed(label, e.getMessage(), started);
        }

        if (!result.success()) {
            log.error("{}: Claude failed: {}", label, result.error());
            return failed(label, "Claude failed: " + result.error(), started);
        }

        Optional<Map<String, Object>> payload = ResultExtractor.extractAny(result.output(), requiredFields());
        if (payload.isEmpty()) {
            log.warn("{}: could not extract structured result (looked for {})", label, requiredFields());
        }

        Outcome outcome = interpret(payload, ctx);

        Map<String, Object> data = new LinkedHashMap<>(outcome.data());
        data.put("duration_ms", result.durationMs());
        data.put("cost_usd", result.costUsd());

        return new AgentState(label, outcome.status(), outcome.confidence(), data,
                outcome.error(), started, clock.instant());
    }

    // ------------------------------------------------------------------
    // Prompt helpers
    // ------------------------------------------------------------------

    /** Placeholder values every template may use. */
    protected static Map<String, String> issueValues(Issue issue) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("ISSUE_NUMBER", String.valueOf(issue.number()));
        values.put("ISSUE_TITLE",  issue.title());
        values.put("ISSUE_BODY",   issue.body());
        values.put("ISSUE_LABELS", String.join(", ", issue.labels()));
        values.put("ISSUE_URL",    issue.url());
        return values;
    }

    /** Pretty-printed JSON for embedding payload fragments in a prompt. */
    protected static String toJson(Object value) {
        try {
            return PRETTY.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable: " + e.getMessage(), e);
        }
    }

    /** Markdown bullet list, or "(none)". */
    protected static String bullets(List<String> items) {
        if (items.isEmpty()) {
            return "(none)";
        }
        StringBuilder sb = new StringBuilder();
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private AgentState failed(String label, String error, Instant started) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        return AgentState.failed(label, error, data, started, clock.instant());
    }
}
