package com.autofix.orchestrator.config;

import com.autofix.orchestrator.model.AgentRole;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Typed view of the {@code autofix.*} block in application.yml.
 *
 * Every value has a default so the application starts with an empty
 * configuration; real runs override at least {@code project-dir} and
 * {@code github-repo} (e.g. AUTOFIX_PROJECT_DIR, AUTOFIX_GITHUB_REPO).
 *
 * @param projectDir   local clone of the repository the agents work in
 * @param runsDir      parent of the per-run audit directories
 * @param promptsDir   overrides for the bundled prompt templates
 * @param claudePath   agent CLI executable
 * @param githubRepo   issue-tracker repository as owner/name
 * @param baseBranch   branch fixes are based on and change requests target
 * @param remote       git remote to sync with and push to
 * @param branchPrefix work branch name is prefix + issue number
 */
@ConfigurationProperties(prefix = "autofix")
public record AutofixProperties(
        @DefaultValue(".")               Path     projectDir,
        @DefaultValue("runs")            Path     runsDir,
        @DefaultValue("prompts")         Path     promptsDir,
        @DefaultValue("claude")          String   claudePath,
        @DefaultValue("")                String   githubRepo,
        @DefaultValue("develop")         String   baseBranch,
        @DefaultValue("origin")          String   remote,
        @DefaultValue("claude-auto-fix-") String  branchPrefix,
        @DefaultValue                    Pipeline pipeline,
        @DefaultValue                    Timeouts timeouts) {

    /**
     * @param maxIterations        bound on fix-review rounds
     * @param weights              stage key → weight, must sum to 1.0
     * @param minTriageConfidence  triage confidence needed to proceed
     */
    public record Pipeline(
            @DefaultValue("3")   int                 maxIterations,
            Map<String, Double>                      weights,
            @DefaultValue("0.6") double              minTriageConfidence) {

        public Pipeline {
            if (weights == null || weights.isEmpty()) {
                weights = Map.of("triage", 0.15, "research", 0.20, "fix", 0.35, "review", 0.30);
            }
        }
    }

    /** Per-stage wall-clock bound on the agent process. */
    public record Timeouts(
            @DefaultValue("180s") Duration triage,
            @DefaultValue("600s") Duration research,
            @DefaultValue("900s") Duration fix,
            @DefaultValue("300s") Duration review) {

        public Duration forRole(AgentRole role) {
            return switch (role) {
                case TRIAGE   -> triage;
                case RESEARCH -> research;
                case FIX      -> fix;
                case REVIEW   -> review;
            };
        }
    }
}
