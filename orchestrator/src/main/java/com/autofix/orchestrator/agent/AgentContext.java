package com.autofix.orchestrator.agent;

import com.autofix.orchestrator.config.AutofixProperties.Timeouts;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.Issue;
import com.autofix.orchestrator.store.RunDirectory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Everything an agent invocation may read.
 *
 * @param previousStates latest state per role so far (read-only snapshot)
 * @param run            where the prompt and raw log are written
 * @param workDir        directory the agent process runs in
 * @param label          artifact name for this invocation, e.g. "fix" or "fix-revision-2"
 * @param iteration      fix-review round, 1-based (1 for stages outside the loop)
 */
public record AgentContext(
        Issue issue,
        Map<AgentRole, AgentState> previousStates,
        RunDirectory run,
        Path workDir,
        Timeouts timeouts,
        String label,
        int iteration) {

    public AgentContext {
        previousStates = Map.copyOf(previousStates);
    }

    public Optional<AgentState> previous(AgentRole role) {
        return Optional.ofNullable(previousStates.get(role));
    }

    public Duration timeoutFor(AgentRole role) {
        return timeouts.forRole(role);
    }
}
