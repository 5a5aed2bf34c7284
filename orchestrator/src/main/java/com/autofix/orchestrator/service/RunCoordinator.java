package com.autofix.orchestrator.service;

import com.autofix.orchestrator.config.AutofixProperties;
import com.autofix.orchestrator.executor.ExecutorException;
import com.autofix.orchestrator.model.AgentRole;
import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.AgentStatus;
import com.autofix.orchestrator.model.Issue;
import com.autofix.orchestrator.model.PipelineState;
import com.autofix.orchestrator.model.PipelineStatus;
import com.autofix.orchestrator.pipeline.PipelineFactory;
import com.autofix.orchestrator.pipeline.PipelineStateMachine;
import com.autofix.orchestrator.store.RunDirectory;
import com.autofix.orchestrator.tracker.ChangeRequest;
import com.autofix.orchestrator.tracker.IssueTracker;
import com.autofix.orchestrator.tracker.IssueTrackerException;
import com.autofix.orchestrator.vcs.GitException;
import com.autofix.orchestrator.vcs.VersionControl;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Takes one issue from the tracker to a draft pull request (or a comment
 * explaining why not).
 *
 * Owns everything around the pipeline: fetching the issue, preparing a clean
 * work branch from the remote base branch, and acting on the final state.
 * The pipeline itself never touches git or the tracker.
 *
 * Every path that does not end in a pushed branch leaves the working tree
 * clean and back on the base branch.
 */
@Service
public class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    static final List<String> COMMIT_EXCLUDES = List.of(".env", "*.env");

    private final IssueTracker      tracker;
    private final VersionControl    vcs;
    private final PipelineFactory   pipelines;
    private final IssueComments     comments;
    private final AutofixProperties properties;
    private final ObjectMapper      objectMapper;
    private final Clock             clock;

    public RunCoordinator(IssueTracker tracker, VersionControl vcs, PipelineFactory pipelines,
                          IssueComments comments, AutofixProperties properties,
                          ObjectMapper objectMapper, Clock clock) {
        this.tracker      = tracker;
        this.vcs          = vcs;
        this.pipelines    = pipelines;
        this.comments     = comments;
        this.properties   = properties;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    /**
     * Process one issue end to end.
     *
     * @return SUCCESS when a change request was opened, SKIPPED when the issue
     *         was deliberately not fixed, FAILED otherwise (BLOCKED runs are
     *         reported as FAILED)
     */
    public PipelineStatus process(int issueNumber) {
        log.info("Fetching issue #{}...", issueNumber);
        Issue issue;
        try {
            issue = tracker.fetchIssue(issueNumber);
        } catch (IssueTrackerException | ExecutorException e) {
            log.error("Failed to fetch issue #{}: {}", issueNumber, e.getMessage());
            return PipelineStatus.FAILED;
        }
        log.info("Issue: {} (labels: {})", issue.title(),
                issue.labels().isEmpty() ? "none" : String.join(", ", issue.labels()));

        RunDirectory run = RunDirectory.create(properties.runsDir(), issueNumber, clock, objectMapper);
        run.writeIssue(issue);

        String branch = properties.branchPrefix() + issueNumber;
        if (!prepareBranch(branch)) {
            return PipelineStatus.FAILED;
        }

        try {
            PipelineStateMachine pipeline = pipelines.create(issue, run);
            PipelineState state = pipeline.run();

            return switch (state.getStatus()) {
                case SUCCESS -> handleSuccess(issue, branch, state, pipeline.agentStates());
                case SKIPPED -> {
                    cleanup(branch);
                    yield handleSkip(issue, state, pipeline.agentStates());
                }
                default -> {
                    log.error("Pipeline {} for issue #{}: {}", state.getStatus(), issueNumber, state.getFailureReason());
                    cleanup(branch);
                    yield PipelineStatus.FAILED;
                }
            };
        } catch (RuntimeException e) {
            log.error("Unexpected error processing issue #{}", issueNumber, e);
            cleanup(branch);
            return PipelineStatus.FAILED;
        }
    }

    // ------------------------------------------------------------------
    // Branch preparation
    // ------------------------------------------------------------------

    private boolean prepareBranch(String branch) {
        String remote = properties.remote();
        String base   = properties.baseBranch();
        try {
            if (vcs.isDirty()) {
                log.error("Working tree has uncommitted changes. Commit or stash them first.");
                return false;
            }
            vcs.syncToRemote(remote, base);
            log.info("Reset to {}/{}", remote, base);

            tracker.findOpenChangeRequest(branch).ifPresent(existing -> {
                log.warn("Closing existing PR #{}", existing.number());
                tracker.closeChangeRequest(existing.number());
            });

            vcs.deleteBranch(branch);
            vcs.deleteRemoteBranch(remote, branch);
            vcs.createBranch(branch);
            return true;
        } catch (GitException | IssueTrackerException | ExecutorException e) {
            log.error("Could not prepare branch {}: {}", branch, e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    private PipelineStatus handleSuccess(Issue issue, String branch, PipelineState state,
                                         Map<AgentRole, AgentState> states) {
        String remote = properties.remote();
        try {
            if (vcs.hasChanges()) {
                vcs.addAll(COMMIT_EXCLUDES);
                vcs.commit("fix: " + issue.title() + "\n\nFixes #" + issue.number());
            }

            if (!vcs.hasUnpushedCommits(remote, branch)) {
                log.warn("No commits to push for issue #{}", issue.number());
                tracker.postComment(issue.number(), comments.noCodeChanges(state));
                cleanup(branch);
                return PipelineStatus.SKIPPED;
            }

            vcs.push(remote, branch);
            log.info("Pushed to {}/{}", remote, branch);

            double confidence = state.getAggregateConfidence();
            ChangeRequest pr = tracker.createChangeRequest(
                    "fix: " + issue.title(),
                    comments.changeRequestBody(issue, state),
                    branch,
                    properties.baseBranch(),
                    true,
                    List.of(confidenceLabel(confidence)));
            log.info("Created PR #{}: {}", pr.number(), pr.url());

            tracker.postComment(issue.number(), comments.fixCreated(pr, states, confidence));
            return PipelineStatus.SUCCESS;
        } catch (GitException | IssueTrackerException | ExecutorException e) {
            log.error("Failed to publish fix for issue #{}: {}", issue.number(), e.getMessage());
            cleanup(branch);
            return PipelineStatus.FAILED;
        }
    }

    private PipelineStatus handleSkip(Issue issue, PipelineState state, Map<AgentRole, AgentState> states) {
        log.warn("Pipeline skipped issue #{}: {}", issue.number(), state.getFailureReason());

        AgentState fix = states.get(AgentRole.FIX);
        String body = fix != null && fix.status() == AgentStatus.SKIPPED
                ? comments.fixMadeNoChanges(states)
                : comments.notAttempted(states.get(AgentRole.TRIAGE));
        try {
            tracker.postComment(issue.number(), body);
        } catch (IssueTrackerException | ExecutorException e) {
            log.warn("Failed to comment on issue #{}: {}", issue.number(), e.getMessage());
        }
        return PipelineStatus.SKIPPED;
    }

    static String confidenceLabel(double confidence) {
        if (confidence >= 0.8) {
            return "high-confidence";
        }
        if (confidence >= 0.6) {
            return "medium-confidence";
        }
        return "low-confidence";
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    /** Discard changes, return to the base branch and drop the work branch. Each step is best effort. */
    private void cleanup(String branch) {
        bestEffort("discard changes", vcs::discardChanges);
        bestEffort("check out " + properties.baseBranch(), () -> vcs.checkout(properties.baseBranch()));
        bestEffort("delete branch " + branch, () -> vcs.deleteBranch(branch));
    }

    private static void bestEffort(String what, Runnable step) {
        try {
            step.run();
        } catch (GitException | ExecutorException e) {
            log.warn("Cleanup: could not {}: {}", what, e.getMessage());
        }
    }
}
