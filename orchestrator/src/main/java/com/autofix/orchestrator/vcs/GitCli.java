package com.autofix.orchestrator.vcs;

import com.autofix.orchestrator.config.AutofixProperties;
import com.autofix.orchestrator.executor.CommandExecutor;
import com.autofix.orchestrator.executor.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link VersionControl} over the {@code git} command-line tool.
 */
@Component
public class GitCli implements VersionControl {

    private static final Logger log = LoggerFactory.getLogger(GitCli.class);

    private static final Duration GIT_TIMEOUT = Duration.ofMinutes(2);

    private final CommandExecutor executor;
    private final Path            repo;

    public GitCli(CommandExecutor executor, AutofixProperties properties) {
        this.executor = executor;
        this.repo     = properties.projectDir();
    }

    @Override
    public boolean isDirty() {
        return !git("status", "--porcelain").isEmpty();
    }

    @Override
    public void fetch(String remote) {
        git("fetch", remote);
    }

    @Override
    public void checkout(String branch) {
        git("checkout", branch);
    }

    @Override
    public void resetHard(String ref) {
        git("reset", "--hard", ref);
    }

    @Override
    public void createBranch(String name) {
        log.info("Creating branch {}", name);
        git("checkout", "-b", name);
    }

    @Override
    public void deleteBranch(String name) {
        gitUnchecked("branch", "-D", name);
    }

    @Override
    public void deleteRemoteBranch(String remote, String name) {
        gitUnchecked("push", remote, "--delete", name);
    }

    @Override
    public boolean hasChanges() {
        String staged   = gitUnchecked("diff", "--cached", "--name-only").out();
        String unstaged = gitUnchecked("diff", "--name-only").out();
        return !staged.isEmpty() || !unstaged.isEmpty();
    }

    @Override
    public boolean hasUnpushedCommits(String remote, String branch) {
        String remoteRef = remote + "/" + branch;
        if (gitUnchecked("rev-parse", "--verify", remoteRef).out().isEmpty()) {
            return true;
        }
        String ahead = gitUnchecked("rev-list", "--count", remoteRef + "..HEAD").out();
        try {
            return Integer.parseInt(ahead.isEmpty() ? "0" : ahead) > 0;
        } catch (NumberFormatException e) {
            throw new GitException("Unexpected rev-list output: " + ahead, e);
        }
    }

    @Override
    public void addAll(List<String> excludes) {
        List<String> args = new ArrayList<>(List.of("add", "."));
        for (String pattern : excludes) {
            args.add(":!" + pattern);
        }
        git(args.toArray(String[]::new));
    }

    @Override
    public void commit(String message) {
        git("commit", "-m", message);
    }

    @Override
    public void push(String remote, String branch) {
        git("push", "-u", remote, branch);
    }

    @Override
    public void discardChanges() {
        git("reset", "--hard", "HEAD");
        git("clean", "-fd");
    }

    @Override
    public String diff(String ref) {
        return gitUnchecked("diff", ref).out();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String git(String... args) {
        ExecutionResult result = gitUnchecked(args);
        if (!result.success()) {
            throw new GitException("git %s failed: %s".formatted(args[0], result.describeFailure()));
        }
        return result.out();
    }

    private ExecutionResult gitUnchecked(String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running {}", command);
        return executor.run(command, repo, GIT_TIMEOUT);
    }
}
