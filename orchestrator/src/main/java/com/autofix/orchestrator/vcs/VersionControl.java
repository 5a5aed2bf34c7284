package com.autofix.orchestrator.vcs;

import java.util.List;

/**
 * Version-control operations the run coordinator and the fix revision need.
 * All operations act on the configured project working tree.
 */
public interface VersionControl {

    /** True when {@code status --porcelain} reports anything. */
    boolean isDirty();

    void fetch(String remote);

    void checkout(String branch);

    void resetHard(String ref);

    /** Fetch, check out {@code branch} and hard-reset it to {@code remote/branch}. */
    default void syncToRemote(String remote, String branch) {
        fetch(remote);
        checkout(branch);
        resetHard(remote + "/" + branch);
    }

    /** Create {@code name} from the current HEAD and check it out. */
    void createBranch(String name);

    /** Force-delete a local branch; a missing branch is not an error. */
    void deleteBranch(String name);

    /** Delete a branch on the remote; a missing branch is not an error. */
    void deleteRemoteBranch(String remote, String name);

    /** True when there are staged or unstaged changes to tracked files. */
    boolean hasChanges();

    /** True when HEAD is ahead of {@code remote/branch}, or that branch does not exist. */
    boolean hasUnpushedCommits(String remote, String branch);

    /** Stage everything except paths matching the given pathspec patterns. */
    void addAll(List<String> excludes);

    void commit(String message);

    /** Push {@code branch} and set its upstream. */
    void push(String remote, String branch);

    /** Drop all working-tree and index changes, including untracked files. */
    void discardChanges();

    /** Diff of the working tree against {@code ref}; empty when there is none. */
    String diff(String ref);
}
