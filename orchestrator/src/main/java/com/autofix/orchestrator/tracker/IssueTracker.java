package com.autofix.orchestrator.tracker;

import com.autofix.orchestrator.model.Issue;

import java.util.List;
import java.util.Optional;

/**
 * Issue-tracker operations used by the run coordinator.
 */
public interface IssueTracker {

    Issue fetchIssue(int number);

    void postComment(int issueNumber, String body);

    Optional<ChangeRequest> findOpenChangeRequest(String headBranch);

    void closeChangeRequest(int number);

    ChangeRequest createChangeRequest(String title, String body, String head, String base,
                                      boolean draft, List<String> labels);
}
