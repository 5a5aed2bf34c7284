package com.autofix.orchestrator.tracker;

/**
 * Thrown when the issue tracker rejects a request or returns something unreadable.
 */
public class IssueTrackerException extends RuntimeException {

    public IssueTrackerException(String message) {
        super(message);
    }

    public IssueTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
