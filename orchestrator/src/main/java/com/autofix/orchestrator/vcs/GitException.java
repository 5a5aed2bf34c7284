package com.autofix.orchestrator.vcs;

/**
 * Thrown when a git command exits non-zero where success is required.
 */
public class GitException extends RuntimeException {

    public GitException(String message) {
        super(message);
    }

    public GitException(String message, Throwable cause) {
        super(message, cause);
    }
}
