package com.autofix.orchestrator.executor;

/**
 * Thrown when an external command cannot be launched or its output cannot be
 * collected. A command that runs and exits non-zero is not an exception; it is
 * reported through {@link ExecutionResult}.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
