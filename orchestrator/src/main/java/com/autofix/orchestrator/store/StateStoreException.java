package com.autofix.orchestrator.store;

/**
 * Thrown when a state snapshot or audit artifact cannot be written.
 *
 * Fatal to the run: the pipeline must not advance past a transition it
 * could not persist.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
