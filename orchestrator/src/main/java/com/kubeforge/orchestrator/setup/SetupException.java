package com.kubeforge.orchestrator.setup;

/**
 * A setup step could not complete.
 *
 * Thrown from a global step it ends the run; thrown from a per-node step it
 * faults that node only.
 */
public class SetupException extends RuntimeException {

    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
