package com.kubeforge.orchestrator.node;

import java.time.Instant;

/**
 * Captured failure that excludes a node from the remaining per-node steps.
 *
 * @param step    Name of the step that faulted the node.
 * @param message Human-readable summary.
 * @param error   The exception caught at the task boundary, or null when the
 *                fault was raised explicitly (e.g. node never came online).
 */
public record NodeFault(String step, String message, Throwable error, Instant faultedAt) {

    public NodeFault(String step, String message, Throwable error) {
        this(step, message, error, Instant.now());
    }
}
