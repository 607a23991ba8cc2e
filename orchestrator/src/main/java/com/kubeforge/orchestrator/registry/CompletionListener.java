package com.kubeforge.orchestrator.registry;

/**
 * Notified once for every key newly marked complete.
 *
 * Called on the thread that completed the step, after the key is visible
 * to {@link StepRegistry#isComplete}. Implementations must be thread-safe.
 */
@FunctionalInterface
public interface CompletionListener {

    void completed(StepKey key);
}
