package com.kubeforge.orchestrator.model;

/**
 * Execution state of a single setup step.
 *
 * Transitions:
 *   PENDING → RUNNING (reached by the controller)
 *   RUNNING → DONE    (global body returned, or every eligible node returned)
 *   RUNNING → FAILED  (global body threw, or at least one node faulted)
 *   any     → PENDING (controller re-run)
 */
public enum SetupStepState {
    PENDING,
    RUNNING,
    DONE,
    FAILED
}
