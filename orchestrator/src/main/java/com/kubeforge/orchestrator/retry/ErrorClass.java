package com.kubeforge.orchestrator.retry;

/**
 * TRANSIENT errors are expected to clear on their own and may be retried.
 * FATAL errors are surfaced immediately.
 */
public enum ErrorClass {
    TRANSIENT,
    FATAL
}
