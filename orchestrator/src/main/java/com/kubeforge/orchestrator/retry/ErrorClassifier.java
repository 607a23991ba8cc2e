package com.kubeforge.orchestrator.retry;

/**
 * Decides whether a failure raised by a transport is worth retrying.
 *
 * Each transport (node agent HTTP client, cloud API client, ...) supplies
 * its own classifier so retry policy can be tested without the transport.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorClass classify(Throwable error);

    /** Treats every error as fatal. */
    static ErrorClassifier fatal() {
        return error -> ErrorClass.FATAL;
    }
}
