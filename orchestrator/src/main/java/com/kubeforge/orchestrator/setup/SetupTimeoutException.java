package com.kubeforge.orchestrator.setup;

import java.time.Duration;

/**
 * A polling wait gave up before its condition became true.
 */
public class SetupTimeoutException extends SetupException {

    private final Duration timeout;

    public SetupTimeoutException(String what, Duration timeout) {
        super("Timed out after " + timeout.toSeconds() + "s waiting for " + what);
        this.timeout = timeout;
    }

    public Duration getTimeout() { return timeout; }
}
