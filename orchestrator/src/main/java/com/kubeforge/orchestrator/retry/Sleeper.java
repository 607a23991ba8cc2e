package com.kubeforge.orchestrator.retry;

import java.time.Duration;

/**
 * Blocking pause between attempts. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
