package com.kubeforge.orchestrator.setup;

import com.kubeforge.orchestrator.retry.Sleeper;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Polls a condition until it holds or a deadline passes.
 *
 * The condition is always checked at least once, and once more after the
 * last sleep, so a zero timeout still gets a single probe.
 */
public final class Waiter {

    private Waiter() {}

    public static void waitFor(String what, BooleanSupplier condition, Duration timeout, Duration pollInterval)
            throws InterruptedException {
        waitFor(what, condition, timeout, pollInterval, Sleeper.SYSTEM);
    }

    public static void waitFor(String what, BooleanSupplier condition, Duration timeout, Duration pollInterval,
                               Sleeper sleeper) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (condition.getAsBoolean()) {
                return;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new SetupTimeoutException(what, timeout);
            }
            sleeper.sleep(Duration.ofNanos(Math.min(remaining, pollInterval.toNanos())));
        }
    }
}
