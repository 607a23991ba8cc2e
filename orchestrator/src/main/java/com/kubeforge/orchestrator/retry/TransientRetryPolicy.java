package com.kubeforge.orchestrator.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Retries an operation while its failures classify as
 * {@link ErrorClass#TRANSIENT}, doubling the delay after each attempt up to
 * {@code maxDelay}.
 *
 * A FATAL failure, or a transient one on the last attempt, is rethrown
 * as-is. Used by transports only; setup steps never retry through this.
 */
public class TransientRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(TransientRetryPolicy.class);

    private final int             maxAttempts;
    private final Duration        initialDelay;
    private final Duration        maxDelay;
    private final ErrorClassifier classifier;
    private final Sleeper         sleeper;

    public TransientRetryPolicy(int maxAttempts,
                                Duration initialDelay,
                                Duration maxDelay,
                                ErrorClassifier classifier,
                                Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts  = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay     = maxDelay;
        this.classifier   = classifier;
        this.sleeper      = sleeper;
    }

    public TransientRetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, ErrorClassifier classifier) {
        this(maxAttempts, initialDelay, maxDelay, classifier, Sleeper.SYSTEM);
    }

    public int maxAttempts() { return maxAttempts; }

    public <T> T invoke(String opName, Callable<T> operation) throws Exception {
        Duration delay = initialDelay;
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts || classifier.classify(e) != ErrorClass.TRANSIENT) {
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        opName, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                sleeper.sleep(delay);
                delay = delay.multipliedBy(2);
                if (delay.compareTo(maxDelay) > 0) {
                    delay = maxDelay;
                }
            }
        }
    }
}
