package com.kubeforge.orchestrator.setup;

import com.kubeforge.orchestrator.node.CommandResponse;
import com.kubeforge.orchestrator.node.NodeProxy;
import com.kubeforge.orchestrator.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Joins nodes to a control plane that may not be serving yet.
 *
 * <p>Attempts are repeated after a fixed delay until one succeeds or the
 * attempt budget runs out. Only a failed attempt (non-zero exit) is retried;
 * a transport exception from the remote shell propagates on the spot.
 * There is no sleep after the last attempt.
 */
public class ClusterJoiner {

    private static final Logger log = LoggerFactory.getLogger(ClusterJoiner.class);

    static final String IGNORE_PREFLIGHT = "--ignore-preflight-errors=DirAvailable--etc-kubernetes-manifests";

    private final int      maxAttempts;
    private final Duration delay;
    private final Sleeper  sleeper;

    public ClusterJoiner(int maxAttempts, Duration delay) {
        this(maxAttempts, delay, Sleeper.SYSTEM);
    }

    public ClusterJoiner(int maxAttempts, Duration delay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.delay       = Objects.requireNonNull(delay, "delay");
        this.sleeper     = Objects.requireNonNull(sleeper, "sleeper");
    }

    public int maxAttempts() { return maxAttempts; }

    /**
     * Runs {@code joinCommand} as root on {@code node}, adding the control-plane
     * flag for control-plane peers.
     *
     * @throws SetupException when every attempt fails
     */
    public void joinWithRetry(NodeProxy node, String joinCommand, boolean controlPlane) throws InterruptedException {
        Objects.requireNonNull(joinCommand, "joinCommand");
        String command = joinCommand
                + (controlPlane ? " --control-plane" : "")
                + " " + IGNORE_PREFLIGHT;

        boolean joined = retry(node.name(), () -> {
            CommandResponse response = node.trySudoCommand(command);
            if (!response.success()) {
                log.warn("[{}] join attempt failed (exit {}): {}",
                        node.name(), response.exitCode(), response.allText().strip());
            }
            return response.success();
        });

        if (!joined) {
            throw new SetupException("Unable to join node [" + node.name() + "] to the cluster after ["
                    + maxAttempts + "] attempts.");
        }
    }

    /**
     * Invokes {@code attempt} up to the attempt budget, stopping at the first success.
     *
     * @return true when an attempt succeeded
     */
    public boolean retry(String nodeName, BooleanSupplier attempt) throws InterruptedException {
        for (int i = 1; i <= maxAttempts; i++) {
            if (attempt.getAsBoolean()) {
                if (i > 1) {
                    log.info("[{}] joined on attempt {}/{}", nodeName, i, maxAttempts);
                }
                return true;
            }
            if (i < maxAttempts) {
                log.debug("[{}] attempt {}/{} failed, retrying in {}ms", nodeName, i, maxAttempts, delay.toMillis());
                sleeper.sleep(delay);
            }
        }
        return false;
    }
}
