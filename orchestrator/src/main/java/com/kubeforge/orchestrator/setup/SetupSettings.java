package com.kubeforge.orchestrator.setup;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables for one cluster setup, bound from {@code kubeforge.setup.*}.
 */
public record SetupSettings(
        int      maxParallel,
        Duration waitUntilOnlineTimeout,
        Duration onlinePollInterval,
        int      joinMaxAttempts,
        Duration joinRetryDelay,
        Duration clusterOpTimeout,
        Duration clusterOpPollInterval,
        Path     loginFolder,
        Path     logFolder) {

    public SetupSettings {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("max-parallel must be >= 1");
        }
        if (joinMaxAttempts < 1) {
            throw new IllegalArgumentException("join-max-attempts must be >= 1");
        }
    }

    public static SetupSettings defaults(Path loginFolder, Path logFolder) {
        return new SetupSettings(
                SetupController.DEFAULT_MAX_PARALLEL,
                Duration.ofMinutes(15),
                Duration.ofSeconds(5),
                10,
                Duration.ofSeconds(5),
                Duration.ofMinutes(10),
                Duration.ofSeconds(5),
                loginFolder,
                logFolder);
    }
}
