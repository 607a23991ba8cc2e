package com.kubeforge.orchestrator.api;

import com.kubeforge.orchestrator.setup.SetupController;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the controller whose progress the status API reports.
 */
@Component
public class SetupMonitor {

    private final AtomicReference<SetupController<?>> current = new AtomicReference<>();

    public void publish(SetupController<?> controller) {
        current.set(controller);
    }

    public Optional<SetupController<?>> current() {
        return Optional.ofNullable(current.get());
    }
}
