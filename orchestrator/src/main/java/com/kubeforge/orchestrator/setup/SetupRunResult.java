package com.kubeforge.orchestrator.setup;

import com.kubeforge.orchestrator.node.NodeFault;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of {@link SetupController#run()}.
 *
 * @param success     true iff no global step failed and no node faulted
 * @param nodeFaults  faults keyed by node name, in node definition order
 * @param failedStep  name of the global step that aborted the run, or null
 * @param globalError the exception that aborted the run, or null
 */
public record SetupRunResult(
        boolean                success,
        Map<String, NodeFault> nodeFaults,
        String                 failedStep,
        Throwable              globalError,
        Duration               elapsed) {

    public SetupRunResult {
        nodeFaults = Collections.unmodifiableMap(new LinkedHashMap<>(nodeFaults));
    }

    public boolean isAborted() {
        return failedStep != null;
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(globalError);
    }
}
