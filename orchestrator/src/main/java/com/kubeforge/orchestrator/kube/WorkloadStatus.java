package com.kubeforge.orchestrator.kube;

/**
 * Replica counts for one workload, already reduced to the two numbers its
 * {@link WorkloadKind} compares.
 *
 * @param desired spec replicas (desired scheduled pods for daemonsets)
 * @param ready   available or ready replicas, depending on the kind
 */
public record WorkloadStatus(
        WorkloadKind kind,
        String       namespace,
        String       name,
        int          desired,
        int          ready) {

    public boolean isReady() {
        return ready == desired;
    }
}
