package com.kubeforge.orchestrator.kube;

/**
 * Workload types the setup waits on, with the readiness rule each one uses.
 */
public enum WorkloadKind {

    /** Ready when available replicas equal spec replicas. */
    DEPLOYMENT("deployments"),

    /** Ready when ready replicas equal spec replicas. */
    STATEFULSET("statefulsets"),

    /** Ready when available pods equal desired scheduled pods. */
    DAEMONSET("daemonsets");

    private final String resource;

    WorkloadKind(String resource) {
        this.resource = resource;
    }

    /** Plural resource name as accepted by {@code kubectl get}. */
    public String resource() {
        return resource;
    }
}
