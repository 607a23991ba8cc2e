package com.kubeforge.orchestrator.kube;

import java.util.List;
import java.util.Map;

/**
 * The Kubernetes API operations the cluster setup needs.
 *
 * Implementations throw {@link KubernetesException} when the API call fails.
 */
public interface KubernetesClient {

    /**
     * Lists workloads of one kind in {@code namespace}, optionally narrowed by
     * a label selector (null for all).
     */
    List<WorkloadStatus> listWorkloads(WorkloadKind kind, String namespace, String labelSelector);

    /** Adds or overwrites labels on a node. */
    void labelNode(String nodeName, Map<String, String> labels);

    /** Removes a taint (e.g. {@code node-role.kubernetes.io/control-plane:NoSchedule}); absent taints are ignored. */
    void removeNodeTaint(String nodeName, String taint);

    /** Names of the nodes registered with the API server. */
    List<String> listNodeNames();
}
