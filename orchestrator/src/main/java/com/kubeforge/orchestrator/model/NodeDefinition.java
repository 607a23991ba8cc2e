package com.kubeforge.orchestrator.model;

import java.util.Map;
import java.util.Objects;

/**
 * Static description of one cluster node as read from the cluster definition.
 *
 * @param name     Unique node name within the cluster (also the node's hostname).
 * @param address  IP address or DNS name the setup reaches the node on.
 * @param role     CONTROL_PLANE or WORKER.
 * @param dataDisk Block device used for the data partition, e.g. "/dev/sdb".
 * @param labels   Extra Kubernetes labels applied by the "label nodes" step.
 */
public record NodeDefinition(
        String              name,
        String              address,
        NodeRole            role,
        String              dataDisk,
        Map<String, String> labels) {

    public NodeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(role, "role");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public NodeDefinition(String name, String address, NodeRole role) {
        this(name, address, role, null, Map.of());
    }

    public boolean isControlPlane() {
        return role == NodeRole.CONTROL_PLANE;
    }
}
