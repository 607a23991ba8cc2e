package com.kubeforge.orchestrator.model;

import java.util.List;
import java.util.Objects;

/**
 * The cluster being set up: identity, hosting substrate, networking and nodes.
 *
 * Loaded from a JSON file by the setup runner; tests build it directly.
 */
public record ClusterDefinition(
        String               name,
        HostingEnvironment   hosting,
        String               kubernetesVersion,
        String               podSubnet,
        String               serviceSubnet,
        String               apiLoadBalancer,
        int                  passwordLength,
        List<NodeDefinition> nodes) {

    public ClusterDefinition {
        Objects.requireNonNull(name, "name");
        hosting           = hosting == null ? HostingEnvironment.MACHINE : hosting;
        kubernetesVersion = kubernetesVersion == null ? "1.29.4" : kubernetesVersion;
        podSubnet         = podSubnet == null ? "10.254.0.0/16" : podSubnet;
        serviceSubnet     = serviceSubnet == null ? "10.253.0.0/16" : serviceSubnet;
        passwordLength    = passwordLength <= 0 ? 20 : passwordLength;
        nodes             = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public List<NodeDefinition> controlPlanes() {
        return nodes.stream().filter(NodeDefinition::isControlPlane).toList();
    }

    public List<NodeDefinition> workers() {
        return nodes.stream().filter(n -> !n.isControlPlane()).toList();
    }

    /**
     * Checks the invariants every hosting environment relies on.
     *
     * @throws IllegalArgumentException when the definition is unusable
     */
    public void validate() {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Cluster [" + name + "] defines no nodes.");
        }
        if (controlPlanes().isEmpty()) {
            throw new IllegalArgumentException("Cluster [" + name + "] needs at least one control-plane node.");
        }
        long distinct = nodes.stream().map(NodeDefinition::name).distinct().count();
        if (distinct != nodes.size()) {
            throw new IllegalArgumentException("Cluster [" + name + "] has duplicate node names.");
        }
    }
}
