package com.kubeforge.orchestrator.model;

/**
 * Role a node plays in the Kubernetes cluster.
 *
 * The first CONTROL_PLANE node (in definition order) initializes the
 * cluster; every other node joins it.
 */
public enum NodeRole {
    CONTROL_PLANE,
    WORKER
}
