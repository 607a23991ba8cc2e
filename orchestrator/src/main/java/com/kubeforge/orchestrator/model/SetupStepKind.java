package com.kubeforge.orchestrator.model;

/**
 * GLOBAL steps run once for the whole cluster on the controller thread.
 * PER_NODE steps fan out across the eligible node set.
 */
public enum SetupStepKind {
    GLOBAL,
    PER_NODE
}
