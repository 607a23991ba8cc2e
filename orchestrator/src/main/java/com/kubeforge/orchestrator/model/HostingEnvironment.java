package com.kubeforge.orchestrator.model;

/**
 * Substrates a cluster can be provisioned on.
 *
 * Only MACHINE (pre-provisioned bare metal or VMs) ships with an
 * implementation here; the others are supplied by separate hosting
 * manager providers.
 */
public enum HostingEnvironment {
    MACHINE,
    AWS,
    AZURE,
    HYPERV
}
