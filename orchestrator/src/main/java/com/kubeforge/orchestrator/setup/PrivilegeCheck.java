package com.kubeforge.orchestrator.setup;

/**
 * Confirms that the local process may perform privileged provisioning.
 */
@FunctionalInterface
public interface PrivilegeCheck {

    /** Passes only when running as root. */
    PrivilegeCheck CURRENT_USER = () -> {
        String user = System.getProperty("user.name");
        if (!"root".equals(user)) {
            throw new SetupException("Cluster setup for this hosting environment must run as root, not [" + user + "].");
        }
    };

    /** @throws SetupException when privileges are missing */
    void verify();
}
