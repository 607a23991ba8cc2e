package com.kubeforge.orchestrator.hosting;

import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.model.HostingEnvironment;
import com.kubeforge.orchestrator.setup.SetupContext;
import com.kubeforge.orchestrator.setup.SetupController;

/**
 * Environment-specific part of cluster setup: cloud, hypervisor or bare metal.
 *
 * <p>The setup sequence hands the controller to the manager twice, once
 * before the generic node preparation steps ({@link #addProvisioningSteps})
 * and once after ({@link #addPostProvisioningSteps}). Everything a manager
 * does happens inside the steps it contributes, so the controller itself
 * never learns which environment it is driving.
 *
 * <p>The controller closes the manager when the run ends.
 */
public interface HostingManager extends AutoCloseable {

    HostingEnvironment environment();

    /**
     * Rejects cluster definitions this environment cannot build.
     *
     * @throws IllegalArgumentException when the definition is unusable here
     */
    void validate(ClusterDefinition cluster);

    /** True when provisioning needs the local user to be an administrator. */
    boolean requiresAdminPrivileges();

    /** True when nodes get a generated password instead of the default one. */
    boolean generateSecurePassword();

    /** True when node addresses must be checked for conflicts before the nodes come up. */
    default boolean requiresNodeAddressCheck() {
        return false;
    }

    void addProvisioningSteps(SetupController<SetupContext> controller);

    default void addPostProvisioningSteps(SetupController<SetupContext> controller) {}

    int  getMaxParallel();
    void setMaxParallel(int maxParallel);

    /** Seconds to wait after provisioning operations that the environment reports asynchronously. */
    int  getWaitSeconds();
    void setWaitSeconds(int waitSeconds);

    @Override
    default void close() {}
}
