package com.kubeforge.orchestrator.hosting;

import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.model.HostingEnvironment;
import com.kubeforge.orchestrator.model.NodeDefinition;
import com.kubeforge.orchestrator.node.CommandResponse;
import com.kubeforge.orchestrator.node.NodeProxy;
import com.kubeforge.orchestrator.setup.SetupContext;
import com.kubeforge.orchestrator.setup.SetupController;
import com.kubeforge.orchestrator.setup.SetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Bare-metal hosting: the machines already exist and keep the password the
 * operator installed, so provisioning only verifies the data disks.
 */
public class MachineHostingManager implements HostingManager {

    private static final Logger log = LoggerFactory.getLogger(MachineHostingManager.class);

    private volatile int maxParallel = 500;
    private volatile int waitSeconds;

    @Override
    public HostingEnvironment environment() {
        return HostingEnvironment.MACHINE;
    }

    /** Every node needs an explicit, unique address; there is nothing to assign them. */
    @Override
    public void validate(ClusterDefinition cluster) {
        Set<String> addresses = new HashSet<>();
        for (NodeDefinition node : cluster.nodes()) {
            if (node.address().isBlank()) {
                throw new IllegalArgumentException("Node [" + node.name() + "] has no address.");
            }
            if (!addresses.add(node.address())) {
                throw new IllegalArgumentException("Node [" + node.name() + "] reuses address [" + node.address() + "].");
            }
        }
    }

    @Override
    public boolean requiresAdminPrivileges() {
        return false;
    }

    @Override
    public boolean generateSecurePassword() {
        return false;
    }

    @Override
    public void addProvisioningSteps(SetupController<SetupContext> controller) {
        controller.addNodeStep("verify data disk", (c, node) -> verifyDataDisk(c, node),
                node -> node.definition().dataDisk() != null);
    }

    private void verifyDataDisk(SetupController<SetupContext> controller, NodeProxy node) {
        String disk = node.definition().dataDisk();
        controller.logProgress(node, "verify", "data disk " + disk);

        CommandResponse response = node.tryRunCommand("test -b " + NodeProxy.quote(disk));
        if (!response.success()) {
            throw new SetupException("Data disk [" + disk + "] is not a block device on node [" + node.name() + "].");
        }
        log.debug("[{}] data disk {} present", node.name(), disk);
    }

    @Override public int  getMaxParallel()                { return maxParallel; }
    @Override public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    @Override public int  getWaitSeconds()                { return waitSeconds; }
    @Override public void setWaitSeconds(int waitSeconds) { this.waitSeconds = waitSeconds; }
}
