package com.kubeforge.orchestrator.hosting;

import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.model.HostingEnvironment;
import com.kubeforge.orchestrator.model.NodeDefinition;
import com.kubeforge.orchestrator.model.NodeRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HostingManagerRegistryTest {

    HostingManagerRegistry registry = new HostingManagerRegistry(List.of(new MachineHostingManagerProvider()));

    @Test
    void getManager_machineCluster_returnsMachineManager() {
        HostingManager manager = registry.getManager(cluster(HostingEnvironment.MACHINE,
                new NodeDefinition("cp-1", "10.0.0.1", NodeRole.CONTROL_PLANE)));

        assertThat(manager).isInstanceOf(MachineHostingManager.class);
        assertThat(manager.requiresAdminPrivileges()).isFalse();
        assertThat(manager.generateSecurePassword()).isFalse();
        assertThat(registry.environments()).containsExactly(HostingEnvironment.MACHINE);
    }

    @Test
    void getManager_unknownEnvironment_throwsNotFound() {
        ClusterDefinition cluster = cluster(HostingEnvironment.AWS,
                new NodeDefinition("cp-1", "10.0.0.1", NodeRole.CONTROL_PLANE));

        assertThatThrownBy(() -> registry.getManager(cluster))
                .isInstanceOf(HostingManagerNotFoundException.class)
                .hasMessage("No hosting manager for the [AWS] environment could be located.");
    }

    @Test
    void constructor_duplicateProviders_rejected() {
        assertThatThrownBy(() -> new HostingManagerRegistry(
                List.of(new MachineHostingManagerProvider(), new MachineHostingManagerProvider())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MACHINE");
    }

    @Test
    void getManager_duplicateAddresses_rejectedAndManagerClosed() {
        AtomicBoolean closed = new AtomicBoolean();
        HostingManagerProvider provider = new HostingManagerProvider() {
            @Override public HostingEnvironment environment() { return HostingEnvironment.MACHINE; }
            @Override public HostingManager create(ClusterDefinition cluster) {
                return new MachineHostingManager() {
                    @Override public void close() { closed.set(true); }
                };
            }
        };
        HostingManagerRegistry closing = new HostingManagerRegistry(List.of(provider));
        ClusterDefinition cluster = cluster(HostingEnvironment.MACHINE,
                new NodeDefinition("cp-1", "10.0.0.1", NodeRole.CONTROL_PLANE),
                new NodeDefinition("w-1", "10.0.0.1", NodeRole.WORKER));

        assertThatThrownBy(() -> closing.getManager(cluster))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reuses address [10.0.0.1]");
        assertThat(closed).isTrue();
    }

    @Test
    void machineManager_blankAddress_rejected() {
        ClusterDefinition cluster = cluster(HostingEnvironment.MACHINE,
                new NodeDefinition("cp-1", " ", NodeRole.CONTROL_PLANE));

        assertThatThrownBy(() -> new MachineHostingManager().validate(cluster))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[cp-1] has no address");
    }

    private static ClusterDefinition cluster(HostingEnvironment hosting, NodeDefinition... nodes) {
        return new ClusterDefinition("alpha", hosting, null, null, null, null, 0, List.of(nodes));
    }
}
