package com.kubeforge.orchestrator.setup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubeforge.orchestrator.hosting.HostingManager;
import com.kubeforge.orchestrator.hosting.HostingManagerProvider;
import com.kubeforge.orchestrator.hosting.HostingManagerRegistry;
import com.kubeforge.orchestrator.hosting.MachineHostingManager;
import com.kubeforge.orchestrator.hosting.MachineHostingManagerProvider;
import com.kubeforge.orchestrator.login.ClusterLogin;
import com.kubeforge.orchestrator.login.ClusterLoginStore;
import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.model.HostingEnvironment;
import com.kubeforge.orchestrator.model.NodeDefinition;
import com.kubeforge.orchestrator.model.NodeRole;
import com.kubeforge.orchestrator.node.CommandResponse;
import com.kubeforge.orchestrator.node.NodeProxy;
import com.kubeforge.orchestrator.node.ScriptedRemoteShell;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives the full setup sequence against a scripted remote shell: every
 * node answers like a fresh Ubuntu machine and the cluster reports its
 * workloads ready.
 */
class KubeSetupTest {

    static final String JOIN = "kubeadm join 10.0.0.1:6443 --token abc.def --discovery-token-ca-cert-hash sha256:1234";

    static final String INIT_OUTPUT = """
            Your Kubernetes control-plane has initialized successfully!

            You can now join any number of control-plane nodes by copying certificate authorities
            and service account keys on each node and then running the following as root:

              kubeadm join 10.0.0.1:6443 --token abc.def \\
            \t--discovery-token-ca-cert-hash sha256:1234 \\
            \t--control-plane

            Then you can join any number of worker nodes by running the following on each as root:

            kubeadm join 10.0.0.1:6443 --token abc.def \\
            \t--discovery-token-ca-cert-hash sha256:1234
            """;

    static final BiFunction<NodeProxy, String, CommandResponse> HEALTHY = (node, cmd) -> {
        if (cmd.equals("cat /etc/os-release")) {
            return CommandResponse.ok("NAME=\"Ubuntu\"\nVERSION_ID=\"22.04\"\nID=ubuntu\n");
        }
        if (cmd.contains("kubeadm init")) {
            return CommandResponse.ok(INIT_OUTPUT);
        }
        if (cmd.contains("get daemonsets")) {
            return CommandResponse.ok("""
                    {"items": [{"metadata": {"name": "calico-node", "namespace": "calico-system"},
                                "status": {"desiredNumberScheduled": 3, "numberAvailable": 3}}]}""");
        }
        if (cmd.contains("get deployments")) {
            return CommandResponse.ok("""
                    {"items": [{"metadata": {"name": "workload", "namespace": "any"},
                                "spec": {"replicas": 1}, "status": {"availableReplicas": 1}}]}""");
        }
        if (cmd.contains("get statefulsets")) {
            return CommandResponse.ok("""
                    {"items": [{"metadata": {"name": "prometheus", "namespace": "monitoring"},
                                "spec": {"replicas": 1}, "status": {"readyReplicas": 1}}]}""");
        }
        return CommandResponse.ok("");
    };

    @TempDir Path folder;

    ScriptedRemoteShell shell = new ScriptedRemoteShell();
    ClusterLoginStore   store;
    SetupSettings       settings;

    ClusterDefinition cluster = cluster(HostingEnvironment.MACHINE);

    @BeforeEach
    void setUp() {
        store    = new ClusterLoginStore(folder, new ObjectMapper());
        settings = new SetupSettings(4, Duration.ofMillis(300), Duration.ofMillis(1), 3, Duration.ZERO,
                Duration.ofSeconds(5), Duration.ofMillis(1), folder, folder);

        shell.putFile("cp-1", "/etc/kubernetes/admin.conf",
                "contexts:\n- name: kubernetes-admin@alpha\n  user: kubernetes-admin\n");
        for (KubeSetup.RemoteFile file : KubeSetup.CONTROL_PLANE_FILES) {
            if (!file.path().equals("/etc/kubernetes/admin.conf")) {
                shell.putFile("cp-1", file.path(), "content of " + file.path());
            }
        }
        shell.respondWith(HEALTHY);
    }

    // ------------------------------------------------------------------
    // Full run
    // ------------------------------------------------------------------

    @Test
    void run_freshCluster_completesAndPersistsLogin() {
        SetupRunResult result = kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(result.success()).isTrue();

        ClusterLogin login = store.load("alpha").orElseThrow();
        assertThat(login.getSetupDetails().isSetupPending()).isFalse();
        assertThat(login.getSetupDetails().getClusterJoinCommand()).isEqualTo(JOIN);
        assertThat(login.getSetupDetails().getControlPlaneFiles()).hasSize(KubeSetup.CONTROL_PLANE_FILES.size());
        assertThat(login.getSetupDetails().getCompletedSteps())
                .contains("*global*:" + SetupController.keyFor("finish setup"))
                .contains("cp-1:setup/kubernetes-init")
                .contains("w-1:" + SetupController.keyFor("join workers"));
        assertThat(login.getSshPassword()).isEqualTo(KubeSetup.SYSADMIN_PASSWORD);
        assertThat(login.getSshKey().publicOpenSsh()).startsWith("ssh-rsa ");
    }

    @Test
    void run_joinsPeersAndWorkersWithTheRecordedCommand() {
        kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(shell.commands("cp-2"))
                .anyMatch(c -> c.contains(JOIN + " --control-plane " + ClusterJoiner.IGNORE_PREFLIGHT));
        assertThat(shell.commands("w-1"))
                .anyMatch(c -> c.contains(JOIN + " " + ClusterJoiner.IGNORE_PREFLIGHT))
                .noneMatch(c -> c.contains("--control-plane"));
        assertThat(shell.commands("cp-1")).noneMatch(c -> c.contains("kubeadm join"));

        // The etcd proxy is removed after the join.
        List<String> worker = shell.commands("w-1");
        assertThat(worker.get(worker.size() - 1)).contains("podman rm --force " + KubeSetup.ETCD_PROXY_NAME);
        assertThat(shell.file("w-1", KubeSetup.ETCD_PROXY_CONFIG))
                .contains("server cp-1 10.0.0.1:2379 check")
                .contains("server cp-2 10.0.0.2:2379 check");
    }

    @Test
    void run_copiesControlPlaneFilesToPeersOnly() {
        kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(shell.file("cp-2", "/etc/kubernetes/pki/ca.key")).isEqualTo("content of /etc/kubernetes/pki/ca.key");
        assertThat(shell.file("cp-2", "/etc/kubernetes/admin.conf")).contains("root@alpha");
        assertThat(shell.file("w-1", "/etc/kubernetes/pki/ca.key")).isNull();
        assertThat(shell.file("cp-1", "/etc/kubernetes/admin.conf"))
                .contains("name: root@alpha")
                .doesNotContain("kubernetes-admin");
    }

    @Test
    void run_installsSshKeyAndChartsAndLabels() {
        kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();
        ClusterLogin login = store.load("alpha").orElseThrow();

        assertThat(shell.file("w-1", "/home/sysadmin/.ssh/authorized_keys"))
                .isEqualTo(login.getSshKey().publicOpenSsh() + "\n");
        assertThat(shell.commands("cp-1"))
                .anyMatch(c -> c.contains("helm upgrade --install") && c.contains("tigera-operator"))
                .anyMatch(c -> c.contains("helm upgrade --install") && c.contains("metrics-server"))
                .anyMatch(c -> c.contains("helm upgrade --install") && c.contains("openebs"))
                .anyMatch(c -> c.contains("helm upgrade --install") && c.contains("kube-prometheus-stack"))
                .anyMatch(c -> c.contains("label node") && c.contains("w-1") && c.contains("kubeforge.io/role=worker"))
                .anyMatch(c -> c.contains("label node") && c.contains("zone=b"))
                .noneMatch(c -> c.contains(" taint node "));
    }

    @Test
    void run_dataDisk_verifiedAndMountedOnlyWhereDefined() {
        kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(shell.commands("w-1"))
                .contains("test -b '/dev/sdb'")
                .anyMatch(c -> c.contains("mkfs.ext4 -F"));
        assertThat(shell.commands("cp-1"))
                .noneMatch(c -> c.startsWith("test -b"))
                .noneMatch(c -> c.contains("mkfs.ext4"));
    }

    @Test
    void run_withoutWorkers_removesControlPlaneTaint() {
        ClusterDefinition single = new ClusterDefinition("solo", HostingEnvironment.MACHINE, null, null, null, null, 0,
                List.of(new NodeDefinition("cp-1", "10.0.0.1", NodeRole.CONTROL_PLANE)));

        SetupRunResult result = kubeSetup(new MachineHostingManagerProvider()).createSetupController(single).run();

        assertThat(result.success()).isTrue();
        assertThat(shell.commands("cp-1"))
                .anyMatch(c -> c.contains(" taint node ") && c.contains(KubeSetup.CONTROL_PLANE_TAINT + "-"));
    }

    @Test
    void run_nonUbuntuNode_faultsOnlyThatNode() {
        shell.respondWith((node, cmd) -> node.name().equals("w-1") && cmd.equals("cat /etc/os-release")
                ? CommandResponse.ok("ID=centos\n")
                : HEALTHY.apply(node, cmd));

        SetupRunResult result = kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(result.success()).isFalse();
        assertThat(result.nodeFaults()).containsOnlyKeys("w-1");
        assertThat(result.nodeFaults().get("w-1").step()).isEqualTo("verify node os");
        assertThat(shell.commands("w-1")).noneMatch(c -> c.contains("kubeadm join"));
        assertThat(shell.commands("cp-2")).anyMatch(c -> c.contains("kubeadm join"));

        // The login stays pending so the next run retries the faulted node.
        assertThat(result.failedStep()).isEqualTo("finish setup");
        assertThat(store.load("alpha").orElseThrow().getSetupDetails().isSetupPending()).isTrue();
    }

    // ------------------------------------------------------------------
    // Resume
    // ------------------------------------------------------------------

    @Test
    void run_afterFailedRun_resumesWithoutRepeatingCompletedWork() {
        shell.respondWith((node, cmd) -> cmd.contains("helm upgrade --install") && cmd.contains("metrics-server")
                ? CommandResponse.failed(1, "repository unreachable")
                : HEALTHY.apply(node, cmd));

        SetupRunResult first = kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(first.isAborted()).isTrue();
        assertThat(first.failedStep()).isEqualTo("install metrics server");
        ClusterLogin pending = store.load("alpha").orElseThrow();
        assertThat(pending.getSetupDetails().isSetupPending()).isTrue();
        assertThat(pending.getSetupDetails().getCompletedSteps())
                .contains("*global*:" + SetupController.keyFor("install cni"))
                .doesNotContain("*global*:" + SetupController.keyFor("install metrics server"));

        shell.respondWith(HEALTHY);
        SetupRunResult second = kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(second.success()).isTrue();
        assertThat(count("cp-1", "kubeadm init")).isEqualTo(1);
        assertThat(count("w-1", "kubeadm join")).isEqualTo(1);
        assertThat(count("w-1", "cat /etc/os-release")).isEqualTo(1);
        assertThat(count("cp-1", "tigera-operator")).isEqualTo(1);
        assertThat(count("cp-1", "kubernetes-sigs.github.io/metrics-server")).isEqualTo(2);
        assertThat(store.load("alpha").orElseThrow().getSshKey())
                .isEqualTo(pending.getSshKey());
    }

    @Test
    void run_faultedNodeRecovers_isJoinedAndLabeledOnResume() {
        shell.respondWith((node, cmd) -> node.name().equals("w-1") && cmd.equals("cat /etc/os-release")
                ? CommandResponse.ok("ID=centos\n")
                : HEALTHY.apply(node, cmd));

        SetupRunResult first = kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(first.nodeFaults()).containsOnlyKeys("w-1");
        assertThat(shell.commands("cp-1")).noneMatch(c -> c.contains("label node") && c.contains("w-1"));

        shell.respondWith(HEALTHY);
        SetupRunResult second = kubeSetup(new MachineHostingManagerProvider()).createSetupController(cluster).run();

        assertThat(second.success()).isTrue();
        assertThat(count("w-1", "kubeadm join")).isEqualTo(1);
        assertThat(shell.commands("cp-1"))
                .anyMatch(c -> c.contains("label node") && c.contains("w-1") && c.contains("kubeforge.io/role=worker"));
        assertThat(shell.commands("cp-1").stream().filter(c -> c.contains("label node") && c.contains("cp-2")).count())
                .isEqualTo(1);
    }

    @Test
    void createSetupController_finishedLogin_startsOver() {
        ClusterLogin done = new ClusterLogin(cluster, KubeSetup.SYSADMIN_USER);
        done.getSetupDetails().setSetupPending(false);
        done.getSetupDetails().setClusterJoinCommand("kubeadm join old");
        done.getSetupDetails().getCompletedSteps().add("*global*:" + SetupController.keyFor("install cni"));
        store.save(done);

        SetupController<SetupContext> controller = kubeSetup(new MachineHostingManagerProvider())
                .createSetupController(cluster);

        assertThat(controller.context().login().getSetupDetails().getClusterJoinCommand()).isNull();
        assertThat(controller.registry().snapshot()).isEmpty();
        assertThat(store.load("alpha").orElseThrow().getSetupDetails().isSetupPending()).isTrue();
    }

    @Test
    void createSetupController_invalidDefinition_rejected() {
        ClusterDefinition workersOnly = new ClusterDefinition("alpha", HostingEnvironment.MACHINE,
                null, null, null, null, 0, List.of(new NodeDefinition("w-1", "10.0.0.3", NodeRole.WORKER)));

        assertThatThrownBy(() -> kubeSetup(new MachineHostingManagerProvider()).createSetupController(workersOnly))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("control-plane");
    }

    @Test
    void createSetupController_stepOrder() {
        SetupController<SetupContext> controller = kubeSetup(new MachineHostingManagerProvider())
                .createSetupController(cluster);

        assertThat(controller.steps()).extracting(SetupStep::name).containsExactly(
                "configure hosting manager",
                "generate ssh credentials",
                "verify data disk",
                "wait until online",
                "verify node os",
                "node credentials",
                "prepare node",
                "initialize control plane",
                "join control plane",
                "configure api server",
                "join workers",
                "configure control plane taints",
                "label nodes",
                "install cni",
                "install metrics server",
                "install storage",
                "install monitoring",
                "finish setup");
    }

    // ------------------------------------------------------------------
    // Hosting manager hooks
    // ------------------------------------------------------------------

    @Test
    void run_adminManagerWithoutPrivileges_abortsAtFirstStep() {
        KubeSetup setup = kubeSetup(() -> { throw new SetupException("must run as root"); },
                new PrivilegedProvider(false));

        SetupRunResult result = setup.createSetupController(cluster(HostingEnvironment.HYPERV)).run();

        assertThat(result.isAborted()).isTrue();
        assertThat(result.failedStep()).isEqualTo("configure hosting manager");
        assertThat(result.globalError()).hasMessageContaining("must run as root");
        assertThat(shell.commands("cp-1")).isEmpty();
    }

    @Test
    void run_secureManager_generatesPasswordOnce() {
        KubeSetup setup = kubeSetup(() -> {}, new PrivilegedProvider(false));

        SetupRunResult result = setup.createSetupController(cluster(HostingEnvironment.HYPERV)).run();

        assertThat(result.success()).isTrue();
        String password = store.load("alpha").orElseThrow().getSshPassword();
        assertThat(password).hasSize(24).endsWith(".Aa0").isNotEqualTo(KubeSetup.SYSADMIN_PASSWORD);
    }

    @Test
    void run_addressAlreadyAnswering_faultsEveryNode() {
        KubeSetup setup = kubeSetup(() -> {}, new PrivilegedProvider(true));

        SetupRunResult result = setup.createSetupController(cluster(HostingEnvironment.HYPERV)).run();

        assertThat(result.nodeFaults()).containsOnlyKeys("cp-1", "cp-2", "w-1");
        assertThat(result.nodeFaults().get("cp-2").step()).isEqualTo("check node addresses");
        assertThat(result.nodeFaults().get("cp-2").message()).contains("[10.0.0.2]").contains("already in use");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @Test
    void extractJoinCommand_takesWorkerForm() {
        assertThat(KubeSetup.extractJoinCommand(INIT_OUTPUT)).isEqualTo(JOIN);
    }

    @Test
    void extractJoinCommand_singleMarker_rejected() {
        assertThatThrownBy(() -> KubeSetup.extractJoinCommand("kubeadm join 10.0.0.1:6443 --token x"))
                .isInstanceOf(SetupException.class)
                .hasMessageContaining("kubeadm join");
        assertThatThrownBy(() -> KubeSetup.extractJoinCommand("init failed"))
                .isInstanceOf(SetupException.class);
    }

    @Test
    void generatePassword_usesUnambiguousCharacters() {
        String password = KubeSetup.generatePassword(200);

        assertThat(password).hasSize(200).doesNotContain("0", "O", "1", "l", "I");
    }

    @Test
    void kubeadmConfig_usesFirstControlPlaneWithoutLoadBalancer() {
        String config = KubeSetup.kubeadmConfig(cluster);

        assertThat(config)
                .contains("clusterName: alpha")
                .contains("kubernetesVersion: v1.29.4")
                .contains("controlPlaneEndpoint: \"10.0.0.1:6443\"")
                .contains("podSubnet: \"10.254.0.0/16\"")
                .contains("  - \"10.0.0.2\"");
    }

    private long count(String node, String fragment) {
        return shell.commands(node).stream().filter(c -> c.contains(fragment)).count();
    }

    private KubeSetup kubeSetup(HostingManagerProvider provider) {
        return kubeSetup(() -> {}, provider);
    }

    private KubeSetup kubeSetup(PrivilegeCheck privilegeCheck, HostingManagerProvider provider) {
        return new KubeSetup(new HostingManagerRegistry(List.of(provider)), shell, store, settings,
                new ObjectMapper(), new SimpleMeterRegistry(), privilegeCheck);
    }

    private static ClusterDefinition cluster(HostingEnvironment hosting) {
        return new ClusterDefinition("alpha", hosting, null, null, null, null, 0, List.of(
                new NodeDefinition("cp-1", "10.0.0.1", NodeRole.CONTROL_PLANE),
                new NodeDefinition("cp-2", "10.0.0.2", NodeRole.CONTROL_PLANE),
                new NodeDefinition("w-1", "10.0.0.3", NodeRole.WORKER, "/dev/sdb", Map.of("zone", "b"))));
    }

    /** Hypervisor-style manager: needs root and generates node passwords. */
    static class PrivilegedProvider implements HostingManagerProvider {

        private final boolean checkAddresses;

        PrivilegedProvider(boolean checkAddresses) {
            this.checkAddresses = checkAddresses;
        }

        @Override
        public HostingEnvironment environment() {
            return HostingEnvironment.HYPERV;
        }

        @Override
        public HostingManager create(ClusterDefinition cluster) {
            return new MachineHostingManager() {
                @Override public HostingEnvironment environment()  { return HostingEnvironment.HYPERV; }
                @Override public boolean requiresAdminPrivileges() { return true; }
                @Override public boolean generateSecurePassword()  { return true; }
                @Override public boolean requiresNodeAddressCheck() { return checkAddresses; }
            };
        }
    }
}
