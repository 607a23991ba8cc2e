package com.kubeforge.orchestrator.setup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubeforge.orchestrator.hosting.HostingManager;
import com.kubeforge.orchestrator.hosting.HostingManagerRegistry;
import com.kubeforge.orchestrator.kube.ChartReference;
import com.kubeforge.orchestrator.kube.HelmChartInstaller;
import com.kubeforge.orchestrator.kube.KubectlClient;
import com.kubeforge.orchestrator.kube.KubernetesClient;
import com.kubeforge.orchestrator.kube.WorkloadKind;
import com.kubeforge.orchestrator.kube.WorkloadWaiter;
import com.kubeforge.orchestrator.login.ClusterLogin;
import com.kubeforge.orchestrator.login.ClusterLoginStore;
import com.kubeforge.orchestrator.login.RemoteFileDetails;
import com.kubeforge.orchestrator.login.SshKeyPair;
import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.model.NodeDefinition;
import com.kubeforge.orchestrator.node.CommandResponse;
import com.kubeforge.orchestrator.node.NodeCredentials;
import com.kubeforge.orchestrator.node.NodeProxy;
import com.kubeforge.orchestrator.node.RemoteShell;
import com.kubeforge.orchestrator.registry.StepKey;
import com.kubeforge.orchestrator.registry.StepRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the controller that takes a cluster from bare machines to a running
 * Kubernetes cluster with networking, metrics, storage and monitoring.
 *
 * <p>Progress is persisted in the cluster-login file: every completed step
 * key is appended as it completes, so calling
 * {@link #createSetupController} again after a failure resumes where the
 * previous run stopped.
 */
@Component
public class KubeSetup {

    private static final Logger log = LoggerFactory.getLogger(KubeSetup.class);

    public static final String SYSADMIN_USER     = "sysadmin";
    public static final String SYSADMIN_PASSWORD = "sysadmin0000";

    static final String JOIN_COMMAND_MARKER = "kubeadm join";

    static final String ETCD_PROXY_NAME   = "kubeforge-etcd-proxy";
    static final String ETCD_PROXY_CONFIG = "/etc/kubeforge/etcd-proxy.cfg";
    static final String ETCD_PROXY_IMAGE  = "docker.io/library/haproxy:2.9";

    static final String CONTROL_PLANE_TAINT = "node-role.kubernetes.io/control-plane:NoSchedule";

    // Owner and permissions are fixed rather than read back from the node.
    static final List<RemoteFile> CONTROL_PLANE_FILES = List.of(
            new RemoteFile("/etc/kubernetes/admin.conf",                 "600", "root:root"),
            new RemoteFile("/etc/kubernetes/pki/ca.crt",                 "600", "root:root"),
            new RemoteFile("/etc/kubernetes/pki/ca.key",                 "600", "root:root"),
            new RemoteFile("/etc/kubernetes/pki/sa.pub",                 "600", "root:root"),
            new RemoteFile("/etc/kubernetes/pki/sa.key",                 "644", "root:root"),
            new RemoteFile("/etc/kubernetes/pki/front-proxy-ca.crt",     "644", "root:root"),
            new RemoteFile("/etc/kubernetes/pki/front-proxy-ca.key",     "600", "root:root"),
            new RemoteFile("/etc/kubernetes/pki/etcd/ca.crt",            "644", "root:root"),
            new RemoteFile("/etc/kubernetes/pki/etcd/ca.key",            "600", "root:root"));

    static final ChartReference CNI_CHART =
            new ChartReference("https://docs.tigera.io/calico/charts", "tigera-operator", "v3.27.3");
    static final ChartReference METRICS_SERVER_CHART =
            new ChartReference("https://kubernetes-sigs.github.io/metrics-server/", "metrics-server", "3.12.1");
    static final ChartReference STORAGE_CHART =
            new ChartReference("https://openebs.github.io/openebs", "openebs", "4.0.1");
    static final ChartReference MONITORING_CHART =
            new ChartReference("https://prometheus-community.github.io/helm-charts", "kube-prometheus-stack", "58.2.2");

    private static final String PASSWORD_CHARS =
            "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz23456789";

    private static final SecureRandom RANDOM = new SecureRandom();

    record RemoteFile(String path, String permissions, String owner) {}

    private final HostingManagerRegistry hostingManagers;
    private final RemoteShell            shell;
    private final ClusterLoginStore      loginStore;
    private final SetupSettings          settings;
    private final ObjectMapper           objectMapper;
    private final MeterRegistry          meterRegistry;
    private final PrivilegeCheck         privilegeCheck;

    public KubeSetup(HostingManagerRegistry hostingManagers,
                     RemoteShell shell,
                     ClusterLoginStore loginStore,
                     SetupSettings settings,
                     ObjectMapper objectMapper,
                     MeterRegistry meterRegistry,
                     PrivilegeCheck privilegeCheck) {
        this.hostingManagers = hostingManagers;
        this.shell           = shell;
        this.loginStore      = loginStore;
        this.settings        = settings;
        this.objectMapper    = objectMapper;
        this.meterRegistry   = meterRegistry;
        this.privilegeCheck  = privilegeCheck;
    }

    /**
     * Creates a ready-to-run controller for {@code cluster}.
     *
     * @throws IllegalArgumentException when the definition is invalid
     * @throws com.kubeforge.orchestrator.hosting.HostingManagerNotFoundException
     *         when no hosting manager handles the cluster's environment
     */
    public SetupController<SetupContext> createSetupController(ClusterDefinition cluster) {
        cluster.validate();
        HostingManager hostingManager = hostingManagers.getManager(cluster);

        // A pending login is a setup that did not finish: keep its password,
        // keys, join command and completed steps. Anything else starts over.
        ClusterLogin login = loginStore.load(cluster.name())
                .filter(l -> l.getSetupDetails().isSetupPending())
                .orElseGet(() -> {
                    ClusterLogin fresh = new ClusterLogin(cluster, SYSADMIN_USER);
                    loginStore.save(fresh);
                    return fresh;
                });

        StepRegistry registry = new StepRegistry();
        List<StepKey> completed = login.getSetupDetails().getCompletedSteps().stream()
                .map(StepKey::parse)
                .toList();
        if (!completed.isEmpty()) {
            log.info("Resuming setup of [{}] with {} completed step(s)", cluster.name(), completed.size());
            registry.restore(completed);
        }
        registry.addListener(key -> {
            synchronized (login) {
                login.getSetupDetails().getCompletedSteps().add(key.toString());
            }
            loginStore.save(login);
        });

        String password = login.getSshPassword() != null ? login.getSshPassword() : SYSADMIN_PASSWORD;
        List<NodeProxy> nodes = cluster.nodes().stream()
                .map(def -> new NodeProxy(def, shell, registry,
                        NodeCredentials.fromPassword(login.getSshUsername(), password)))
                .toList();
        NodeProxy firstControlPlane = nodes.stream()
                .filter(NodeProxy::isControlPlane)
                .findFirst()
                .orElseThrow();

        KubernetesClient kubernetes = new KubectlClient(firstControlPlane, objectMapper);
        SetupContext context = new SetupContext(
                cluster,
                hostingManager,
                login,
                loginStore,
                settings,
                firstControlPlane,
                new ClusterJoiner(settings.joinMaxAttempts(), settings.joinRetryDelay()),
                kubernetes,
                new HelmChartInstaller(firstControlPlane),
                new WorkloadWaiter(kubernetes, settings.clusterOpTimeout(), settings.clusterOpPollInterval()),
                privilegeCheck);

        SetupController<SetupContext> controller = new SetupController<>(
                "Setup [" + cluster.name() + "] cluster", nodes, registry, context, meterRegistry);
        controller.setMaxParallel(settings.maxParallel());
        controller.setOnlinePollInterval(settings.onlinePollInterval());

        addSteps(controller, hostingManager);
        controller.addDisposable(hostingManager);
        return controller;
    }

    private void addSteps(SetupController<SetupContext> controller, HostingManager hostingManager) {
        controller.addGlobalStep("configure hosting manager", KubeSetup::configureHostingManager);
        controller.addGlobalStep("generate ssh credentials", KubeSetup::generateSshCredentials);

        if (hostingManager.requiresNodeAddressCheck()) {
            controller.addNodeStep("check node addresses", KubeSetup::checkNodeAddress);
        }

        hostingManager.addProvisioningSteps(controller);

        controller.addWaitUntilOnlineStep(settings.waitUntilOnlineTimeout());
        controller.addNodeStep("verify node os", KubeSetup::verifyNodeOs);
        controller.addNodeStep("node credentials", KubeSetup::installSshKey);
        controller.addNodeStep("prepare node", KubeSetup::prepareNode);

        hostingManager.addPostProvisioningSteps(controller);

        controller.addGlobalStep("initialize control plane", KubeSetup::initializeControlPlane);
        controller.addNodeStep("join control plane", KubeSetup::joinControlPlane,
                node -> node.isControlPlane() && node != controller.context().firstControlPlane());
        controller.addNodeStep("configure api server", KubeSetup::configureApiServer, NodeProxy::isControlPlane);
        controller.addNodeStep("join workers", KubeSetup::joinWorker, node -> !node.isControlPlane());
        controller.addNodeStep("configure control plane taints", KubeSetup::configureTaint, NodeProxy::isControlPlane);
        controller.addNodeStep("label nodes", KubeSetup::labelNode);
        controller.addGlobalStep("install cni", KubeSetup::installCni);
        controller.addGlobalStep("install metrics server", KubeSetup::installMetricsServer);
        controller.addGlobalStep("install storage", KubeSetup::installStorage);
        controller.addGlobalStep("install monitoring", KubeSetup::installMonitoring);
        controller.addGlobalStep("finish setup", KubeSetup::finishSetup);
    }

    // ------------------------------------------------------------------
    // Preparation
    // ------------------------------------------------------------------

    static void configureHostingManager(SetupController<SetupContext> controller) {
        SetupContext ctx = controller.context();
        HostingManager hostingManager = ctx.hostingManager();
        if (hostingManager.requiresAdminPrivileges()) {
            try {
                ctx.privilegeCheck().verify();
            } catch (SetupException e) {
                controller.logError(e.getMessage());
                return;
            }
        }
        hostingManager.setMaxParallel(controller.getMaxParallel());
        hostingManager.setWaitSeconds(60);
    }

    static void generateSshCredentials(SetupController<SetupContext> controller) {
        SetupContext ctx   = controller.context();
        ClusterLogin login = ctx.login();

        if (!ctx.hostingManager().generateSecurePassword()) {
            login.setSshPassword(SYSADMIN_PASSWORD);
        } else if (login.getSshPassword() == null || login.getSshPassword().isEmpty()) {
            // The suffix satisfies cloud password rules needing upper, lower and digit classes.
            login.setSshPassword(generatePassword(ctx.cluster().passwordLength()) + ".Aa0");
        }

        if (login.getSshKey() == null) {
            controller.logProgress("generate", "ssh key");
            login.setSshKey(SshKeyPair.generate(ctx.cluster().name() + " cluster key"));
        }
        ctx.saveLogin();
    }

    static String generatePassword(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(PASSWORD_CHARS.charAt(RANDOM.nextInt(PASSWORD_CHARS.length())));
        }
        return sb.toString();
    }

    /** Before provisioning, nothing may already answer at a node's address. */
    static void checkNodeAddress(SetupController<SetupContext> controller, NodeProxy node) {
        controller.logProgress(node, "check", "address " + node.address());
        if (node.isOnline()) {
            throw new SetupException("Address [" + node.address() + "] for node [" + node.name()
                    + "] is already in use by another machine.");
        }
    }

    static void verifyNodeOs(SetupController<SetupContext> controller, NodeProxy node) {
        controller.logProgress(node, "verify", "operating system");
        String osRelease = node.runCommand("cat /etc/os-release").outputText();
        boolean ubuntu = osRelease.lines()
                .map(String::strip)
                .anyMatch(line -> line.equals("ID=ubuntu") || line.equals("ID=\"ubuntu\""));
        if (!ubuntu) {
            throw new SetupException("Node [" + node.name() + "] is not running Ubuntu.");
        }
    }

    static void installSshKey(SetupController<SetupContext> controller, NodeProxy node) {
        ClusterLogin login = controller.context().login();
        String user = login.getSshUsername();
        String home = "/home/" + user;

        controller.logProgress(node, "install", "ssh key");
        node.sudoCommand("mkdir -p " + home + "/.ssh && chmod 700 " + home + "/.ssh && chown "
                + user + ":" + user + " " + home + "/.ssh");
        node.uploadText(home + "/.ssh/authorized_keys", login.getSshKey().publicOpenSsh() + "\n",
                "600", user + ":" + user);
    }

    static void prepareNode(SetupController<SetupContext> controller, NodeProxy node) throws Exception {
        node.invokeIdempotent("setup/package-manager", () -> {
            controller.logProgress(node, "configure", "package manager");
            node.sudoCommand("DEBIAN_FRONTEND=noninteractive apt-get update -q");
        });

        node.invokeIdempotent("setup/environment", () -> {
            controller.logProgress(node, "configure", "environment");
            node.uploadText("/etc/kubeforge/environment",
                    "KUBEFORGE_NODE_NAME=" + node.name() + "\n"
                            + "KUBEFORGE_NODE_ROLE=" + node.role().name().toLowerCase() + "\n"
                            + "KUBEFORGE_NODE_ADDRESS=" + node.address() + "\n",
                    "644", "root:root");
            node.sudoCommand("swapoff -a && sed -i '/\\sswap\\s/d' /etc/fstab");
        });

        String dataDisk = node.definition().dataDisk();
        if (dataDisk != null) {
            node.invokeIdempotent("setup/data-disk", () -> {
                controller.logProgress(node, "prepare", "data disk " + dataDisk);
                node.sudoCommand("mkfs.ext4 -F " + NodeProxy.quote(dataDisk)
                        + " && mkdir -p /mnt-data"
                        + " && echo " + NodeProxy.quote(dataDisk + " /mnt-data ext4 defaults 0 2") + " >> /etc/fstab"
                        + " && mount /mnt-data");
            });
        }
    }

    // ------------------------------------------------------------------
    // Control plane
    // ------------------------------------------------------------------

    static void initializeControlPlane(SetupController<SetupContext> controller) throws Exception {
        SetupContext ctx   = controller.context();
        NodeProxy    first = ctx.firstControlPlane();
        ClusterLogin login = ctx.login();

        first.invokeIdempotent("setup/kubernetes-init", () -> {
            controller.logProgress(first, "initialize", "kubernetes");

            // A previous init may have been interrupted.
            first.sudoCommand("kubeadm reset --force");
            writeEtcdProxyConfig(ctx, first);

            first.uploadText("/etc/kubeforge/cluster.yaml", kubeadmConfig(ctx.cluster()), "600", "root:root");
            CommandResponse response = first.sudoCommand(
                    "systemctl enable kubelet.service && kubeadm init --config /etc/kubeforge/cluster.yaml "
                            + ClusterJoiner.IGNORE_PREFLIGHT);

            login.getSetupDetails().setClusterJoinCommand(extractJoinCommand(response.outputText()));
            ctx.saveLogin();
            controller.logProgress(first, "created", "cluster");
        });

        first.invokeIdempotent("setup/kubectl", () -> {
            controller.logProgress(first, "configure", "kubectl");
            String name   = ctx.cluster().name();
            String config = first.downloadText("/etc/kubernetes/admin.conf")
                    .replace("kubernetes-admin@" + name, "root@" + name)
                    .replace("kubernetes-admin", "root@" + name);
            first.uploadText("/etc/kubernetes/admin.conf", config, "600", "root:root");
        });

        Map<String, RemoteFileDetails> files = login.getSetupDetails().getControlPlaneFiles();
        if (files.isEmpty()) {
            controller.logProgress(first, "download", "control-plane files");
            Map<String, RemoteFileDetails> downloaded = new LinkedHashMap<>();
            for (RemoteFile file : CONTROL_PLANE_FILES) {
                downloaded.put(file.path(),
                        new RemoteFileDetails(first.downloadText(file.path()), file.permissions(), file.owner()));
            }
            login.getSetupDetails().setControlPlaneFiles(downloaded);
            ctx.saveLogin();
        }
    }

    /**
     * Pulls the node join command out of {@code kubeadm init} output. The
     * output mentions the command twice (control-plane then worker form);
     * the second one is used.
     *
     * @throws SetupException when the command cannot be found
     */
    static String extractJoinCommand(String initOutput) {
        int first = initOutput.indexOf(JOIN_COMMAND_MARKER);
        int start = first < 0 ? -1 : initOutput.indexOf(JOIN_COMMAND_MARKER, first + 1);
        if (start < 0) {
            throw new SetupException("Cannot locate the [kubeadm join ...] command in the [kubeadm init ...] response.");
        }
        return initOutput.substring(start).strip().replaceAll("[\\t\\n\\r\\\\]", "");
    }

    static String kubeadmConfig(ClusterDefinition cluster) {
        List<NodeDefinition> controlPlanes = cluster.controlPlanes();
        String endpoint = cluster.apiLoadBalancer() != null
                ? cluster.apiLoadBalancer()
                : controlPlanes.get(0).address() + ":6443";
        String certSans = controlPlanes.stream()
                .map(n -> "  - \"" + n.address() + "\"")
                .collect(Collectors.joining("\n"));

        return """
                apiVersion: kubeadm.k8s.io/v1beta3
                kind: ClusterConfiguration
                clusterName: %s
                kubernetesVersion: v%s
                controlPlaneEndpoint: "%s"
                networking:
                  podSubnet: "%s"
                  serviceSubnet: "%s"
                apiServer:
                  certSANs:
                %s
                ---
                apiVersion: kubelet.config.k8s.io/v1beta1
                kind: KubeletConfiguration
                cgroupDriver: systemd
                ---
                apiVersion: kubeproxy.config.k8s.io/v1alpha1
                kind: KubeProxyConfiguration
                mode: ipvs
                """.formatted(cluster.name(), cluster.kubernetesVersion(), endpoint,
                cluster.podSubnet(), cluster.serviceSubnet(), certSans);
    }

    static void joinControlPlane(SetupController<SetupContext> controller, NodeProxy node) throws Exception {
        SetupContext ctx = controller.context();

        controller.logProgress(node, "reset", "kubernetes");
        node.sudoCommand("kubeadm reset --force");

        controller.logProgress(node, "upload", "control-plane files");
        for (Map.Entry<String, RemoteFileDetails> file : ctx.login().getSetupDetails().getControlPlaneFiles().entrySet()) {
            RemoteFileDetails details = file.getValue();
            node.uploadText(file.getKey(), details.text(), details.permissions(), details.owner());
        }

        joinThroughEtcdProxy(controller, node, true);
    }

    static void configureApiServer(SetupController<SetupContext> controller, NodeProxy node) {
        controller.logProgress(node, "configure", "api server");
        node.sudoCommand("sed -i 's/.*--enable-admission-plugins=.*/    - --enable-admission-plugins="
                + "NamespaceLifecycle,LimitRanger,ServiceAccount,DefaultStorageClass,DefaultTolerationSeconds,"
                + "MutatingAdmissionWebhook,ValidatingAdmissionWebhook,Priority,ResourceQuota/' "
                + "/etc/kubernetes/manifests/kube-apiserver.yaml");
    }

    static void joinWorker(SetupController<SetupContext> controller, NodeProxy node) throws Exception {
        joinThroughEtcdProxy(controller, node, false);
    }

    /** The proxy container is removed whatever the join outcome. */
    private static void joinThroughEtcdProxy(SetupController<SetupContext> controller, NodeProxy node,
                                             boolean controlPlane) throws InterruptedException {
        SetupContext ctx = controller.context();
        String joinCommand = ctx.login().getSetupDetails().getClusterJoinCommand();
        if (joinCommand == null) {
            throw new SetupException("No cluster join command has been recorded.");
        }

        writeEtcdProxyConfig(ctx, node);
        node.sudoCommand("podman rm --force " + ETCD_PROXY_NAME + " >/dev/null 2>&1; podman run"
                + " --name=" + ETCD_PROXY_NAME
                + " --detach --restart=always"
                + " -v=" + ETCD_PROXY_CONFIG + ":/etc/haproxy/haproxy.cfg"
                + " --network=host --log-driver=k8s-file "
                + ETCD_PROXY_IMAGE);
        try {
            controller.logProgress(node, "join", controlPlane ? "as control plane" : "as worker");
            ctx.joiner().joinWithRetry(node, joinCommand, controlPlane);
            controller.logProgress(node, "joined", "to cluster");
        } finally {
            CommandResponse removed = node.trySudoCommand("podman rm --force " + ETCD_PROXY_NAME);
            if (!removed.success()) {
                log.warn("[{}] could not remove {}: {}", node.name(), ETCD_PROXY_NAME, removed.allText().strip());
            }
        }
    }

    static void writeEtcdProxyConfig(SetupContext ctx, NodeProxy node) {
        StringBuilder backends = new StringBuilder();
        for (NodeDefinition controlPlane : ctx.cluster().controlPlanes()) {
            backends.append("    server ").append(controlPlane.name()).append(' ')
                    .append(controlPlane.address()).append(":2379 check\n");
        }
        String config = """
                global
                    daemon
                defaults
                    mode tcp
                    timeout connect 5s
                    timeout client 1h
                    timeout server 1h
                frontend etcd
                    bind 127.0.0.1:2379
                    default_backend etcd-members
                backend etcd-members
                    balance roundrobin
                %s""".formatted(backends);
        node.uploadText(ETCD_PROXY_CONFIG, config, "644", "root:root");
    }

    // ------------------------------------------------------------------
    // Cluster configuration
    // ------------------------------------------------------------------

    /** Without workers, control-plane nodes must accept regular workloads. */
    static void configureTaint(SetupController<SetupContext> controller, NodeProxy node) {
        SetupContext ctx = controller.context();
        if (!ctx.cluster().workers().isEmpty()) {
            return;
        }
        controller.logProgress(node, "allow", "workloads on control plane");
        ctx.kubernetes().removeNodeTaint(node.name(), CONTROL_PLANE_TAINT);
    }

    static void labelNode(SetupController<SetupContext> controller, NodeProxy node) {
        Map<String, String> labels = new LinkedHashMap<>(node.definition().labels());
        labels.put("kubeforge.io/role", node.role().name().toLowerCase().replace('_', '-'));
        controller.logProgress(node, "label", "node");
        controller.context().kubernetes().labelNode(node.name(), labels);
    }

    static void installCni(SetupController<SetupContext> controller) throws InterruptedException {
        SetupContext ctx = controller.context();
        controller.logProgress("install", "cni");
        ctx.charts().install(CNI_CHART, "calico", "tigera-operator",
                Map.of("installation.calicoNetwork.ipPools[0].cidr", ctx.cluster().podSubnet()));
        ctx.workloads().waitForReady(WorkloadKind.DAEMONSET, "calico-system", "k8s-app=calico-node");
    }

    static void installMetricsServer(SetupController<SetupContext> controller) throws InterruptedException {
        SetupContext ctx = controller.context();
        controller.logProgress("install", "metrics server");
        ctx.charts().install(METRICS_SERVER_CHART, "metrics-server", "kube-system",
                Map.of("args[0]", "--kubelet-insecure-tls"));
        ctx.workloads().waitForReady(WorkloadKind.DEPLOYMENT, "kube-system", "app.kubernetes.io/name=metrics-server");
    }

    static void installStorage(SetupController<SetupContext> controller) throws InterruptedException {
        SetupContext ctx = controller.context();
        controller.logProgress("install", "storage");
        ctx.charts().install(STORAGE_CHART, "openebs", "openebs",
                Map.of("engines.replicated.mayastor.enabled", "false"));
        ctx.workloads().waitForReady(WorkloadKind.DEPLOYMENT, "openebs", null);
    }

    static void installMonitoring(SetupController<SetupContext> controller) throws InterruptedException {
        SetupContext ctx = controller.context();
        controller.logProgress("install", "monitoring");
        ctx.charts().install(MONITORING_CHART, "monitoring", "monitoring",
                Map.of("grafana.enabled", "true"));
        ctx.workloads().waitForReady(WorkloadKind.STATEFULSET, "monitoring", null);
    }

    /** Faulted nodes keep the login pending so the next run picks them up again. */
    static void finishSetup(SetupController<SetupContext> controller) {
        List<String> faulted = controller.nodes().stream()
                .filter(NodeProxy::isFaulted)
                .map(NodeProxy::name)
                .toList();
        if (!faulted.isEmpty()) {
            throw new SetupException("Cluster setup is incomplete: node(s) " + faulted + " faulted.");
        }
        SetupContext ctx = controller.context();
        ctx.login().getSetupDetails().setSetupPending(false);
        ctx.saveLogin();
        controller.logProgress("finished", "cluster setup");
    }
}
