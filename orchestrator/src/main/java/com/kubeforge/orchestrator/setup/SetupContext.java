package com.kubeforge.orchestrator.setup;

import com.kubeforge.orchestrator.hosting.HostingManager;
import com.kubeforge.orchestrator.kube.ChartInstaller;
import com.kubeforge.orchestrator.kube.KubernetesClient;
import com.kubeforge.orchestrator.kube.WorkloadWaiter;
import com.kubeforge.orchestrator.login.ClusterLogin;
import com.kubeforge.orchestrator.login.ClusterLoginStore;
import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.node.NodeProxy;

/**
 * Shared state for the cluster setup steps, built once per controller.
 *
 * @param firstControlPlane the node that runs "kubeadm init" and hosts kubectl and helm
 */
public record SetupContext(
        ClusterDefinition cluster,
        HostingManager    hostingManager,
        ClusterLogin      login,
        ClusterLoginStore loginStore,
        SetupSettings     settings,
        NodeProxy         firstControlPlane,
        ClusterJoiner     joiner,
        KubernetesClient  kubernetes,
        ChartInstaller    charts,
        WorkloadWaiter    workloads,
        PrivilegeCheck    privilegeCheck) {

    public void saveLogin() {
        loginStore.save(login);
    }
}
