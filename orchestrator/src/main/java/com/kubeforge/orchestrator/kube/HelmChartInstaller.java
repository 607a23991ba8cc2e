package com.kubeforge.orchestrator.kube;

import com.kubeforge.orchestrator.node.CommandResponse;
import com.kubeforge.orchestrator.node.NodeProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * {@link ChartInstaller} that runs {@code helm upgrade --install} as root on a
 * control-plane node. Values are passed as {@code --set} arguments in key order.
 */
public class HelmChartInstaller implements ChartInstaller {

    private static final Logger log = LoggerFactory.getLogger(HelmChartInstaller.class);

    private final NodeProxy controlPlane;

    public HelmChartInstaller(NodeProxy controlPlane) {
        this.controlPlane = controlPlane;
    }

    @Override
    public void install(ChartReference chart, String releaseName, String namespace, Map<String, String> values) {
        String command = buildCommand(chart, releaseName, namespace, values);
        log.info("[{}] helm install {} ({} {}) into {}",
                controlPlane.name(), releaseName, chart.name(), chart.version(), namespace);

        CommandResponse response = controlPlane.trySudoCommand(command);
        if (!response.success()) {
            throw new KubernetesException("helm install of [" + releaseName + "] failed (exit "
                    + response.exitCode() + "): " + response.allText().strip());
        }
    }

    static String buildCommand(ChartReference chart, String releaseName, String namespace, Map<String, String> values) {
        StringBuilder sb = new StringBuilder("helm upgrade --install")
                .append(" --kubeconfig /etc/kubernetes/admin.conf")
                .append(" ").append(NodeProxy.quote(releaseName))
                .append(" ").append(NodeProxy.quote(chart.name()))
                .append(" --repo ").append(NodeProxy.quote(chart.repository()))
                .append(" --version ").append(NodeProxy.quote(chart.version()))
                .append(" --namespace ").append(NodeProxy.quote(namespace))
                .append(" --create-namespace");
        new TreeMap<>(values).forEach((key, value) ->
                sb.append(" --set ").append(NodeProxy.quote(key + "=" + value)));
        return sb.toString();
    }
}
