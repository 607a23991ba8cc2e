package com.kubeforge.orchestrator.kube;

import java.util.Map;

/**
 * Installs packaged charts into the cluster.
 */
public interface ChartInstaller {

    /**
     * Installs or upgrades {@code chart} as {@code releaseName} in {@code namespace},
     * creating the namespace when missing.
     *
     * @throws KubernetesException when the install fails
     */
    void install(ChartReference chart, String releaseName, String namespace, Map<String, String> values);
}
