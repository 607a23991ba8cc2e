package com.kubeforge.orchestrator.kube;

/**
 * A chart in a remote chart repository, pinned to one version.
 */
public record ChartReference(String repository, String name, String version) {}
