package com.kubeforge.orchestrator.kube;

/**
 * A Kubernetes API or chart operation failed.
 */
public class KubernetesException extends RuntimeException {

    public KubernetesException(String message) {
        super(message);
    }

    public KubernetesException(String message, Throwable cause) {
        super(message, cause);
    }
}
