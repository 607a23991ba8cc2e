package com.kubeforge.orchestrator.setup;

import com.kubeforge.orchestrator.node.NodeProxy;

/**
 * Receives real-time progress from a running controller.
 *
 * {@code node} is null for cluster-wide messages. Called from worker threads.
 */
public interface SetupProgressListener {

    void progress(NodeProxy node, String verb, String message);

    default void error(NodeProxy node, String message) {}
}
