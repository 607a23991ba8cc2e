package com.kubeforge.orchestrator.setup;

import com.kubeforge.orchestrator.node.NodeProxy;

/**
 * Body of a step that runs once per eligible node.
 *
 * Invoked concurrently for different nodes; must only mutate state owned by
 * {@code node} or guarded shared state.
 *
 * @param <C> setup context type carried by the controller
 */
@FunctionalInterface
public interface NodeStepAction<C> {

    void run(SetupController<C> controller, NodeProxy node) throws Exception;
}
