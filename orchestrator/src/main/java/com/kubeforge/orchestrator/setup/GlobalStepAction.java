package com.kubeforge.orchestrator.setup;

/**
 * Body of a step that runs once for the whole cluster.
 *
 * @param <C> setup context type carried by the controller
 */
@FunctionalInterface
public interface GlobalStepAction<C> {

    void run(SetupController<C> controller) throws Exception;
}
