package com.kubeforge.orchestrator.registry;

/**
 * The effect guarded by {@link StepRegistry#invokeIdempotent}.
 */
@FunctionalInterface
public interface StepBody {

    void run() throws Exception;
}
