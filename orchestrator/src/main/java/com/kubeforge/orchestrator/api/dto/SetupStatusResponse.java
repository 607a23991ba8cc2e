package com.kubeforge.orchestrator.api.dto;

import com.kubeforge.orchestrator.setup.SetupController;
import com.kubeforge.orchestrator.setup.SetupRunResult;
import com.kubeforge.orchestrator.setup.SetupStep;

import java.util.List;

/**
 * Response body for GET /setup.
 *
 * state is one of PENDING (not run yet), RUNNING, SUCCEEDED, FAULTED (finished
 * with some nodes faulted) or FAILED (a global step aborted the run).
 */
public record SetupStatusResponse(
        String                  title,
        String                  state,
        String                  currentStep,
        String                  failedStep,
        int                     faultedNodes,
        List<SetupStepResponse> steps
) {
    public static SetupStatusResponse from(SetupController<?> controller) {
        SetupRunResult result  = controller.lastResult();
        SetupStep<?>   current = controller.currentStep();
        int faulted = (int) controller.nodes().stream().filter(n -> n.isFaulted()).count();
        return new SetupStatusResponse(
                controller.title(),
                stateOf(controller, result),
                current == null ? null : current.name(),
                result == null ? null : result.failedStep(),
                faulted,
                controller.steps().stream().map(SetupStepResponse::from).toList()
        );
    }

    private static String stateOf(SetupController<?> controller, SetupRunResult result) {
        if (controller.isRunning()) return "RUNNING";
        if (result == null)         return "PENDING";
        if (result.success())       return "SUCCEEDED";
        return result.isAborted() ? "FAILED" : "FAULTED";
    }
}
