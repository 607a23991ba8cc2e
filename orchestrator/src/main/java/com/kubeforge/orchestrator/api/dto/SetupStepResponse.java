package com.kubeforge.orchestrator.api.dto;

import com.kubeforge.orchestrator.model.SetupStepKind;
import com.kubeforge.orchestrator.model.SetupStepState;
import com.kubeforge.orchestrator.setup.SetupStep;

import java.time.Instant;

public record SetupStepResponse(
        String         name,
        String         key,
        SetupStepKind  kind,
        SetupStepState state,
        Instant        startedAt,
        Instant        finishedAt
) {
    public static SetupStepResponse from(SetupStep<?> step) {
        return new SetupStepResponse(
                step.name(),
                step.key(),
                step.kind(),
                step.state(),
                step.startedAt(),
                step.finishedAt()
        );
    }
}
