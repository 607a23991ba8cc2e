package com.kubeforge.orchestrator.node.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kubeforge.orchestrator.node.CommandResponse;

/**
 * Response from the node agent's POST /command/run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandResult(
        int    exit_code,
        String stdout,
        String stderr,
        double elapsed_sec
) {
    public CommandResponse toResponse() {
        return new CommandResponse(exit_code, stdout, stderr);
    }
}
