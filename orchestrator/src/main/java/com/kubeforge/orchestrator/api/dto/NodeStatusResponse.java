package com.kubeforge.orchestrator.api.dto;

import com.kubeforge.orchestrator.model.NodeRole;
import com.kubeforge.orchestrator.node.NodeFault;
import com.kubeforge.orchestrator.node.NodeProxy;

import java.time.Instant;

/**
 * Live view of one node. The fault fields are null while the node is healthy.
 */
public record NodeStatusResponse(
        String   name,
        NodeRole role,
        String   address,
        String   status,
        boolean  faulted,
        String   faultStep,
        String   faultMessage,
        Instant  faultedAt
) {
    public static NodeStatusResponse from(NodeProxy node) {
        NodeFault fault = node.getFault().orElse(null);
        return new NodeStatusResponse(
                node.name(),
                node.role(),
                node.address(),
                node.getStatus(),
                fault != null,
                fault == null ? null : fault.step(),
                fault == null ? null : fault.message(),
                fault == null ? null : fault.faultedAt()
        );
    }
}
