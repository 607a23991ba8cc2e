package com.kubeforge.orchestrator.api;

import com.kubeforge.orchestrator.api.dto.NodeStatusResponse;
import com.kubeforge.orchestrator.api.dto.SetupStatusResponse;
import com.kubeforge.orchestrator.setup.SetupController;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read-only progress API for the current cluster setup.
 *
 * GET /setup                 overall state and per-step state
 * GET /setup/nodes           status and fault of every node
 * GET /setup/nodes/{name}    one node
 *
 * All endpoints return 404 until a setup has been published.
 */
@RestController
@RequestMapping("/setup")
public class SetupStatusController {

    private final SetupMonitor monitor;

    public SetupStatusController(SetupMonitor monitor) {
        this.monitor = monitor;
    }

    @GetMapping
    public SetupStatusResponse getSetup() {
        return SetupStatusResponse.from(current());
    }

    @GetMapping("/nodes")
    public List<NodeStatusResponse> getNodes() {
        return current().nodes().stream()
                .map(NodeStatusResponse::from)
                .toList();
    }

    @GetMapping("/nodes/{name}")
    public NodeStatusResponse getNode(@PathVariable String name) {
        return current().nodes().stream()
                .filter(n -> n.name().equals(name))
                .findFirst()
                .map(NodeStatusResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Node not found: " + name));
    }

    private SetupController<?> current() {
        return monitor.current().orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "No cluster setup has been started"));
    }
}
