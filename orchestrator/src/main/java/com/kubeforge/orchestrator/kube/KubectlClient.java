package com.kubeforge.orchestrator.kube;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubeforge.orchestrator.node.CommandResponse;
import com.kubeforge.orchestrator.node.NodeProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link KubernetesClient} that runs {@code kubectl} as root on a control-plane
 * node against its admin kubeconfig and parses the JSON output.
 */
public class KubectlClient implements KubernetesClient {

    private static final Logger log = LoggerFactory.getLogger(KubectlClient.class);

    static final String KUBECTL = "kubectl --kubeconfig=/etc/kubernetes/admin.conf";

    private final NodeProxy    controlPlane;
    private final ObjectMapper json;

    public KubectlClient(NodeProxy controlPlane, ObjectMapper json) {
        this.controlPlane = controlPlane;
        this.json         = json;
    }

    @Override
    public List<WorkloadStatus> listWorkloads(WorkloadKind kind, String namespace, String labelSelector) {
        StringBuilder command = new StringBuilder(KUBECTL)
                .append(" get ").append(kind.resource())
                .append(" -n ").append(NodeProxy.quote(namespace));
        if (labelSelector != null && !labelSelector.isBlank()) {
            command.append(" -l ").append(NodeProxy.quote(labelSelector));
        }
        command.append(" -o json");

        JsonNode items = readJson(kubectl(command.toString())).path("items");
        List<WorkloadStatus> result = new ArrayList<>();
        for (JsonNode item : items) {
            result.add(toStatus(kind, item));
        }
        return result;
    }

    @Override
    public void labelNode(String nodeName, Map<String, String> labels) {
        if (labels.isEmpty()) {
            return;
        }
        String pairs = labels.entrySet().stream()
                .map(e -> NodeProxy.quote(e.getKey() + "=" + e.getValue()))
                .collect(Collectors.joining(" "));
        kubectl(KUBECTL + " label node " + NodeProxy.quote(nodeName) + " " + pairs + " --overwrite");
    }

    @Override
    public void removeNodeTaint(String nodeName, String taint) {
        CommandResponse response = controlPlane.trySudoCommand(
                KUBECTL + " taint node " + NodeProxy.quote(nodeName) + " " + NodeProxy.quote(taint + "-"));
        if (!response.success()) {
            if (response.allText().contains("not found")) {
                log.debug("Taint {} not present on {}", taint, nodeName);
                return;
            }
            throw new KubernetesException("Failed to remove taint [" + taint + "] from node [" + nodeName + "]: "
                    + response.allText().strip());
        }
    }

    @Override
    public List<String> listNodeNames() {
        JsonNode items = readJson(kubectl(KUBECTL + " get nodes -o json")).path("items");
        List<String> names = new ArrayList<>();
        for (JsonNode item : items) {
            names.add(item.path("metadata").path("name").asText());
        }
        return names;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static WorkloadStatus toStatus(WorkloadKind kind, JsonNode item) {
        JsonNode metadata = item.path("metadata");
        JsonNode spec     = item.path("spec");
        JsonNode status   = item.path("status");

        int desired;
        int ready;
        switch (kind) {
            case DEPLOYMENT -> {
                desired = spec.path("replicas").asInt(1);
                ready   = status.path("availableReplicas").asInt(0);
            }
            case STATEFULSET -> {
                desired = spec.path("replicas").asInt(1);
                ready   = status.path("readyReplicas").asInt(0);
            }
            case DAEMONSET -> {
                desired = status.path("desiredNumberScheduled").asInt(0);
                ready   = status.path("numberAvailable").asInt(0);
            }
            default -> throw new IllegalArgumentException("Unsupported workload kind: " + kind);
        }
        return new WorkloadStatus(kind,
                metadata.path("namespace").asText(),
                metadata.path("name").asText(),
                desired, ready);
    }

    private String kubectl(String command) {
        CommandResponse response = controlPlane.trySudoCommand(command);
        if (!response.success()) {
            throw new KubernetesException("kubectl failed (exit " + response.exitCode() + "): "
                    + response.allText().strip());
        }
        return response.outputText();
    }

    private JsonNode readJson(String text) {
        try {
            return json.readTree(text);
        } catch (JsonProcessingException e) {
            throw new KubernetesException("Cannot parse kubectl output: " + e.getOriginalMessage(), e);
        }
    }
}
