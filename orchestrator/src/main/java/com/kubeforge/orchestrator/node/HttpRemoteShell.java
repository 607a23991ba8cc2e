package com.kubeforge.orchestrator.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubeforge.orchestrator.node.dto.CommandResult;
import com.kubeforge.orchestrator.node.dto.DownloadResult;
import com.kubeforge.orchestrator.retry.ErrorClass;
import com.kubeforge.orchestrator.retry.ErrorClassifier;
import com.kubeforge.orchestrator.retry.TransientRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@link RemoteShell} backed by the node agent, a small HTTP service listening
 * on every node.
 *
 * Endpoints (all POST, JSON in and out):
 * <pre>
 *   /command/run    {command, timeout_sec}            → {exit_code, stdout, stderr, elapsed_sec}
 *   /file/upload    {path, content, permissions, owner} → 2xx
 *   /file/download  {path}                            → {path, content}
 * </pre>
 * Credentials travel as HTTP basic auth. Transport failures are retried via
 * {@link TransientRetryPolicy} using this class's own {@link #classify}.
 * Commands are not idempotent, so {@code /command/run} is only retried when
 * the agent cannot have started it; see {@link #classifyCommand}.
 */
@Component
public class HttpRemoteShell implements RemoteShell, ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteShell.class);

    private static final Set<Integer> TRANSIENT_STATUS = Set.of(429, 502, 503, 504);

    /** Statuses the agent returns before it accepts a command. */
    private static final Set<Integer> COMMAND_REFUSED_STATUS = Set.of(429, 503);

    private final HttpClient           http;
    private final ObjectMapper         json;
    private final int                  agentPort;
    private final Duration             commandTimeout;
    private final TransientRetryPolicy retryPolicy;
    private final TransientRetryPolicy commandRetryPolicy;

    public HttpRemoteShell(
            @Value("${kubeforge.agent.port:7080}") int agentPort,
            @Value("${kubeforge.agent.request-timeout:30m}") Duration commandTimeout,
            ObjectMapper objectMapper) {
        this.agentPort      = agentPort;
        this.commandTimeout = commandTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.retryPolicy    = new TransientRetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(8), this);
        this.commandRetryPolicy = new TransientRetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(8),
                this::classifyCommand);
    }

    // ------------------------------------------------------------------
    // RemoteShell
    // ------------------------------------------------------------------

    @Override
    public CommandResponse runCommand(NodeProxy node, String command) {
        log.debug("[{}] run: {}", node.name(), command);
        String body = toJson(Map.of("command",     command,
                                    "timeout_sec", commandTimeout.toSeconds()));
        String respBody = post(node, "/command/run", body, "runCommand",
                commandTimeout.plusSeconds(30), commandRetryPolicy);
        try {
            return json.readValue(respBody, CommandResult.class).toResponse();
        } catch (JsonProcessingException e) {
            throw new RemoteCommandException("Failed to parse runCommand response from " + node.name(), e);
        }
    }

    @Override
    public void uploadText(NodeProxy node, String path, String content, String permissions, String owner) {
        log.debug("[{}] upload: {}", node.name(), path);
        Map<String, Object> request = new HashMap<>();
        request.put("path",    path);
        request.put("content", content);
        if (permissions != null) request.put("permissions", permissions);
        if (owner != null)       request.put("owner", owner);
        post(node, "/file/upload", toJson(request), "uploadText " + path, Duration.ofSeconds(120), retryPolicy);
    }

    @Override
    public String downloadText(NodeProxy node, String path) {
        log.debug("[{}] download: {}", node.name(), path);
        String respBody = post(node, "/file/download", toJson(Map.of("path", path)),
                "downloadText " + path, Duration.ofSeconds(120), retryPolicy);
        try {
            return json.readValue(respBody, DownloadResult.class).content();
        } catch (JsonProcessingException e) {
            throw new RemoteCommandException("Failed to parse downloadText response from " + node.name(), e);
        }
    }

    // ------------------------------------------------------------------
    // ErrorClassifier
    // ------------------------------------------------------------------

    /**
     * Connection failures, timeouts and gateway-style HTTP statuses are
     * transient; anything the agent rejected outright is fatal.
     */
    @Override
    public ErrorClass classify(Throwable error) {
        if (error instanceof RemoteCommandException rce) {
            if (rce.getStatusCode() > 0) {
                return TRANSIENT_STATUS.contains(rce.getStatusCode()) ? ErrorClass.TRANSIENT : ErrorClass.FATAL;
            }
            Throwable cause = rce.getCause();
            if (cause instanceof HttpTimeoutException || cause instanceof IOException) {
                return ErrorClass.TRANSIENT;
            }
        }
        return ErrorClass.FATAL;
    }

    /**
     * Narrower classification for {@code /command/run}. A timeout or a broken
     * connection after the request was sent may leave the command running
     * on the node, so only refused connections and agent-side refusals are
     * transient.
     */
    ErrorClass classifyCommand(Throwable error) {
        if (error instanceof RemoteCommandException rce) {
            if (rce.getStatusCode() > 0) {
                return COMMAND_REFUSED_STATUS.contains(rce.getStatusCode()) ? ErrorClass.TRANSIENT : ErrorClass.FATAL;
            }
            Throwable cause = rce.getCause();
            if (cause instanceof HttpConnectTimeoutException || cause instanceof ConnectException) {
                return ErrorClass.TRANSIENT;
            }
        }
        return ErrorClass.FATAL;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    URI endpoint(NodeProxy node, String path) {
        return URI.create("http://" + node.address() + ":" + agentPort + path);
    }

    private String post(NodeProxy node, String path, String jsonBody, String opName, Duration timeout,
                        TransientRetryPolicy policy) {
        String op = opName + " on " + node.name();
        try {
            return policy.invoke(op, () -> send(node, path, jsonBody, op, timeout));
        } catch (RemoteCommandException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCommandException(op + " interrupted", e);
        } catch (Exception e) {
            throw new RemoteCommandException(op + " failed", e);
        }
    }

    private String send(NodeProxy node, String path, String jsonBody, String op, Duration timeout) {
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(endpoint(node, path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
            NodeCredentials credentials = node.credentials();
            if (credentials != null && credentials.hasPassword()) {
                String token = credentials.username() + ":" + credentials.password();
                req.header("Authorization",
                        "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
            }
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new RemoteCommandException(
                        op + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                        resp.statusCode(), null);
            }
            return resp.body();
        } catch (RemoteCommandException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCommandException(op + " interrupted", e);
        } catch (Exception e) {
            throw new RemoteCommandException(op + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new RemoteCommandException("JSON serialization failed", e);
        }
    }
}
