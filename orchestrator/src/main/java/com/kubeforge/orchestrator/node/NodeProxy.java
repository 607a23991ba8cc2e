package com.kubeforge.orchestrator.node;

import com.kubeforge.orchestrator.model.NodeDefinition;
import com.kubeforge.orchestrator.model.NodeRole;
import com.kubeforge.orchestrator.registry.StepBody;
import com.kubeforge.orchestrator.registry.StepRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle for one cluster node during a setup run.
 *
 * Identity (name, address, role) is fixed. Status, fault and credentials are
 * mutable and written only by the task currently working on this node, so
 * each node keeps its own cells instead of sharing a lock with other nodes.
 *
 * Idempotent sub-steps go through the controller's shared {@link StepRegistry}
 * scoped by this node's name.
 */
public class NodeProxy {

    private static final Logger log = LoggerFactory.getLogger(NodeProxy.class);

    private final NodeDefinition definition;
    private final RemoteShell    shell;
    private final StepRegistry   registry;

    private volatile NodeCredentials credentials;
    private volatile String          status = "";
    private final AtomicReference<NodeFault> fault = new AtomicReference<>();

    public NodeProxy(NodeDefinition definition, RemoteShell shell, StepRegistry registry, NodeCredentials credentials) {
        this.definition  = Objects.requireNonNull(definition, "definition");
        this.shell       = Objects.requireNonNull(shell, "shell");
        this.registry    = Objects.requireNonNull(registry, "registry");
        this.credentials = credentials;
    }

    // ------------------------------------------------------------------
    // Identity
    // ------------------------------------------------------------------

    public String         name()           { return definition.name(); }
    public String         address()        { return definition.address(); }
    public NodeRole       role()           { return definition.role(); }
    public NodeDefinition definition()     { return definition; }
    public boolean        isControlPlane() { return definition.isControlPlane(); }
    public NodeCredentials credentials()   { return credentials; }

    public void updateCredentials(NodeCredentials credentials) {
        this.credentials = credentials;
    }

    // ------------------------------------------------------------------
    // Status and fault
    // ------------------------------------------------------------------

    public String getStatus() { return status; }

    /** Last writer wins; the value is for live progress display only. */
    public void setStatus(String status) {
        this.status = status == null ? "" : status;
        if (!this.status.isEmpty()) {
            log.debug("[{}] {}", name(), this.status);
        }
    }

    /** Records the first fault only; later faults for the same run are logged and dropped. */
    public void fault(NodeFault nodeFault) {
        if (!fault.compareAndSet(null, nodeFault)) {
            log.warn("[{}] already faulted, ignoring additional fault: {}", name(), nodeFault.message());
            return;
        }
        status = "fault: " + nodeFault.message();
    }

    public void fault(String step, String message) {
        fault(new NodeFault(step, message, null));
    }

    public boolean isFaulted() {
        return fault.get() != null;
    }

    public Optional<NodeFault> getFault() {
        return Optional.ofNullable(fault.get());
    }

    public void clearFault() {
        fault.set(null);
    }

    // ------------------------------------------------------------------
    // Idempotent sub-steps
    // ------------------------------------------------------------------

    /**
     * Run {@code body} once per node for {@code key}; see {@link StepRegistry#invokeIdempotent}.
     */
    public boolean invokeIdempotent(String key, StepBody body) throws Exception {
        return registry.invokeIdempotent(name(), key, body);
    }

    public boolean isStepComplete(String key) {
        return registry.isComplete(name(), key);
    }

    // ------------------------------------------------------------------
    // Remote execution
    // ------------------------------------------------------------------

    /** Runs a command and returns the response whatever the exit code. */
    public CommandResponse tryRunCommand(String command) {
        return shell.runCommand(this, command);
    }

    /** Runs a command as root and returns the response whatever the exit code. */
    public CommandResponse trySudoCommand(String command) {
        return shell.runCommand(this, sudo(command));
    }

    /**
     * Runs a command and throws {@link CommandFailedException} when it exits non-zero.
     */
    public CommandResponse runCommand(String command) {
        return ensureSuccess(command, tryRunCommand(command));
    }

    public CommandResponse sudoCommand(String command) {
        return ensureSuccess(command, trySudoCommand(command));
    }

    public void uploadText(String path, String content) {
        shell.uploadText(this, path, content, null, null);
    }

    public void uploadText(String path, String content, String permissions, String owner) {
        shell.uploadText(this, path, content, permissions, owner);
    }

    public String downloadText(String path) {
        return shell.downloadText(this, path);
    }

    public boolean fileExists(String path) {
        return tryRunCommand("test -f " + quote(path)).success();
    }

    /**
     * True when the node answers a no-op command. Transport failures mean
     * "not online yet" rather than an error.
     */
    public boolean isOnline() {
        try {
            return tryRunCommand("true").success();
        } catch (RemoteCommandException e) {
            log.trace("[{}] not reachable yet: {}", name(), e.getMessage());
            return false;
        }
    }

    @Override
    public String toString() {
        return name() + " (" + address() + ", " + role() + ")";
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CommandResponse ensureSuccess(String command, CommandResponse response) {
        if (!response.success()) {
            throw new CommandFailedException(name(), command, response);
        }
        return response;
    }

    private static String sudo(String command) {
        return "sudo bash -c " + quote(command);
    }

    /** Single-quotes a value for bash. */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
