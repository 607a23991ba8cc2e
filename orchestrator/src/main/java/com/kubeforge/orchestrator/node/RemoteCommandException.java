package com.kubeforge.orchestrator.node;

/**
 * Thrown when the remote execution layer cannot reach a node or the node
 * agent returns a transport-level error.
 *
 * This is never a "command exited non-zero" signal; see {@link CommandResponse}.
 */
public class RemoteCommandException extends RuntimeException {

    /** HTTP status from the node agent, or -1 when no response was received. */
    private final int statusCode;

    public RemoteCommandException(String message) {
        this(message, -1, null);
    }

    public RemoteCommandException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public RemoteCommandException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() { return statusCode; }
}
