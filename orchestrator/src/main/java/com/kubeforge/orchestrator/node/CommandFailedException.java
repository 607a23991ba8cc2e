package com.kubeforge.orchestrator.node;

/**
 * Thrown by the checked command helpers on {@link NodeProxy} when a command
 * ran but exited non-zero.
 */
public class CommandFailedException extends RuntimeException {

    private final transient CommandResponse response;

    public CommandFailedException(String nodeName, String command, CommandResponse response) {
        super("[" + nodeName + "] command failed with exit code " + response.exitCode()
                + ": " + command + "\n" + response.allText().strip());
        this.response = response;
    }

    public CommandResponse getResponse() { return response; }
}
