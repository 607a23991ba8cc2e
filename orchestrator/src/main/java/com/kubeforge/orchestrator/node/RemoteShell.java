package com.kubeforge.orchestrator.node;

/**
 * Remote execution layer: runs commands and moves text files on a node.
 *
 * All methods block for the duration of the remote operation and are called
 * concurrently for different nodes. Transport failures raise
 * {@link RemoteCommandException}; a command that ran and failed is reported
 * through {@link CommandResponse#exitCode()}.
 */
public interface RemoteShell {

    CommandResponse runCommand(NodeProxy node, String command);

    /**
     * @param permissions octal mode such as "600", or null to keep the default
     * @param owner       "user:group", or null to keep the default
     */
    void uploadText(NodeProxy node, String path, String content, String permissions, String owner);

    String downloadText(NodeProxy node, String path);
}
