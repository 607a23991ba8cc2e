package com.kubeforge.orchestrator.login;

/**
 * A text file captured from one node so it can be written to others.
 *
 * @param permissions octal mode, e.g. "600"
 * @param owner       "user:group"
 */
public record RemoteFileDetails(String text, String permissions, String owner) {}
