package com.kubeforge.orchestrator.node;

/**
 * Result of one remote command.
 *
 * A non-zero exit code is an ordinary result, not an exception: callers that
 * expect failures (join retries, probes) inspect {@link #success()}.
 */
public record CommandResponse(
        int    exitCode,
        String outputText,
        String errorText) {

    public CommandResponse {
        outputText = outputText == null ? "" : outputText;
        errorText  = errorText == null ? "" : errorText;
    }

    public static CommandResponse ok(String outputText) {
        return new CommandResponse(0, outputText, "");
    }

    public static CommandResponse failed(int exitCode, String errorText) {
        return new CommandResponse(exitCode, "", errorText);
    }

    public boolean success() {
        return exitCode == 0;
    }

    /** Combined stdout and stderr, for error messages and node logs. */
    public String allText() {
        if (errorText.isBlank()) return outputText;
        if (outputText.isBlank()) return errorText;
        return outputText.stripTrailing() + "\n" + errorText;
    }
}
