package com.kubeforge.orchestrator.registry;

import java.util.Objects;

/**
 * Composite completion key: a scope (the global token or a node name) plus
 * the step's idempotency key.
 *
 * Keys are persisted in the cluster-login file, so both parts must stay
 * stable across releases for resume to work.
 */
public record StepKey(String scope, String key) {

    /** Scope token for steps that run once for the whole cluster. */
    public static final String GLOBAL_SCOPE = "*global*";

    public StepKey {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(key, "key");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Step key must not be blank");
        }
    }

    public static StepKey global(String key) {
        return new StepKey(GLOBAL_SCOPE, key);
    }

    public static StepKey node(String nodeName, String key) {
        return new StepKey(nodeName, key);
    }

    /**
     * Parses the {@code scope:key} form produced by {@link #toString()}.
     * The scope never contains a colon, so the first one separates the parts.
     */
    public static StepKey parse(String text) {
        int colon = text.indexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new IllegalArgumentException("Not a step key: '" + text + "'");
        }
        return new StepKey(text.substring(0, colon), text.substring(colon + 1));
    }

    public boolean isGlobal() {
        return GLOBAL_SCOPE.equals(scope);
    }

    @Override
    public String toString() {
        return scope + ":" + key;
    }
}
