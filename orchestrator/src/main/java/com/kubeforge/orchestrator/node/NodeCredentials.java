package com.kubeforge.orchestrator.node;

/**
 * Login used by the remote execution layer. Exactly one of password or
 * private key is normally set.
 */
public record NodeCredentials(String username, String password, String privateKeyPem) {

    public static NodeCredentials fromPassword(String username, String password) {
        return new NodeCredentials(username, password, null);
    }

    public static NodeCredentials fromPrivateKey(String username, String privateKeyPem) {
        return new NodeCredentials(username, null, privateKeyPem);
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "NodeCredentials[username=" + username
                + (hasPassword() ? ", password=***" : "")
                + (privateKeyPem != null ? ", privateKey=***" : "") + "]";
    }
}
