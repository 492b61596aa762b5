package com.mgmt.session.auth.server.store;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Persistent application settings, as far as session tokens are concerned.
 */
@Getter
@Setter
@NoArgsConstructor
public class Settings {

    /** Durable secret for kubeconfig-scoped tokens, {@code null} until first bootstrap. */
    private byte[] kubeSecretKey;

    /** Extension deployments get tokens that practically never expire. */
    private boolean extensionMode;

    /** Lifetime of kubeconfig tokens, {@code "0"} for tokens that never expire. */
    private String kubeconfigExpiry = "0";

    public Settings copy() {
        Settings copy = new Settings();
        copy.kubeSecretKey = kubeSecretKey == null ? null : kubeSecretKey.clone();
        copy.extensionMode = extensionMode;
        copy.kubeconfigExpiry = kubeconfigExpiry;
        return copy;
    }
}
