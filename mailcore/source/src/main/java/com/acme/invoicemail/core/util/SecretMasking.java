package com.acme.invoicemail.core.util;

/**
 * Renders secrets for log lines.
 */
public final class SecretMasking {

    private SecretMasking() {
    }

    /**
     * First {@code length} characters followed by an ellipsis, or a marker
     * when the value is absent.
     */
    public static String prefix(String secret, int length) {
        if (secret == null) {
            return "<none>";
        }
        return secret.substring(0, Math.min(length, secret.length())) + "...";
    }
}
