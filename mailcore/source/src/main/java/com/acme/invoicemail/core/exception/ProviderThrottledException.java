package com.acme.invoicemail.core.exception;

/**
 * Provider answered 429. {@link #getRetryAfterSeconds()} is the provider's
 * Retry-After hint, or the configured default when none was sent.
 */
public class ProviderThrottledException extends MailProviderException {

    private final long retryAfterSeconds;

    public ProviderThrottledException(String message, long retryAfterSeconds, Throwable cause) {
        super(message, 429, cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
