package com.acme.invoicemail.core.exception;

/**
 * Failure talking to the mail provider API. Carries the HTTP status when
 * the provider answered, or 0 for transport failures.
 */
public class MailProviderException extends RuntimeException {

    private final int statusCode;

    public MailProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public MailProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
