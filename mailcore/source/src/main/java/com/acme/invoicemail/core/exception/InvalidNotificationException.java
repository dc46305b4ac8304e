package com.acme.invoicemail.core.exception;

/**
 * Queued notification that cannot be interpreted. Thrown so the queue
 * redelivers and eventually dead-letters the message.
 */
public class InvalidNotificationException extends RuntimeException {

    public InvalidNotificationException(String message) {
        super(message);
    }

    public InvalidNotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
