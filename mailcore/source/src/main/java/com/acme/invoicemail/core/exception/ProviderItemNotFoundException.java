package com.acme.invoicemail.core.exception;

public class ProviderItemNotFoundException extends MailProviderException {

    public ProviderItemNotFoundException(String message, Throwable cause) {
        super(message, 404, cause);
    }
}
