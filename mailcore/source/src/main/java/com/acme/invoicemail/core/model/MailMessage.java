package com.acme.invoicemail.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Mailbox message as resolved from the provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailMessage {

    private String id;
    private String sender;
    private String subject;
    private Instant receivedAt;
    private boolean hasAttachments;
    private boolean read;
}
