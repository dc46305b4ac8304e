package com.acme.invoicemail.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Downstream payload placed on the raw-mail queue once an item is claimed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawMail {

    public static final String SCHEMA_VERSION = "1.0";

    private String id;
    private String itemKey;
    private String sender;
    private String subject;
    private Instant receivedAt;
    private boolean hasAttachments;
    private IngestionSource source;

    /**
     * Content fingerprint, null when the content layer is disabled
     */
    private String contentHash;

    private Instant queuedAt;

    @Builder.Default
    private String schemaVersion = SCHEMA_VERSION;
}
