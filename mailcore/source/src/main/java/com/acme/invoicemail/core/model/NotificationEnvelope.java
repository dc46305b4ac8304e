package com.acme.invoicemail.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Queue message produced by the webhook receiver for every accepted
 * change notification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationEnvelope {

    /**
     * ULID assigned on receipt
     */
    private String id;

    private String subscriptionId;

    /**
     * Provider resource path, e.g. users/{mailbox}/messages/{id}
     */
    private String resourceRef;

    private String changeType;

    private Instant receivedAt;
}
