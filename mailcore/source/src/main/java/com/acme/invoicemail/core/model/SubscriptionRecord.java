package com.acme.invoicemail.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of the append-only subscription history. At most one record per
 * resource is active.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionRecord {

    private String id;

    /**
     * Provider-assigned id, shared by every record a renewal produces
     */
    private String subscriptionId;

    private String resourceRef;
    private String clientStateHint;
    private Instant expiresAt;
    private boolean active;
    private Instant createdAt;
    private Instant renewedAt;
}
