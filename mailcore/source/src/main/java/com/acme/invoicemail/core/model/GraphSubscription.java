package com.acme.invoicemail.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Subscription as returned by the provider on create or renew.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphSubscription {

    private String id;
    private String resource;
    private String changeType;
    private String notificationUrl;
    private Instant expirationDateTime;
}
