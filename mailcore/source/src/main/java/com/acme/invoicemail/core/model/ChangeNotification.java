package com.acme.invoicemail.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single entry of a provider change-notification delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangeNotification {

    private String subscriptionId;
    private String resource;
    private String changeType;
    private String clientState;
    private String tenantId;
}
