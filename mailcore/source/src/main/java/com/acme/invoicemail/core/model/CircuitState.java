package com.acme.invoicemail.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only snapshot of one circuit breaker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitState {

    private String name;

    /**
     * closed | open | half-open
     */
    private String state;

    private int failureCount;
    private int failureThreshold;
    private Instant openedAt;
}
