package com.acme.invoicemail.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger row proving an item was handed downstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedItemRecord {

    private String itemKey;
    private String contentHash;
    private Instant processedAt;

    /**
     * yyyyMM of processedAt
     */
    private String timeBucket;

    private IngestionSource source;
    private String sender;
    private String subject;
}
