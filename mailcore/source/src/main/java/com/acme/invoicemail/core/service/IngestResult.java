package com.acme.invoicemail.core.service;

/**
 * What the ingestion pipeline did with one message.
 */
public enum IngestResult {
    FORWARDED,
    SKIPPED,
    DUPLICATE
}
