package com.acme.invoicemail.core.model;

/**
 * Path through which an item entered the pipeline.
 */
public enum IngestionSource {
    WEBHOOK,
    POLL
}
