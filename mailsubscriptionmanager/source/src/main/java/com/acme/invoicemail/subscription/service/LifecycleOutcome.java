package com.acme.invoicemail.subscription.service;

/**
 * Result of one lifecycle operation.
 */
public enum LifecycleOutcome {
    CREATED,
    RENEWED,
    UNCHANGED,
    /**
     * Another writer changed the active record first; nothing was written.
     */
    CONFLICT,
    /**
     * Provider or store failure; the next run retries.
     */
    FAILED
}
