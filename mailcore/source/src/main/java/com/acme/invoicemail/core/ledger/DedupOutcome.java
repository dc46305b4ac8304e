package com.acme.invoicemail.core.ledger;

/**
 * Result of a ledger claim.
 */
public enum DedupOutcome {

    /** First sighting; the caller owns the item. */
    NEW,

    /** The provider id was already claimed. */
    DUPLICATE_ITEM,

    /** Another item with the same content fingerprint was claimed within the lookback window. */
    DUPLICATE_CONTENT,

    /** The ledger could not be consulted; callers proceed as if NEW. */
    LEDGER_UNAVAILABLE;

    public boolean isDuplicate() {
        return this == DUPLICATE_ITEM || this == DUPLICATE_CONTENT;
    }
}
