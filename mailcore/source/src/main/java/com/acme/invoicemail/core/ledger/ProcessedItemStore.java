package com.acme.invoicemail.core.ledger;

import com.acme.invoicemail.core.model.ContentFingerprint;
import com.acme.invoicemail.core.model.ProcessedItemRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage behind the deduplication ledger. Writes are single-row
 * and conditional; there is no read-then-write.
 */
public interface ProcessedItemStore {

    /**
     * @return false if a record with the same item key already exists
     */
    boolean insertItemIfAbsent(ProcessedItemRecord record);

    /**
     * @return false if the fingerprint is already claimed
     */
    boolean insertFingerprintIfAbsent(ContentFingerprint fingerprint);

    Optional<ContentFingerprint> findFingerprint(String contentHash);

    /**
     * Hands an existing fingerprint to a new item, but only while its current
     * claim is still older than {@code claimedBefore}.
     *
     * @return true if this call took the claim
     */
    boolean reclaimFingerprint(ContentFingerprint fingerprint, Instant claimedBefore);

    Optional<ProcessedItemRecord> findItem(String itemKey);

    /**
     * @return false if no record had that key
     */
    boolean deleteItem(String itemKey);

    /**
     * Deletes the fingerprint only while {@code itemKey} still holds it.
     *
     * @return false if the fingerprint is absent or held by another item
     */
    boolean deleteFingerprintOwnedBy(String contentHash, String itemKey);

    /**
     * Newest first. Null or blank fragments are not filtered on.
     */
    List<ProcessedItemRecord> search(String senderFragment, String subjectFragment, int limit);

    int deleteItemsBefore(Instant cutoff);

    int deleteFingerprintsBefore(Instant cutoff);
}
