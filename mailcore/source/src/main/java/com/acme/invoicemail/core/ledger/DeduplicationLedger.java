package com.acme.invoicemail.core.ledger;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.model.ContentFingerprint;
import com.acme.invoicemail.core.model.IngestionSource;
import com.acme.invoicemail.core.model.MailMessage;
import com.acme.invoicemail.core.model.ProcessedItemRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Idempotence ledger shared by the webhook and polling paths.
 *
 * <p>An item is claimed in two layers. The provider id is inserted if
 * absent; a second insert of the same id reports {@link DedupOutcome#DUPLICATE_ITEM}.
 * Then the content fingerprint is claimed the same way, so a resend under a
 * new id inside the lookback window reports {@link DedupOutcome#DUPLICATE_CONTENT}.
 * A fingerprint older than the window is taken over by a conditional update.</p>
 *
 * <p>Storage failures never block ingestion: the claim reports
 * {@link DedupOutcome#LEDGER_UNAVAILABLE} and the caller proceeds.</p>
 */
@Service
public class DeduplicationLedger {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationLedger.class);
    private static final DateTimeFormatter TIME_BUCKET =
            DateTimeFormatter.ofPattern("yyyyMM").withZone(ZoneOffset.UTC);

    private final ProcessedItemStore store;
    private final ContentFingerprinter fingerprinter;
    private final InvoiceMailProperties.Dedup settings;
    private final Clock clock;

    public DeduplicationLedger(
            ProcessedItemStore store,
            ContentFingerprinter fingerprinter,
            InvoiceMailProperties properties,
            Clock clock) {
        this.store = store;
        this.fingerprinter = fingerprinter;
        this.settings = properties.getDedup();
        this.clock = clock;
    }

    /**
     * Outcome of a claim together with the fingerprint that was computed.
     */
    public record ClaimResult(DedupOutcome outcome, String contentHash) {
    }

    public ClaimResult claim(MailMessage message, IngestionSource source) {
        String itemKey = message.getId();
        Instant now = clock.instant();
        String contentHash = settings.isContentHashEnabled() ? fingerprinter.fingerprint(message) : null;

        try {
            ProcessedItemRecord record = ProcessedItemRecord.builder()
                    .itemKey(itemKey)
                    .contentHash(contentHash)
                    .processedAt(now)
                    .timeBucket(TIME_BUCKET.format(now))
                    .source(source)
                    .sender(message.getSender())
                    .subject(message.getSubject())
                    .build();

            if (!store.insertItemIfAbsent(record)) {
                log.info("Duplicate item skipped: itemKey={}, source={}", itemKey, source);
                return new ClaimResult(DedupOutcome.DUPLICATE_ITEM, contentHash);
            }

            if (contentHash != null && !claimFingerprint(itemKey, contentHash, now)) {
                log.info("Duplicate content skipped: itemKey={}, contentHash={}, source={}",
                        itemKey, contentHash, source);
                return new ClaimResult(DedupOutcome.DUPLICATE_CONTENT, contentHash);
            }

            log.debug("Ledger claim granted: itemKey={}, source={}", itemKey, source);
            return new ClaimResult(DedupOutcome.NEW, contentHash);

        } catch (RuntimeException e) {
            log.warn("Ledger unavailable, continuing in degraded mode: itemKey={}, source={}, error={}",
                    itemKey, source, e.toString());
            return new ClaimResult(DedupOutcome.LEDGER_UNAVAILABLE, contentHash);
        }
    }

    /**
     * Gives back a claim whose item never reached downstream, so the next
     * delivery of the same item is treated as new. The fingerprint is only
     * removed while this item still holds it.
     *
     * @return false if the ledger could not be updated
     */
    public boolean release(String itemKey, String contentHash) {
        try {
            if (contentHash != null) {
                store.deleteFingerprintOwnedBy(contentHash, itemKey);
            }
            boolean removed = store.deleteItem(itemKey);
            log.info("Ledger claim released: itemKey={}, removed={}", itemKey, removed);
            return true;
        } catch (RuntimeException e) {
            log.error("Could not release ledger claim, item will be reported as duplicate: itemKey={}, error={}",
                    itemKey, e.toString());
            return false;
        }
    }

    public Optional<ProcessedItemRecord> find(String itemKey) {
        return store.findItem(itemKey);
    }

    public List<ProcessedItemRecord> search(String senderFragment, String subjectFragment) {
        return store.search(senderFragment, subjectFragment, settings.getSearchLimit());
    }

    /**
     * Deletes ledger rows older than the retention period.
     *
     * @return number of rows removed across both tables
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(settings.getRetention());
        int items = store.deleteItemsBefore(cutoff);
        int fingerprints = store.deleteFingerprintsBefore(cutoff);
        log.info("Ledger retention sweep: items={}, fingerprints={}, cutoff={}", items, fingerprints, cutoff);
        return items + fingerprints;
    }

    private boolean claimFingerprint(String itemKey, String contentHash, Instant now) {
        ContentFingerprint fingerprint = ContentFingerprint.builder()
                .contentHash(contentHash)
                .itemKey(itemKey)
                .firstSeenAt(now)
                .build();

        if (store.insertFingerprintIfAbsent(fingerprint)) {
            return true;
        }

        Instant windowStart = now.minus(settings.getLookback());
        Optional<ContentFingerprint> existing = store.findFingerprint(contentHash);
        if (existing.isEmpty()) {
            // purged between the insert and the read
            return store.insertFingerprintIfAbsent(fingerprint);
        }
        if (itemKey.equals(existing.get().getItemKey())) {
            return true;
        }
        if (!existing.get().getFirstSeenAt().isBefore(windowStart)) {
            return false;
        }
        return store.reclaimFingerprint(fingerprint, windowStart);
    }
}
