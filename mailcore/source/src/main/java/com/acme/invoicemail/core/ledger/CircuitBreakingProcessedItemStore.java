package com.acme.invoicemail.core.ledger;

import com.acme.invoicemail.core.model.ContentFingerprint;
import com.acme.invoicemail.core.model.ProcessedItemRecord;
import com.acme.invoicemail.core.resilience.CircuitBreakerNames;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Guards ledger storage with the ledger-store breaker.
 */
@Primary
@Component
public class CircuitBreakingProcessedItemStore implements ProcessedItemStore {

    private final ProcessedItemStore delegate;
    private final CircuitBreaker circuitBreaker;

    @Autowired
    public CircuitBreakingProcessedItemStore(JdbcProcessedItemStore delegate, CircuitBreakerRegistry registry) {
        this(delegate, registry.circuitBreaker(CircuitBreakerNames.LEDGER_STORE));
    }

    CircuitBreakingProcessedItemStore(ProcessedItemStore delegate, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public boolean insertItemIfAbsent(ProcessedItemRecord record) {
        return circuitBreaker.executeSupplier(() -> delegate.insertItemIfAbsent(record));
    }

    @Override
    public boolean insertFingerprintIfAbsent(ContentFingerprint fingerprint) {
        return circuitBreaker.executeSupplier(() -> delegate.insertFingerprintIfAbsent(fingerprint));
    }

    @Override
    public Optional<ContentFingerprint> findFingerprint(String contentHash) {
        return circuitBreaker.executeSupplier(() -> delegate.findFingerprint(contentHash));
    }

    @Override
    public boolean reclaimFingerprint(ContentFingerprint fingerprint, Instant claimedBefore) {
        return circuitBreaker.executeSupplier(() -> delegate.reclaimFingerprint(fingerprint, claimedBefore));
    }

    @Override
    public Optional<ProcessedItemRecord> findItem(String itemKey) {
        return circuitBreaker.executeSupplier(() -> delegate.findItem(itemKey));
    }

    @Override
    public boolean deleteItem(String itemKey) {
        return circuitBreaker.executeSupplier(() -> delegate.deleteItem(itemKey));
    }

    @Override
    public boolean deleteFingerprintOwnedBy(String contentHash, String itemKey) {
        return circuitBreaker.executeSupplier(() -> delegate.deleteFingerprintOwnedBy(contentHash, itemKey));
    }

    @Override
    public List<ProcessedItemRecord> search(String senderFragment, String subjectFragment, int limit) {
        return circuitBreaker.executeSupplier(() -> delegate.search(senderFragment, subjectFragment, limit));
    }

    @Override
    public int deleteItemsBefore(Instant cutoff) {
        return circuitBreaker.executeSupplier(() -> delegate.deleteItemsBefore(cutoff));
    }

    @Override
    public int deleteFingerprintsBefore(Instant cutoff) {
        return circuitBreaker.executeSupplier(() -> delegate.deleteFingerprintsBefore(cutoff));
    }
}
