package com.acme.invoicemail.core.ledger;

import com.acme.invoicemail.core.model.ContentFingerprint;
import com.acme.invoicemail.core.model.IngestionSource;
import com.acme.invoicemail.core.model.ProcessedItemRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store against H2 with the production migration script.
 */
class JdbcProcessedItemStoreTest {

    private EmbeddedDatabase database;
    private JdbcProcessedItemStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("db/migration/V1__invoice_mail_schema.sql")
                .build();
        store = new JdbcProcessedItemStore(new JdbcTemplate(database));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void insertItemIfAbsent_secondInsertReturnsFalse() {
        ProcessedItemRecord record = item("msg-001", "billing@vendor.com", "Invoice 1", Instant.now());

        assertTrue(store.insertItemIfAbsent(record));
        assertFalse(store.insertItemIfAbsent(record));
        assertTrue(store.findItem("msg-001").isPresent());
    }

    @Test
    void findItem_roundTripsColumns() {
        Instant processedAt = Instant.parse("2024-03-01T10:00:00Z");
        store.insertItemIfAbsent(item("msg-001", "billing@vendor.com", "Invoice 1", processedAt));

        ProcessedItemRecord found = store.findItem("msg-001").orElseThrow();

        assertEquals("billing@vendor.com", found.getSender());
        assertEquals(processedAt, found.getProcessedAt());
        assertEquals("202403", found.getTimeBucket());
        assertEquals(IngestionSource.WEBHOOK, found.getSource());
    }

    @Test
    void reclaimFingerprint_onlyWhenOlderThanCutoff() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        ContentFingerprint first = fingerprint("hash-1", "msg-001", now.minus(10, ChronoUnit.DAYS));
        assertTrue(store.insertFingerprintIfAbsent(first));
        assertFalse(store.insertFingerprintIfAbsent(fingerprint("hash-1", "msg-002", now)));

        // claim is 10 days old, window starts 30 days back: not reclaimable
        assertFalse(store.reclaimFingerprint(fingerprint("hash-1", "msg-002", now), now.minus(30, ChronoUnit.DAYS)));
        // window starts 5 days back: reclaimable
        assertTrue(store.reclaimFingerprint(fingerprint("hash-1", "msg-002", now), now.minus(5, ChronoUnit.DAYS)));

        assertEquals("msg-002", store.findFingerprint("hash-1").orElseThrow().getItemKey());
    }

    @Test
    void search_escapesLikeMetacharacters() {
        Instant now = Instant.now();
        store.insertItemIfAbsent(item("msg-001", "billing@vendor.com", "Invoice 100% paid", now));
        store.insertItemIfAbsent(item("msg-002", "billing@vendor.com", "Invoice 1000 paid", now));
        store.insertItemIfAbsent(item("msg-003", "ops_team@acme.com", "Statement", now));
        store.insertItemIfAbsent(item("msg-004", "opsxteam@acme.com", "Statement", now));

        List<ProcessedItemRecord> percent = store.search(null, "100%", 10);
        List<ProcessedItemRecord> underscore = store.search("OPS_TEAM", null, 10);

        assertEquals(List.of("msg-001"), percent.stream().map(ProcessedItemRecord::getItemKey).toList());
        assertEquals(List.of("msg-003"), underscore.stream().map(ProcessedItemRecord::getItemKey).toList());
    }

    @Test
    void search_noFilters_newestFirstWithLimit() {
        Instant now = Instant.now();
        store.insertItemIfAbsent(item("old", "a@x.com", "s", now.minus(2, ChronoUnit.HOURS)));
        store.insertItemIfAbsent(item("mid", "a@x.com", "s", now.minus(1, ChronoUnit.HOURS)));
        store.insertItemIfAbsent(item("new", "a@x.com", "s", now));

        List<ProcessedItemRecord> results = store.search(" ", null, 2);

        assertEquals(List.of("new", "mid"), results.stream().map(ProcessedItemRecord::getItemKey).toList());
    }

    @Test
    void deleteBefore_removesOnlyExpiredRows() {
        Instant now = Instant.now();
        store.insertItemIfAbsent(item("expired", "a@x.com", "s", now.minus(100, ChronoUnit.DAYS)));
        store.insertItemIfAbsent(item("fresh", "a@x.com", "s", now));
        store.insertFingerprintIfAbsent(fingerprint("h-old", "expired", now.minus(100, ChronoUnit.DAYS)));
        store.insertFingerprintIfAbsent(fingerprint("h-new", "fresh", now));

        Instant cutoff = now.minus(90, ChronoUnit.DAYS);
        assertEquals(1, store.deleteItemsBefore(cutoff));
        assertEquals(1, store.deleteFingerprintsBefore(cutoff));

        assertTrue(store.findItem("expired").isEmpty());
        assertTrue(store.findItem("fresh").isPresent());
        assertTrue(store.findFingerprint("h-old").isEmpty());
    }

    private static ProcessedItemRecord item(String key, String sender, String subject, Instant processedAt) {
        return ProcessedItemRecord.builder()
                .itemKey(key)
                .contentHash("hash-" + key)
                .processedAt(processedAt)
                .timeBucket(java.time.format.DateTimeFormatter.ofPattern("yyyyMM")
                        .withZone(java.time.ZoneOffset.UTC).format(processedAt))
                .source(IngestionSource.WEBHOOK)
                .sender(sender)
                .subject(subject)
                .build();
    }

    private static ContentFingerprint fingerprint(String hash, String itemKey, Instant firstSeenAt) {
        return ContentFingerprint.builder().contentHash(hash).itemKey(itemKey).firstSeenAt(firstSeenAt).build();
    }
}
