package com.acme.invoicemail.core.ledger;

import com.acme.invoicemail.core.model.ContentFingerprint;
import com.acme.invoicemail.core.model.IngestionSource;
import com.acme.invoicemail.core.model.ProcessedItemRecord;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcProcessedItemStore implements ProcessedItemStore {

    private static final String ITEM_COLUMNS =
            "item_key, content_hash, processed_at, time_bucket, source, sender, subject";

    private final JdbcTemplate jdbcTemplate;

    public JdbcProcessedItemStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean insertItemIfAbsent(ProcessedItemRecord record) {
        String sql = """
            INSERT INTO invoicemail.processed_items
            (item_key, content_hash, processed_at, time_bucket, source, sender, subject)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                    record.getItemKey(),
                    record.getContentHash(),
                    Timestamp.from(record.getProcessedAt()),
                    record.getTimeBucket(),
                    record.getSource().name(),
                    truncate(record.getSender(), 320),
                    truncate(record.getSubject(), 1024));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public boolean insertFingerprintIfAbsent(ContentFingerprint fingerprint) {
        String sql = """
            INSERT INTO invoicemail.content_fingerprints (content_hash, item_key, first_seen_at)
            VALUES (?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                    fingerprint.getContentHash(),
                    fingerprint.getItemKey(),
                    Timestamp.from(fingerprint.getFirstSeenAt()));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public Optional<ContentFingerprint> findFingerprint(String contentHash) {
        String sql = """
            SELECT content_hash, item_key, first_seen_at
            FROM invoicemail.content_fingerprints
            WHERE content_hash = ?
            """;
        List<ContentFingerprint> results = jdbcTemplate.query(sql, fingerprintRowMapper(), contentHash);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean reclaimFingerprint(ContentFingerprint fingerprint, Instant claimedBefore) {
        String sql = """
            UPDATE invoicemail.content_fingerprints
            SET item_key = ?, first_seen_at = ?
            WHERE content_hash = ? AND first_seen_at < ?
            """;
        return jdbcTemplate.update(sql,
                fingerprint.getItemKey(),
                Timestamp.from(fingerprint.getFirstSeenAt()),
                fingerprint.getContentHash(),
                Timestamp.from(claimedBefore)) == 1;
    }

    @Override
    public Optional<ProcessedItemRecord> findItem(String itemKey) {
        String sql = "SELECT " + ITEM_COLUMNS + " FROM invoicemail.processed_items WHERE item_key = ?";
        List<ProcessedItemRecord> results = jdbcTemplate.query(sql, itemRowMapper(), itemKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ProcessedItemRecord> search(String senderFragment, String subjectFragment, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(ITEM_COLUMNS)
                .append(" FROM invoicemail.processed_items WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (senderFragment != null && !senderFragment.isBlank()) {
            sql.append(" AND LOWER(sender) LIKE ? ESCAPE '\\'");
            args.add(LikePatterns.contains(senderFragment.strip()));
        }
        if (subjectFragment != null && !subjectFragment.isBlank()) {
            sql.append(" AND LOWER(subject) LIKE ? ESCAPE '\\'");
            args.add(LikePatterns.contains(subjectFragment.strip()));
        }
        sql.append(" ORDER BY processed_at DESC LIMIT ?");
        args.add(limit);

        return jdbcTemplate.query(sql.toString(), itemRowMapper(), args.toArray());
    }

    @Override
    public boolean deleteItem(String itemKey) {
        return jdbcTemplate.update(
                "DELETE FROM invoicemail.processed_items WHERE item_key = ?", itemKey) == 1;
    }

    @Override
    public boolean deleteFingerprintOwnedBy(String contentHash, String itemKey) {
        return jdbcTemplate.update(
                "DELETE FROM invoicemail.content_fingerprints WHERE content_hash = ? AND item_key = ?",
                contentHash, itemKey) == 1;
    }

    @Override
    public int deleteItemsBefore(Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM invoicemail.processed_items WHERE processed_at < ?",
                Timestamp.from(cutoff));
    }

    @Override
    public int deleteFingerprintsBefore(Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM invoicemail.content_fingerprints WHERE first_seen_at < ?",
                Timestamp.from(cutoff));
    }

    private RowMapper<ProcessedItemRecord> itemRowMapper() {
        return (ResultSet rs, int rowNum) -> ProcessedItemRecord.builder()
                .itemKey(rs.getString("item_key"))
                .contentHash(rs.getString("content_hash"))
                .processedAt(toInstant(rs.getTimestamp("processed_at")))
                .timeBucket(rs.getString("time_bucket"))
                .source(IngestionSource.valueOf(rs.getString("source")))
                .sender(rs.getString("sender"))
                .subject(rs.getString("subject"))
                .build();
    }

    private RowMapper<ContentFingerprint> fingerprintRowMapper() {
        return (ResultSet rs, int rowNum) -> ContentFingerprint.builder()
                .contentHash(rs.getString("content_hash"))
                .itemKey(rs.getString("item_key"))
                .firstSeenAt(toInstant(rs.getTimestamp("first_seen_at")))
                .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
