package com.acme.invoicemail.subscription.store;

import com.acme.invoicemail.core.model.SubscriptionRecord;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of provider subscriptions.
 *
 * <p>The {@code active_resource} column carries the resource path while a
 * record is active and is cleared when it is superseded. Its unique
 * constraint keeps at most one active record per resource, so concurrent
 * writers race on the database rather than in memory.</p>
 */
@Repository
public class SubscriptionRecordStore {

    private static final String COLUMNS = """
            id, subscription_id, resource_ref, client_state_hint, expires_at,
            is_active, created_at, renewed_at""";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SubscriptionRecordStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public Optional<SubscriptionRecord> findActive(String resourceRef) {
        String sql = "SELECT " + COLUMNS + " FROM invoicemail.subscription_records WHERE active_resource = ?";
        List<SubscriptionRecord> results = jdbcTemplate.query(sql, rowMapper(), resourceRef);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Every record, newest first.
     */
    public List<SubscriptionRecord> findAll() {
        String sql = "SELECT " + COLUMNS + " FROM invoicemail.subscription_records ORDER BY created_at DESC, id DESC";
        return jdbcTemplate.query(sql, rowMapper());
    }

    /**
     * Inserts an active record.
     *
     * @return false if the resource already has an active record
     */
    public boolean insertActive(SubscriptionRecord record) {
        try {
            insert(record);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    /**
     * Marks a record inactive if it still is.
     *
     * @return false if another writer superseded it first
     */
    public boolean supersede(String id) {
        String sql = """
            UPDATE invoicemail.subscription_records
            SET is_active = FALSE, active_resource = NULL
            WHERE id = ? AND is_active = TRUE
            """;
        return jdbcTemplate.update(sql, id) == 1;
    }

    /**
     * Supersedes {@code currentId} and appends {@code replacement} in one
     * transaction. Nothing changes when the current record is no longer
     * active or another active record appeared meanwhile.
     *
     * @return false if this writer lost the race
     */
    public boolean replaceActive(String currentId, SubscriptionRecord replacement) {
        Boolean replaced = transactionTemplate.execute(status -> {
            if (!supersede(currentId)) {
                return false;
            }
            try {
                insert(replacement);
                return true;
            } catch (DuplicateKeyException e) {
                status.setRollbackOnly();
                return false;
            }
        });
        return Boolean.TRUE.equals(replaced);
    }

    private void insert(SubscriptionRecord record) {
        String sql = """
            INSERT INTO invoicemail.subscription_records
            (id, subscription_id, resource_ref, client_state_hint, expires_at,
             is_active, active_resource, created_at, renewed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
                record.getId(),
                record.getSubscriptionId(),
                record.getResourceRef(),
                record.getClientStateHint(),
                Timestamp.from(record.getExpiresAt()),
                record.isActive(),
                record.isActive() ? record.getResourceRef() : null,
                Timestamp.from(record.getCreatedAt()),
                record.getRenewedAt() != null ? Timestamp.from(record.getRenewedAt()) : null);
    }

    private RowMapper<SubscriptionRecord> rowMapper() {
        return (rs, rowNum) -> SubscriptionRecord.builder()
                .id(rs.getString("id"))
                .subscriptionId(rs.getString("subscription_id"))
                .resourceRef(rs.getString("resource_ref"))
                .clientStateHint(rs.getString("client_state_hint"))
                .expiresAt(toInstant(rs.getTimestamp("expires_at")))
                .active(rs.getBoolean("is_active"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .renewedAt(toInstant(rs.getTimestamp("renewed_at")))
                .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
