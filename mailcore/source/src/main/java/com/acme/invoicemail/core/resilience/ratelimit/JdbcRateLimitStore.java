package com.acme.invoicemail.core.resilience.ratelimit;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * {@link RateLimitStore} over the rate_limit_counters table. Both statements
 * touch a single row and carry their own guard, so concurrent replicas never
 * count past the limit.
 */
@Repository
public class JdbcRateLimitStore implements RateLimitStore {

    private static final String INCREMENT_SQL = """
            UPDATE invoicemail.rate_limit_counters
            SET request_count = request_count + 1, last_request_at = ?
            WHERE client_key = ? AND window_start = ? AND request_count < ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO invoicemail.rate_limit_counters
            (client_key, window_start, request_count, last_request_at)
            VALUES (?, ?, 1, ?)
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcRateLimitStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean incrementIfBelow(String clientKey, Instant windowStart, int limit, Instant now) {
        if (increment(clientKey, windowStart, limit, now)) {
            return true;
        }
        if (limit <= 0) {
            return false;
        }
        try {
            jdbcTemplate.update(INSERT_SQL, clientKey, Timestamp.from(windowStart), Timestamp.from(now));
            return true;
        } catch (DuplicateKeyException e) {
            // the row exists: either full or created by a concurrent request
            return increment(clientKey, windowStart, limit, now);
        }
    }

    @Override
    public int deleteWindowsBefore(Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM invoicemail.rate_limit_counters WHERE window_start < ?",
                Timestamp.from(cutoff));
    }

    private boolean increment(String clientKey, Instant windowStart, int limit, Instant now) {
        return jdbcTemplate.update(INCREMENT_SQL,
                Timestamp.from(now), clientKey, Timestamp.from(windowStart), limit) == 1;
    }
}
