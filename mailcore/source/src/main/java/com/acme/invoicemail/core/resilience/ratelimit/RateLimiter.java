package com.acme.invoicemail.core.resilience.ratelimit;

import com.acme.invoicemail.core.InvoiceMailProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Fixed-window request limiter keyed by client. Fails open: when the
 * counter store cannot be reached the request is allowed.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /**
     * Width of rate_limit_counters.client_key
     */
    static final int MAX_CLIENT_KEY_LENGTH = 128;

    private final RateLimitStore store;
    private final InvoiceMailProperties.RateLimit settings;
    private final Clock clock;

    public RateLimiter(RateLimitStore store, InvoiceMailProperties properties, Clock clock) {
        this.store = store;
        this.settings = properties.getRateLimit();
        this.clock = clock;
    }

    public boolean tryAcquire(String requestedKey) {
        if (!settings.isEnabled()) {
            return true;
        }
        String clientKey = boundedKey(requestedKey);
        Instant now = clock.instant();
        Instant windowStart = windowStart(now);
        try {
            boolean allowed = store.incrementIfBelow(clientKey, windowStart, settings.getLimit(), now);
            if (!allowed) {
                log.warn("Rate limit exceeded: clientKey={}, limit={}, windowStart={}",
                        clientKey, settings.getLimit(), windowStart);
            }
            return allowed;
        } catch (RuntimeException e) {
            log.warn("Rate limiter store unavailable, allowing request: clientKey={}, error={}",
                    clientKey, e.getMessage());
            return true;
        }
    }

    /**
     * Whole seconds until the current window closes, at least 1.
     */
    public long retryAfterSeconds() {
        Instant now = clock.instant();
        Instant windowEnd = windowStart(now).plus(settings.getWindow());
        long millis = windowEnd.toEpochMilli() - now.toEpochMilli();
        return Math.max(1, (millis + 999) / 1000);
    }

    public int purgeStaleCounters() {
        Instant cutoff = clock.instant().minus(settings.getCounterRetention());
        int removed = store.deleteWindowsBefore(cutoff);
        if (removed > 0) {
            log.info("Purged rate limit counters: removed={}, cutoff={}", removed, cutoff);
        }
        return removed;
    }

    static String boundedKey(String clientKey) {
        if (clientKey == null || clientKey.isEmpty()) {
            return "unknown";
        }
        return clientKey.length() <= MAX_CLIENT_KEY_LENGTH ? clientKey : clientKey.substring(0, MAX_CLIENT_KEY_LENGTH);
    }

    Instant windowStart(Instant now) {
        long windowMillis = settings.getWindow().toMillis();
        long epochMillis = now.toEpochMilli();
        return Instant.ofEpochMilli(epochMillis - Math.floorMod(epochMillis, windowMillis));
    }
}
