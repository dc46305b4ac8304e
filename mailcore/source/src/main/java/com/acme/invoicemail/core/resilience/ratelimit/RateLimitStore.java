package com.acme.invoicemail.core.resilience.ratelimit;

import java.time.Instant;

/**
 * Durable per-client request counters for fixed windows.
 */
public interface RateLimitStore {

    /**
     * Atomically counts one request for the client in the given window,
     * unless the window already holds {@code limit} requests.
     *
     * @return true if the request was counted
     */
    boolean incrementIfBelow(String clientKey, Instant windowStart, int limit, Instant now);

    /**
     * Removes counters for windows that started before {@code cutoff}.
     */
    int deleteWindowsBefore(Instant cutoff);
}
