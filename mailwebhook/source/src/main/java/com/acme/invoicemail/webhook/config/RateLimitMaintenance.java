package com.acme.invoicemail.webhook.config;

import com.acme.invoicemail.core.resilience.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Drops rate limit counters for windows that have long closed. Every
 * replica may run it; the delete is idempotent.
 */
@Configuration
@EnableScheduling
public class RateLimitMaintenance {

    private static final Logger log = LoggerFactory.getLogger(RateLimitMaintenance.class);

    private final RateLimiter rateLimiter;

    public RateLimitMaintenance(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${invoicemail.rate-limit.purge-interval-ms:600000}",
            initialDelayString = "${invoicemail.rate-limit.purge-interval-ms:600000}")
    public void purgeStaleCounters() {
        try {
            rateLimiter.purgeStaleCounters();
        } catch (RuntimeException e) {
            log.warn("Rate limit counter purge failed: error={}", e.getMessage());
        }
    }
}
