package com.acme.invoicemail.core;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed settings shared by every invoice mail service, bound from the
 * {@code invoicemail.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "invoicemail")
public class InvoiceMailProperties {

    private Graph graph = new Graph();
    private Webhook webhook = new Webhook();
    private Subscription subscription = new Subscription();
    private Ingest ingest = new Ingest();
    private Filters filters = new Filters();
    private Dedup dedup = new Dedup();
    private RateLimit rateLimit = new RateLimit();
    private Resilience resilience = new Resilience();
    private Queues queues = new Queues();

    @Data
    public static class Graph {
        private String tenantId;
        private String clientId;
        private String clientSecret;
        private String mailbox;
        private String baseUrl = "https://graph.microsoft.com/v1.0";
        private String authorityUrl = "https://login.microsoftonline.com";
        private String scope = "https://graph.microsoft.com/.default";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration tokenRefreshSkew = Duration.ofMinutes(5);
        private long defaultRetryAfterSeconds = 60;
    }

    @Data
    public static class Webhook {
        private String notificationUrl;
        private String clientState;
        private int secretLogPrefixLength = 8;
    }

    @Data
    public static class Subscription {
        private boolean enabled = true;
        private String changeType = "created";
        private Duration lifetime = Duration.ofHours(70);
        private Duration renewalThreshold = Duration.ofHours(48);
        private long checkIntervalMs = 21_600_000L;
        private long initialDelayMs = 30_000L;
    }

    @Data
    public static class Ingest {
        private boolean enabled = true;
        private int maxResults = 50;
        private boolean requireAttachments = true;
        private long pollIntervalMs = 3_600_000L;
        private long initialDelayMs = 60_000L;
    }

    @Data
    public static class Filters {
        private String outboundSubjectPattern = "^Invoice:\\s+.+\\s+-\\s+GL\\s+\\d{4}$";
        private String replyPrefix = "re:";
        private String noticeMarker = "vendor registration";
    }

    @Data
    public static class Dedup {
        private boolean contentHashEnabled = true;
        private List<FingerprintField> fingerprintFields =
                new ArrayList<>(List.of(FingerprintField.SENDER, FingerprintField.SUBJECT, FingerprintField.DATE));
        private Duration lookback = Duration.ofDays(90);
        private Duration retention = Duration.ofDays(90);

        /**
         * Schedule of the retention sweep, UTC
         */
        private String retentionCron = "0 30 3 * * *";

        private int searchLimit = 100;
    }

    /**
     * Message attributes that may take part in the content fingerprint.
     */
    public enum FingerprintField {
        SENDER, SUBJECT, DATE
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private int limit = 100;
        private Duration window = Duration.ofMinutes(1);
        private Duration counterRetention = Duration.ofHours(1);
        private long purgeIntervalMs = 600_000L;
    }

    @Data
    public static class Resilience {
        private Map<String, Breaker> breakers = new LinkedHashMap<>();
    }

    @Data
    public static class Breaker {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);

        public Breaker() {
        }

        public Breaker(int failureThreshold, Duration resetTimeout) {
            this.failureThreshold = failureThreshold;
            this.resetTimeout = resetTimeout;
        }
    }

    @Data
    public static class Queues {
        private String webhookNotifications = "webhook-notifications";
        private String rawMail = "raw-mail";
        private int maxReceiveCount = 5;
        private String deadLetterSuffix = "-dlq";
    }
}
