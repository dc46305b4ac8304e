package com.acme.invoicemail.webhook.service;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.model.ChangeNotification;
import com.acme.invoicemail.core.model.NotificationEnvelope;
import com.acme.invoicemail.core.service.SqsService;
import com.acme.invoicemail.core.util.SecretMasking;
import com.acme.invoicemail.core.util.UlidGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Verifies the shared secret on each change notification and enqueues the
 * valid ones for the notification processor. Does no item resolution.
 */
@Service
public class NotificationIntakeService {

    private static final Logger log = LoggerFactory.getLogger(NotificationIntakeService.class);

    private final SqsService sqsService;
    private final InvoiceMailProperties properties;
    private final Clock clock;

    public NotificationIntakeService(SqsService sqsService, InvoiceMailProperties properties, Clock clock) {
        this.sqsService = sqsService;
        this.properties = properties;
        this.clock = clock;
    }

    public record IntakeResult(int received, int enqueued, int rejected) {
    }

    public boolean isSecretConfigured() {
        String secret = properties.getWebhook().getClientState();
        return secret != null && !secret.isBlank();
    }

    /**
     * Enqueues every notification carrying the expected client state.
     * A queue failure propagates so the provider redelivers the batch.
     */
    public IntakeResult enqueue(List<ChangeNotification> notifications) {
        String expected = properties.getWebhook().getClientState();
        int prefixLength = properties.getWebhook().getSecretLogPrefixLength();
        Instant receivedAt = clock.instant();
        int enqueued = 0;
        int rejected = 0;

        for (ChangeNotification notification : notifications) {
            if (!secretMatches(expected, notification.getClientState())) {
                log.error("Invalid clientState on notification: subscriptionId={}, expected={}, received={}",
                        notification.getSubscriptionId(),
                        SecretMasking.prefix(expected, prefixLength),
                        SecretMasking.prefix(notification.getClientState(), prefixLength));
                rejected++;
                continue;
            }

            NotificationEnvelope envelope = NotificationEnvelope.builder()
                    .id(UlidGenerator.generate(receivedAt))
                    .subscriptionId(notification.getSubscriptionId())
                    .resourceRef(notification.getResource())
                    .changeType(notification.getChangeType())
                    .receivedAt(receivedAt)
                    .build();

            sqsService.sendMessage(properties.getQueues().getWebhookNotifications(), envelope,
                    Map.of("envelopeId", envelope.getId()));
            enqueued++;
            log.info("Queued webhook notification: envelopeId={}, subscriptionId={}, changeType={}",
                    envelope.getId(), envelope.getSubscriptionId(), envelope.getChangeType());
        }

        return new IntakeResult(notifications.size(), enqueued, rejected);
    }

    static boolean secretMatches(String expected, String received) {
        if (received == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                received.getBytes(StandardCharsets.UTF_8));
    }
}
