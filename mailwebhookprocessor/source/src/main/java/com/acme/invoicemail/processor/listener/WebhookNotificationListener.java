package com.acme.invoicemail.processor.listener;

import com.acme.invoicemail.core.exception.ProviderThrottledException;
import com.acme.invoicemail.processor.service.NotificationProcessorService;
import io.awspring.cloud.sqs.annotation.SqsListener;
import io.awspring.cloud.sqs.listener.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

/**
 * SQS listener for the webhook-notifications queue.
 *
 * <p>Any failure is rethrown so the message returns to the queue and, after
 * the redrive limit, lands in the dead-letter queue. When the provider
 * throttles, the message stays invisible for the provider's Retry-After
 * hint before the next attempt.</p>
 */
@Component
public class WebhookNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationListener.class);

    private final NotificationProcessorService processorService;

    public WebhookNotificationListener(NotificationProcessorService processorService) {
        this.processorService = processorService;
    }

    @SqsListener(value = "${invoicemail.queues.webhook-notifications}")
    public void handleMessage(
            String messageBody,
            Visibility visibility,
            @Header(value = "envelopeId", required = false) String envelopeId) {

        try {
            processorService.process(messageBody);
        } catch (ProviderThrottledException e) {
            long retryAfter = e.getRetryAfterSeconds();
            log.warn("Provider throttled, delaying redelivery: envelopeId={}, retryAfter={}s", envelopeId, retryAfter);
            extendVisibility(visibility, retryAfter, envelopeId);
            throw e;
        } catch (RuntimeException e) {
            log.error("Error processing webhook notification: envelopeId={}", envelopeId, e);
            throw e;
        }
    }

    private void extendVisibility(Visibility visibility, long seconds, String envelopeId) {
        try {
            visibility.changeTo((int) Math.min(seconds, 43_200L));
        } catch (RuntimeException e) {
            log.warn("Could not extend visibility: envelopeId={}, error={}", envelopeId, e.getMessage());
        }
    }
}
