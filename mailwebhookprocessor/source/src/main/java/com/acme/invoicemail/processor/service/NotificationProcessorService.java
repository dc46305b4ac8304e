package com.acme.invoicemail.processor.service;

import com.acme.invoicemail.core.exception.InvalidNotificationException;
import com.acme.invoicemail.core.graph.GraphResourcePath;
import com.acme.invoicemail.core.graph.MailProviderClient;
import com.acme.invoicemail.core.model.IngestionSource;
import com.acme.invoicemail.core.model.MailMessage;
import com.acme.invoicemail.core.model.NotificationEnvelope;
import com.acme.invoicemail.core.service.IngestResult;
import com.acme.invoicemail.core.service.MailIngestionService;
import com.acme.invoicemail.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves a queued change notification into the mail it points at and
 * hands it to the ingestion pipeline.
 */
@Service
public class NotificationProcessorService {

    private static final Logger log = LoggerFactory.getLogger(NotificationProcessorService.class);

    private final MailProviderClient mailClient;
    private final MailIngestionService ingestionService;

    public NotificationProcessorService(MailProviderClient mailClient, MailIngestionService ingestionService) {
        this.mailClient = mailClient;
        this.ingestionService = ingestionService;
    }

    /**
     * @throws InvalidNotificationException if the envelope cannot be interpreted
     */
    public IngestResult process(String messageBody) {
        NotificationEnvelope envelope = parse(messageBody);

        GraphResourcePath.MessageRef ref;
        try {
            ref = GraphResourcePath.parseMessage(envelope.getResourceRef());
        } catch (IllegalArgumentException e) {
            throw new InvalidNotificationException(
                    "Unusable resource on envelope " + envelope.getId() + ": " + e.getMessage(), e);
        }

        log.info("Resolving notification: envelopeId={}, mailbox={}, itemKey={}",
                envelope.getId(), ref.mailbox(), ref.messageId());

        MailMessage message = mailClient.getMessage(ref.mailbox(), ref.messageId());
        IngestResult result = ingestionService.ingest(message, ref.mailbox(), IngestionSource.WEBHOOK);

        log.info("Notification processed: envelopeId={}, itemKey={}, result={}",
                envelope.getId(), ref.messageId(), result);
        return result;
    }

    private NotificationEnvelope parse(String messageBody) {
        NotificationEnvelope envelope;
        try {
            envelope = JsonUtils.fromJson(messageBody, NotificationEnvelope.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidNotificationException("Malformed notification envelope", e);
        }
        if (envelope == null) {
            throw new InvalidNotificationException("Empty notification envelope");
        }
        if (envelope.getResourceRef() == null || envelope.getResourceRef().isBlank()) {
            throw new InvalidNotificationException("Notification envelope " + envelope.getId() + " has no resourceRef");
        }
        return envelope;
    }
}
