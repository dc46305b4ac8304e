package com.acme.invoicemail.core.service;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.filter.FilterDecision;
import com.acme.invoicemail.core.filter.MailFilterChain;
import com.acme.invoicemail.core.graph.MailProviderClient;
import com.acme.invoicemail.core.ledger.DedupOutcome;
import com.acme.invoicemail.core.ledger.DeduplicationLedger;
import com.acme.invoicemail.core.model.IngestionSource;
import com.acme.invoicemail.core.model.MailMessage;
import com.acme.invoicemail.core.model.RawMail;
import com.acme.invoicemail.core.util.UlidGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Pipeline shared by the webhook processor and the fallback poller:
 * loop-prevention filters, attachment check, ledger claim, then forward to
 * the raw-mail queue. Every handled message is marked read; a message whose
 * forward fails keeps no ledger claim and stays unread.
 */
@Service
public class MailIngestionService {

    private static final Logger log = LoggerFactory.getLogger(MailIngestionService.class);

    private final MailFilterChain filterChain;
    private final DeduplicationLedger ledger;
    private final MailProviderClient mailClient;
    private final SqsService sqsService;
    private final InvoiceMailProperties properties;
    private final Clock clock;

    public MailIngestionService(
            MailFilterChain filterChain,
            DeduplicationLedger ledger,
            MailProviderClient mailClient,
            SqsService sqsService,
            InvoiceMailProperties properties,
            Clock clock) {
        this.filterChain = filterChain;
        this.ledger = ledger;
        this.mailClient = mailClient;
        this.sqsService = sqsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param mailbox mailbox segment used for provider calls; may be the
     *                mailbox id rather than its address
     */
    public IngestResult ingest(MailMessage message, String mailbox, IngestionSource source) {
        String itemKey = message.getId();

        FilterDecision decision = filterChain.evaluate(message, systemMailbox(mailbox));
        if (decision.isSkip()) {
            mailClient.markAsRead(mailbox, itemKey);
            return IngestResult.SKIPPED;
        }

        if (properties.getIngest().isRequireAttachments() && !message.isHasAttachments()) {
            log.info("Message without attachments skipped: itemKey={}, source={}", itemKey, source);
            mailClient.markAsRead(mailbox, itemKey);
            return IngestResult.SKIPPED;
        }

        DeduplicationLedger.ClaimResult claim = ledger.claim(message, source);
        if (claim.outcome().isDuplicate()) {
            mailClient.markAsRead(mailbox, itemKey);
            return IngestResult.DUPLICATE;
        }

        RawMail rawMail = RawMail.builder()
                .id(UlidGenerator.generate())
                .itemKey(itemKey)
                .sender(message.getSender())
                .subject(message.getSubject())
                .receivedAt(message.getReceivedAt())
                .hasAttachments(message.isHasAttachments())
                .source(source)
                .contentHash(claim.contentHash())
                .queuedAt(Instant.now(clock))
                .build();

        try {
            sqsService.sendMessage(properties.getQueues().getRawMail(), rawMail,
                    Map.of("itemKey", itemKey, "source", source.name()));
        } catch (RuntimeException e) {
            log.error("Forward failed, releasing ledger claim: itemKey={}, source={}", itemKey, source);
            ledger.release(itemKey, claim.contentHash());
            throw e;
        }
        mailClient.markAsRead(mailbox, itemKey);

        log.info("Message forwarded: itemKey={}, rawMailId={}, source={}, ledger={}",
                itemKey, rawMail.getId(), source, claim.outcome());
        if (claim.outcome() == DedupOutcome.LEDGER_UNAVAILABLE) {
            log.warn("Forwarded without ledger record: itemKey={}, source={}", itemKey, source);
        }
        return IngestResult.FORWARDED;
    }

    private String systemMailbox(String fallback) {
        String configured = properties.getGraph().getMailbox();
        return configured != null && !configured.isBlank() ? configured : fallback;
    }
}
