package com.acme.invoicemail.ingest.service;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.exception.ProviderThrottledException;
import com.acme.invoicemail.core.graph.MailProviderClient;
import com.acme.invoicemail.core.model.IngestionSource;
import com.acme.invoicemail.core.model.MailMessage;
import com.acme.invoicemail.core.service.IngestResult;
import com.acme.invoicemail.core.service.MailIngestionService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fallback scan of the invoice mailbox.
 *
 * <p>Picks up anything the webhook path missed: notifications that never
 * arrived, an expired subscription, a dead-lettered envelope. Every unread
 * message goes through the same ingestion pipeline, so items already
 * forwarded by the webhook path are recognised by the ledger and only
 * marked read.</p>
 *
 * <p>Runs under a ShedLock lock; a replica that does not get the lock skips
 * the tick.</p>
 */
@Service
public class MailPollerService {

    private static final Logger log = LoggerFactory.getLogger(MailPollerService.class);

    private final MailProviderClient mailClient;
    private final MailIngestionService ingestionService;
    private final InvoiceMailProperties properties;

    public MailPollerService(
            MailProviderClient mailClient,
            MailIngestionService ingestionService,
            InvoiceMailProperties properties) {
        this.mailClient = mailClient;
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    /**
     * Counters for one scan.
     */
    public record PollResult(int scanned, int forwarded, int skipped, int duplicates, int failed) {

        static PollResult empty() {
            return new PollResult(0, 0, 0, 0, 0);
        }
    }

    @Scheduled(
            initialDelayString = "${invoicemail.ingest.initial-delay-ms:60000}",
            fixedDelayString = "${invoicemail.ingest.poll-interval-ms:3600000}")
    @SchedulerLock(name = "mail-poller", lockAtLeastFor = "PT10S", lockAtMostFor = "PT15M")
    public void scheduledPoll() {
        if (!properties.getIngest().isEnabled()) {
            log.debug("Fallback poller disabled");
            return;
        }
        try {
            poll();
        } catch (RuntimeException e) {
            log.error("Fallback poll failed, retrying next tick: error={}", e.toString());
        }
    }

    /**
     * Scans the mailbox once.
     *
     * @throws com.acme.invoicemail.core.exception.MailProviderException if the unread list cannot be read
     */
    public PollResult poll() {
        String mailbox = properties.getGraph().getMailbox();
        if (mailbox == null || mailbox.isBlank()) {
            log.warn("No mailbox configured, skipping fallback poll");
            return PollResult.empty();
        }

        int maxResults = properties.getIngest().getMaxResults();
        List<MailMessage> unread = mailClient.listUnreadMessages(mailbox, maxResults);
        if (unread.isEmpty()) {
            log.debug("Fallback poll found no unread mail: mailbox={}", mailbox);
            return PollResult.empty();
        }

        log.info("Fallback poll started: mailbox={}, unread={}", mailbox, unread.size());

        int scanned = 0;
        int forwarded = 0;
        int skipped = 0;
        int duplicates = 0;
        int failed = 0;

        for (MailMessage message : unread) {
            scanned++;
            try {
                IngestResult result = ingestionService.ingest(message, mailbox, IngestionSource.POLL);
                switch (result) {
                    case FORWARDED -> forwarded++;
                    case SKIPPED -> skipped++;
                    case DUPLICATE -> duplicates++;
                }
            } catch (ProviderThrottledException e) {
                failed++;
                log.warn("Provider throttled, stopping batch: itemKey={}, retryAfter={}s, remaining={}",
                        message.getId(), e.getRetryAfterSeconds(), unread.size() - scanned);
                break;
            } catch (CallNotPermittedException e) {
                failed++;
                log.warn("Circuit open, stopping batch: itemKey={}, remaining={}",
                        message.getId(), unread.size() - scanned);
                break;
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to ingest polled message: itemKey={}", message.getId(), e);
            }
        }

        PollResult result = new PollResult(scanned, forwarded, skipped, duplicates, failed);
        log.info("Fallback poll completed: mailbox={}, scanned={}, forwarded={}, skipped={}, duplicates={}, failed={}",
                mailbox, scanned, forwarded, skipped, duplicates, failed);
        return result;
    }
}
