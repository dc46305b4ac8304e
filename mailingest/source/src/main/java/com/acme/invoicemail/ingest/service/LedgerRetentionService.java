package com.acme.invoicemail.ingest.service;

import com.acme.invoicemail.core.ledger.DeduplicationLedger;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Daily sweep removing ledger rows past the retention period.
 */
@Service
public class LedgerRetentionService {

    private static final Logger log = LoggerFactory.getLogger(LedgerRetentionService.class);

    private final DeduplicationLedger ledger;

    public LedgerRetentionService(DeduplicationLedger ledger) {
        this.ledger = ledger;
    }

    @Scheduled(cron = "${invoicemail.dedup.retention-cron:0 30 3 * * *}", zone = "UTC")
    @SchedulerLock(name = "ledger-retention", lockAtLeastFor = "PT1M", lockAtMostFor = "PT30M")
    public void purge() {
        try {
            int removed = ledger.purgeExpired();
            log.info("Ledger retention completed: removed={}", removed);
        } catch (RuntimeException e) {
            log.error("Ledger retention failed, retrying next run: error={}", e.toString());
        }
    }
}
