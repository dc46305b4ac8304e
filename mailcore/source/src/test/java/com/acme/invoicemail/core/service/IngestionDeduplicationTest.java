package com.acme.invoicemail.core.service;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.filter.MailFilterChain;
import com.acme.invoicemail.core.filter.NoticeReplyFilter;
import com.acme.invoicemail.core.filter.OutboundTemplateFilter;
import com.acme.invoicemail.core.filter.SenderIdentityFilter;
import com.acme.invoicemail.core.graph.MailProviderClient;
import com.acme.invoicemail.core.ledger.ContentFingerprinter;
import com.acme.invoicemail.core.ledger.DeduplicationLedger;
import com.acme.invoicemail.core.ledger.JdbcProcessedItemStore;
import com.acme.invoicemail.core.model.IngestionSource;
import com.acme.invoicemail.core.model.MailMessage;
import com.acme.invoicemail.core.model.RawMail;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Both ingestion paths through one real ledger: downstream sees each item once.
 */
class IngestionDeduplicationTest {

    private static final String MAILBOX = "invoices@example.com";

    private EmbeddedDatabase database;
    private MailProviderClient mailClient;
    private SqsService sqsService;
    private MailIngestionService service;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("db/migration/V1__invoice_mail_schema.sql")
                .build();
        InvoiceMailProperties properties = new InvoiceMailProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:45:00Z"), ZoneOffset.UTC);

        DeduplicationLedger ledger = new DeduplicationLedger(
                new JdbcProcessedItemStore(new JdbcTemplate(database)),
                new ContentFingerprinter(properties), properties, clock);
        MailFilterChain chain = new MailFilterChain(List.of(
                new SenderIdentityFilter(), new OutboundTemplateFilter(properties), new NoticeReplyFilter(properties)));

        mailClient = mock(MailProviderClient.class);
        sqsService = mock(SqsService.class);
        service = new MailIngestionService(chain, ledger, mailClient, sqsService, properties, clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void repeatedDeliveriesOfOneItem_forwardedOnce() {
        MailMessage message = invoice("msg-001", "2024-03-01T10:00:00Z");

        for (int i = 0; i < 6; i++) {
            service.ingest(message, MAILBOX, i % 2 == 0 ? IngestionSource.WEBHOOK : IngestionSource.POLL);
        }

        verify(sqsService, times(1)).sendMessage(eq("raw-mail"), any(), anyMap());
        verify(mailClient, times(6)).markAsRead(MAILBOX, "msg-001");
    }

    @Test
    void concurrentDeliveries_forwardedOnce() throws Exception {
        MailMessage message = invoice("msg-001", "2024-03-01T10:00:00Z");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<IngestResult>> tasks = new java.util.ArrayList<>();
            for (int i = 0; i < 16; i++) {
                IngestionSource source = i % 2 == 0 ? IngestionSource.WEBHOOK : IngestionSource.POLL;
                tasks.add(() -> service.ingest(message, MAILBOX, source));
            }
            long forwarded = 0;
            for (Future<IngestResult> future : pool.invokeAll(tasks)) {
                if (future.get() == IngestResult.FORWARDED) {
                    forwarded++;
                }
            }
            assertEquals(1, forwarded);
        } finally {
            pool.shutdownNow();
        }
        verify(sqsService, times(1)).sendMessage(eq("raw-mail"), any(), anyMap());
    }

    @Test
    void webhookThenContentIdenticalResendViaPoll_onlyFirstReachesDownstream() {
        service.ingest(invoice("msg-001", "2024-03-01T10:00:00Z"), MAILBOX, IngestionSource.WEBHOOK);
        IngestResult second = service.ingest(invoice("msg-002", "2024-03-01T10:30:00Z"), MAILBOX, IngestionSource.POLL);

        assertEquals(IngestResult.DUPLICATE, second);
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(sqsService, times(1)).sendMessage(eq("raw-mail"), payload.capture(), anyMap());
        assertEquals("msg-001", ((RawMail) payload.getValue()).getItemKey());
    }

    @Test
    void failedForward_isRetriedByRedeliveryAndNotLost() {
        // Given the first send to raw-mail fails
        MailMessage message = invoice("msg-001", "2024-03-01T10:00:00Z");
        when(sqsService.sendMessage(eq("raw-mail"), any(), anyMap()))
                .thenThrow(new IllegalStateException("sqs unavailable"))
                .thenReturn("sqs-msg-1");

        // When
        assertThrows(IllegalStateException.class, () -> service.ingest(message, MAILBOX, IngestionSource.WEBHOOK));
        IngestResult redelivery = service.ingest(message, MAILBOX, IngestionSource.WEBHOOK);
        IngestResult poll = service.ingest(message, MAILBOX, IngestionSource.POLL);

        // Then
        assertEquals(IngestResult.FORWARDED, redelivery);
        assertEquals(IngestResult.DUPLICATE, poll);
        verify(sqsService, times(2)).sendMessage(eq("raw-mail"), any(), anyMap());
        verify(mailClient, times(2)).markAsRead(MAILBOX, "msg-001");
    }

    @Test
    void failedForward_pollPicksItUp() {
        MailMessage message = invoice("msg-001", "2024-03-01T10:00:00Z");
        when(sqsService.sendMessage(eq("raw-mail"), any(), anyMap()))
                .thenThrow(new IllegalStateException("sqs unavailable"))
                .thenReturn("sqs-msg-1");

        assertThrows(IllegalStateException.class, () -> service.ingest(message, MAILBOX, IngestionSource.WEBHOOK));

        assertEquals(IngestResult.FORWARDED, service.ingest(message, MAILBOX, IngestionSource.POLL));
    }

    private static MailMessage invoice(String id, String receivedAt) {
        return MailMessage.builder()
                .id(id)
                .sender("billing@vendor.com")
                .subject("Invoice 4411 for March")
                .receivedAt(Instant.parse(receivedAt))
                .hasAttachments(true)
                .build();
    }
}
