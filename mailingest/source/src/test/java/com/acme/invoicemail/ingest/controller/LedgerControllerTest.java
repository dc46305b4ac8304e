package com.acme.invoicemail.ingest.controller;

import com.acme.invoicemail.core.ledger.DeduplicationLedger;
import com.acme.invoicemail.core.model.IngestionSource;
import com.acme.invoicemail.core.model.ProcessedItemRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LedgerController.class)
class LedgerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DeduplicationLedger ledger;

    @Test
    void search_passesFragmentsThrough() throws Exception {
        // Given
        ProcessedItemRecord record = ProcessedItemRecord.builder()
                .itemKey("msg-001")
                .sender("billing@vendor.example")
                .subject("Invoice 100%_final")
                .source(IngestionSource.WEBHOOK)
                .processedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .timeBucket("202403")
                .build();
        when(ledger.search("vendor", "100%_")).thenReturn(List.of(record));

        // When / Then
        mockMvc.perform(get("/api/v1/ingest/ledger")
                        .param("sender", "vendor")
                        .param("subject", "100%_"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].itemKey").value("msg-001"))
                .andExpect(jsonPath("$[0].source").value("WEBHOOK"));
    }

    @Test
    void search_withoutFragments_listsRecent() throws Exception {
        when(ledger.search(null, null)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/ingest/ledger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(ledger).search(null, null);
    }

    @Test
    void get_unknownItem_returns404() throws Exception {
        when(ledger.find("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/ingest/ledger/missing"))
                .andExpect(status().isNotFound());
    }
}
