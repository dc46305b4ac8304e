package com.acme.invoicemail.subscription.controller;

import com.acme.invoicemail.core.model.SubscriptionRecord;
import com.acme.invoicemail.subscription.service.LifecycleOutcome;
import com.acme.invoicemail.subscription.service.SubscriptionLifecycleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SubscriptionController.class)
class SubscriptionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SubscriptionLifecycleService lifecycleService;

    @Test
    void history_returnsRecords() throws Exception {
        // Given
        SubscriptionRecord record = SubscriptionRecord.builder()
                .id("01HQ7ZJ4F0M3K2N5P6Q7R8S9TV")
                .subscriptionId("sub-1")
                .resourceRef("users/invoices@acme.example/mailFolders('Inbox')/messages")
                .expiresAt(Instant.parse("2024-03-04T08:00:00Z"))
                .active(true)
                .createdAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
        when(lifecycleService.history()).thenReturn(List.of(record));

        // When / Then
        mockMvc.perform(get("/api/v1/subscriptions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].subscriptionId").value("sub-1"))
                .andExpect(jsonPath("$[0].active").value(true));
    }

    @Test
    void reconcile_returnsOutcome() throws Exception {
        when(lifecycleService.reconcile()).thenReturn(LifecycleOutcome.RENEWED);

        mockMvc.perform(post("/api/v1/subscriptions/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("RENEWED"));
    }

    @Test
    void reconcile_failed_returns503() throws Exception {
        when(lifecycleService.reconcile()).thenReturn(LifecycleOutcome.FAILED);

        mockMvc.perform(post("/api/v1/subscriptions/reconcile"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.outcome").value("FAILED"));
    }

    @Test
    void recreate_conflict_returns409() throws Exception {
        when(lifecycleService.recreate()).thenReturn(LifecycleOutcome.CONFLICT);

        mockMvc.perform(post("/api/v1/subscriptions/recreate"))
                .andExpect(status().isConflict());

        verify(lifecycleService).recreate();
    }
}
