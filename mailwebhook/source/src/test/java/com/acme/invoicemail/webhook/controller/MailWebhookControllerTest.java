package com.acme.invoicemail.webhook.controller;

import com.acme.invoicemail.core.model.ChangeNotification;
import com.acme.invoicemail.core.resilience.CircuitBreakerMonitor;
import com.acme.invoicemail.core.resilience.ratelimit.RateLimiter;
import com.acme.invoicemail.webhook.service.NotificationIntakeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MailWebhookController.class)
class MailWebhookControllerTest {

    private static final String NOTIFICATION = """
            {"value": [{
              "subscriptionId": "sub-1",
              "changeType": "created",
              "resource": "Users/mbx-guid/Messages/AAMkAD001",
              "clientState": "expected-secret"
            }]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private NotificationIntakeService intakeService;

    @MockBean
    private RateLimiter rateLimiter;

    @MockBean
    private CircuitBreakerMonitor circuitBreakerMonitor;

    @BeforeEach
    void setUp() {
        when(rateLimiter.tryAcquire(anyString())).thenReturn(true);
        when(intakeService.isSecretConfigured()).thenReturn(true);
    }

    @Test
    void validationHandshake_echoesTokenAsPlainText() throws Exception {
        mockMvc.perform(post("/api/v1/mail/webhook")
                        .param("validationToken", "Validation: Token 123")
                        .contentType(MediaType.TEXT_PLAIN))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("Validation: Token 123"));

        verifyNoInteractions(intakeService);
    }

    @Test
    void validationHandshake_urlEncodedToken_isDecoded() throws Exception {
        mockMvc.perform(post(URI.create("/api/v1/mail/webhook?validationToken=abc%2Bdef%20ghi")))
                .andExpect(status().isOk())
                .andExpect(content().string("abc+def ghi"));
    }

    @Test
    void validNotification_isQueuedAnd202Returned() throws Exception {
        // Given
        when(intakeService.enqueue(anyList())).thenReturn(new NotificationIntakeService.IntakeResult(1, 1, 0));

        // When / Then
        mockMvc.perform(post("/api/v1/mail/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(NOTIFICATION))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.enqueued").value(1));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChangeNotification>> captor = ArgumentCaptor.forClass(List.class);
        verify(intakeService).enqueue(captor.capture());
        assertEquals("Users/mbx-guid/Messages/AAMkAD001", captor.getValue().get(0).getResource());
    }

    @Test
    void malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/mail/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());

        verify(intakeService, never()).enqueue(anyList());
    }

    @Test
    void secretNotConfigured_returns500() throws Exception {
        when(intakeService.isSecretConfigured()).thenReturn(false);

        mockMvc.perform(post("/api/v1/mail/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(NOTIFICATION))
                .andExpect(status().isInternalServerError());

        verify(intakeService, never()).enqueue(anyList());
    }

    @Test
    void emptyBatch_returns202WithoutQueueing() throws Exception {
        mockMvc.perform(post("/api/v1/mail/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": []}"))
                .andExpect(status().isAccepted());

        verify(intakeService, never()).enqueue(anyList());
    }

    @Test
    void queueFailure_returns500SoProviderRetries() throws Exception {
        when(intakeService.enqueue(anyList())).thenThrow(new IllegalStateException("sqs unavailable"));

        mockMvc.perform(post("/api/v1/mail/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(NOTIFICATION))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void overLimit_returns429WithRetryAfter() throws Exception {
        when(rateLimiter.tryAcquire("203.0.113.9")).thenReturn(false);
        when(rateLimiter.retryAfterSeconds()).thenReturn(42L);

        mockMvc.perform(post("/api/v1/mail/webhook")
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(NOTIFICATION))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(jsonPath("$.error").value("rate_limit_exceeded"))
                .andExpect(jsonPath("$.retryAfter").value(42));

        verifyNoInteractions(intakeService);
    }
}
