package com.acme.invoicemail.ingest.controller;

import com.acme.invoicemail.core.exception.MailProviderException;
import com.acme.invoicemail.ingest.service.MailPollerService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(IngestController.class)
class IngestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MailPollerService pollerService;

    @Test
    void poll_returnsCounters() throws Exception {
        when(pollerService.poll()).thenReturn(new MailPollerService.PollResult(4, 2, 1, 1, 0));

        mockMvc.perform(post("/api/v1/ingest/poll"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scanned").value(4))
                .andExpect(jsonPath("$.forwarded").value(2))
                .andExpect(jsonPath("$.skipped").value(1))
                .andExpect(jsonPath("$.duplicates").value(1))
                .andExpect(jsonPath("$.failed").value(0));
    }

    @Test
    void poll_providerFailure_returns502() throws Exception {
        when(pollerService.poll()).thenThrow(new MailProviderException("Graph list: 500", 500));

        mockMvc.perform(post("/api/v1/ingest/poll"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("provider_error"));
    }

    @Test
    void poll_circuitOpen_returns503() throws Exception {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("graph-api");
        breaker.transitionToOpenState();
        when(pollerService.poll()).thenThrow(CallNotPermittedException.createCallNotPermittedException(breaker));

        mockMvc.perform(post("/api/v1/ingest/poll"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("circuit_open"));
    }
}
