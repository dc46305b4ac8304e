package com.acme.invoicemail.core.controller;

import com.acme.invoicemail.core.model.CircuitState;
import com.acme.invoicemail.core.resilience.CircuitBreakerMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class DiagnosticControllerTest {

    @Mock
    private CircuitBreakerMonitor circuitBreakerMonitor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new DiagnosticController(circuitBreakerMonitor)).build();
    }

    @Test
    void circuits_listsSnapshots() throws Exception {
        when(circuitBreakerMonitor.snapshot()).thenReturn(List.of(
                CircuitState.builder().name("graph-api").state("open").failureCount(5).failureThreshold(5).build(),
                CircuitState.builder().name("ledger-store").state("closed").failureThreshold(5).build()));

        mockMvc.perform(get("/api/v1/diagnostics/circuits"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("graph-api"))
                .andExpect(jsonPath("$[0].state").value("open"))
                .andExpect(jsonPath("$[1].state").value("closed"));
    }

    @Test
    void circuit_unknownName_returns404() throws Exception {
        when(circuitBreakerMonitor.snapshot()).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/diagnostics/circuits/nope"))
                .andExpect(status().isNotFound());
    }
}
