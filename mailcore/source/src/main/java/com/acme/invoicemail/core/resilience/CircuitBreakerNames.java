package com.acme.invoicemail.core.resilience;

import com.acme.invoicemail.core.InvoiceMailProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Breakers guarding each external dependency and their default thresholds.
 */
public final class CircuitBreakerNames {

    public static final String GRAPH_API = "graph-api";
    public static final String LEDGER_STORE = "ledger-store";
    /** Reserved for the enrichment stage downstream of the raw-mail queue. */
    public static final String AZURE_OPENAI = "azure-openai";

    private CircuitBreakerNames() {
    }

    static Map<String, InvoiceMailProperties.Breaker> defaults() {
        Map<String, InvoiceMailProperties.Breaker> defaults = new LinkedHashMap<>();
        defaults.put(GRAPH_API, new InvoiceMailProperties.Breaker(5, Duration.ofSeconds(60)));
        defaults.put(LEDGER_STORE, new InvoiceMailProperties.Breaker(5, Duration.ofSeconds(45)));
        defaults.put(AZURE_OPENAI, new InvoiceMailProperties.Breaker(3, Duration.ofSeconds(30)));
        return defaults;
    }
}
