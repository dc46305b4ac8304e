package com.acme.invoicemail.core.resilience;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.model.CircuitState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerMonitorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private CircuitBreakerRegistry registry;
    private CircuitBreakerMonitor monitor;

    @BeforeEach
    void setUp() {
        InvoiceMailProperties properties = new InvoiceMailProperties();
        properties.getResilience().setBreakers(Map.of(
                CircuitBreakerNames.GRAPH_API, new InvoiceMailProperties.Breaker(2, Duration.ofSeconds(5))));
        registry = new CircuitBreakerConfiguration().circuitBreakerRegistry(properties);
        monitor = new CircuitBreakerMonitor(registry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void registry_containsEveryDependencyWithConfiguredThresholds() {
        List<CircuitState> states = monitor.snapshot();

        assertEquals(List.of("azure-openai", "graph-api", "ledger-store"),
                states.stream().map(CircuitState::getName).toList());
        assertEquals(2, registry.circuitBreaker("graph-api").getCircuitBreakerConfig().getMinimumNumberOfCalls());
        assertEquals(5, registry.circuitBreaker("ledger-store").getCircuitBreakerConfig().getMinimumNumberOfCalls());
        assertEquals(45_000L, registry.circuitBreaker("ledger-store")
                .getCircuitBreakerConfig().getWaitIntervalFunctionInOpenState().apply(1));
        assertEquals(3, registry.circuitBreaker("azure-openai").getCircuitBreakerConfig().getMinimumNumberOfCalls());
    }

    @Test
    void snapshot_reportsOpenStateAndOpenedAt() {
        CircuitBreaker graph = registry.circuitBreaker(CircuitBreakerNames.GRAPH_API);
        graph.onError(0, TimeUnit.MILLISECONDS, new RuntimeException("boom"));
        graph.onError(0, TimeUnit.MILLISECONDS, new RuntimeException("boom"));

        CircuitState state = monitor.snapshot().stream()
                .filter(s -> s.getName().equals(CircuitBreakerNames.GRAPH_API))
                .findFirst().orElseThrow();

        assertEquals("open", state.getState());
        assertEquals(2, state.getFailureCount());
        assertEquals(NOW, state.getOpenedAt());
    }

    @Test
    void snapshot_closedBreakerHasNoOpenedAt() {
        CircuitState state = monitor.snapshot().get(0);

        assertEquals("closed", state.getState());
        assertNull(state.getOpenedAt());
    }
}
