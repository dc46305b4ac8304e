package com.acme.invoicemail.core.resilience;

import com.acme.invoicemail.core.model.CircuitState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs breaker transitions and exposes read-only snapshots for diagnostics.
 */
@Component
public class CircuitBreakerMonitor {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerMonitor.class);

    private final CircuitBreakerRegistry registry;
    private final Clock clock;
    private final Map<String, Instant> openedAt = new ConcurrentHashMap<>();

    public CircuitBreakerMonitor(CircuitBreakerRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        registry.getAllCircuitBreakers().forEach(this::watch);
        registry.getEventPublisher().onEntryAdded(event -> watch(event.getAddedEntry()));
    }

    public List<CircuitState> snapshot() {
        return registry.getAllCircuitBreakers().stream()
                .map(this::toState)
                .sorted(Comparator.comparing(CircuitState::getName))
                .toList();
    }


    private void watch(CircuitBreaker breaker) {
        breaker.getEventPublisher().onStateTransition(this::onTransition);
    }

    private void onTransition(CircuitBreakerOnStateTransitionEvent event) {
        String name = event.getCircuitBreakerName();
        CircuitBreaker.State to = event.getStateTransition().getToState();
        if (to == CircuitBreaker.State.OPEN) {
            openedAt.put(name, clock.instant());
            log.warn("Circuit opened: breaker={}, transition={}", name, event.getStateTransition());
        } else {
            if (to == CircuitBreaker.State.CLOSED) {
                openedAt.remove(name);
            }
            log.info("Circuit transition: breaker={}, transition={}", name, event.getStateTransition());
        }
    }

    private CircuitState toState(CircuitBreaker breaker) {
        return CircuitState.builder()
                .name(breaker.getName())
                .state(label(breaker.getState()))
                .failureCount(breaker.getMetrics().getNumberOfFailedCalls())
                .failureThreshold(breaker.getCircuitBreakerConfig().getMinimumNumberOfCalls())
                .openedAt(openedAt.get(breaker.getName()))
                .build();
    }

    private static String label(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> "closed";
            case OPEN, FORCED_OPEN -> "open";
            case HALF_OPEN -> "half-open";
            default -> state.name().toLowerCase();
        };
    }
}
