package com.acme.invoicemail.core.resilience;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.exception.InvalidNotificationException;
import com.acme.invoicemail.core.exception.ProviderItemNotFoundException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * One Resilience4j breaker per external dependency.
 *
 * <p>A count-based window of {@code failure-threshold} calls that opens at a
 * 100% failure rate trips after that many consecutive failures. The
 * open-to-half-open move happens on the first call after
 * {@code reset-timeout}, which is then the single probe.</p>
 */
@Configuration
public class CircuitBreakerConfiguration {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(InvoiceMailProperties properties) {
        Map<String, InvoiceMailProperties.Breaker> breakers = CircuitBreakerNames.defaults();
        breakers.putAll(properties.getResilience().getBreakers());

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        breakers.forEach((name, settings) -> registry.circuitBreaker(name, breakerConfig(settings)));
        return registry;
    }

    public static CircuitBreakerConfig breakerConfig(InvoiceMailProperties.Breaker settings) {
        int threshold = settings.getFailureThreshold();
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(settings.getResetTimeout())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .ignoreExceptions(
                        IllegalArgumentException.class,
                        ProviderItemNotFoundException.class,
                        InvalidNotificationException.class)
                .build();
    }
}
