package com.acme.invoicemail.core.resilience;

import com.acme.invoicemail.core.graph.GraphMailClient;
import com.acme.invoicemail.core.graph.MailProviderClient;
import com.acme.invoicemail.core.model.GraphSubscription;
import com.acme.invoicemail.core.model.MailMessage;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Routes every provider call through the graph-api breaker. While the
 * breaker is open calls fail with
 * {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException}
 * and no request is sent.
 */
@Primary
@Component
public class ResilientMailProviderClient implements MailProviderClient {

    private final MailProviderClient delegate;
    private final CircuitBreaker circuitBreaker;

    @Autowired
    public ResilientMailProviderClient(GraphMailClient delegate, CircuitBreakerRegistry registry) {
        this((MailProviderClient) delegate, registry.circuitBreaker(CircuitBreakerNames.GRAPH_API));
    }

    ResilientMailProviderClient(MailProviderClient delegate, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public MailMessage getMessage(String mailbox, String messageId) {
        return circuitBreaker.executeSupplier(() -> delegate.getMessage(mailbox, messageId));
    }

    @Override
    public List<MailMessage> listUnreadMessages(String mailbox, int maxResults) {
        return circuitBreaker.executeSupplier(() -> delegate.listUnreadMessages(mailbox, maxResults));
    }

    @Override
    public void markAsRead(String mailbox, String messageId) {
        circuitBreaker.executeRunnable(() -> delegate.markAsRead(mailbox, messageId));
    }

    @Override
    public GraphSubscription createSubscription(String resource, String notificationUrl, String changeType,
                                                String clientState, Instant expiresAt) {
        return circuitBreaker.executeSupplier(() ->
                delegate.createSubscription(resource, notificationUrl, changeType, clientState, expiresAt));
    }

    @Override
    public GraphSubscription renewSubscription(String subscriptionId, Instant expiresAt) {
        return circuitBreaker.executeSupplier(() -> delegate.renewSubscription(subscriptionId, expiresAt));
    }

    @Override
    public void deleteSubscription(String subscriptionId) {
        circuitBreaker.executeRunnable(() -> delegate.deleteSubscription(subscriptionId));
    }
}
