package com.acme.invoicemail.core.graph;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.exception.MailProviderException;
import com.acme.invoicemail.core.exception.ProviderItemNotFoundException;
import com.acme.invoicemail.core.exception.ProviderThrottledException;
import com.acme.invoicemail.core.model.GraphSubscription;
import com.acme.invoicemail.core.model.MailMessage;
import com.acme.invoicemail.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Microsoft Graph v1.0 implementation of {@link MailProviderClient}.
 */
@Component
public class GraphMailClient implements MailProviderClient {

    private static final Logger log = LoggerFactory.getLogger(GraphMailClient.class);

    private final RestTemplate restTemplate;
    private final GraphTokenProvider tokenProvider;
    private final InvoiceMailProperties.Graph graph;

    public GraphMailClient(
            @Qualifier("graphRestTemplate") RestTemplate restTemplate,
            GraphTokenProvider tokenProvider,
            InvoiceMailProperties properties) {
        this.restTemplate = restTemplate;
        this.tokenProvider = tokenProvider;
        this.graph = properties.getGraph();
    }

    @Override
    public MailMessage getMessage(String mailbox, String messageId) {
        JsonNode body = call(HttpMethod.GET,
                "/users/{mailbox}/messages/{id}?$select={select}", null,
                "get message " + messageId,
                mailbox, messageId, GraphMessageMapper.MESSAGE_SELECT);
        return GraphMessageMapper.toMessage(body);
    }

    @Override
    public List<MailMessage> listUnreadMessages(String mailbox, int maxResults) {
        JsonNode body = call(HttpMethod.GET,
                "/users/{mailbox}/messages?$filter={filter}&$top={top}&$orderby={orderby}&$select={select}", null,
                "list unread messages",
                mailbox, "isRead eq false", maxResults, "receivedDateTime asc", GraphMessageMapper.MESSAGE_SELECT);

        List<MailMessage> messages = new ArrayList<>();
        for (JsonNode node : body.path("value")) {
            messages.add(GraphMessageMapper.toMessage(node));
        }
        log.debug("Listed unread messages: mailbox={}, count={}", mailbox, messages.size());
        return messages;
    }

    @Override
    public void markAsRead(String mailbox, String messageId) {
        call(HttpMethod.PATCH, "/users/{mailbox}/messages/{id}", Map.of("isRead", true),
                "mark message read " + messageId, mailbox, messageId);
    }

    @Override
    public GraphSubscription createSubscription(String resource, String notificationUrl, String changeType,
                                                String clientState, Instant expiresAt) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("changeType", changeType);
        request.put("notificationUrl", notificationUrl);
        request.put("resource", resource);
        request.put("expirationDateTime", expiresAt.toString());
        request.put("clientState", clientState);

        JsonNode body = call(HttpMethod.POST, "/subscriptions", request, "create subscription");
        GraphSubscription subscription = GraphMessageMapper.toSubscription(body);
        log.info("Created Graph subscription: subscriptionId={}, resource={}, expiresAt={}",
                subscription.getId(), resource, subscription.getExpirationDateTime());
        return subscription;
    }

    @Override
    public GraphSubscription renewSubscription(String subscriptionId, Instant expiresAt) {
        JsonNode body = call(HttpMethod.PATCH, "/subscriptions/{id}",
                Map.of("expirationDateTime", expiresAt.toString()),
                "renew subscription " + subscriptionId, subscriptionId);
        GraphSubscription subscription = GraphMessageMapper.toSubscription(body);
        log.info("Renewed Graph subscription: subscriptionId={}, expiresAt={}",
                subscriptionId, subscription.getExpirationDateTime());
        return subscription;
    }

    @Override
    public void deleteSubscription(String subscriptionId) {
        call(HttpMethod.DELETE, "/subscriptions/{id}", null,
                "delete subscription " + subscriptionId, subscriptionId);
        log.info("Deleted Graph subscription: subscriptionId={}", subscriptionId);
    }

    private JsonNode call(HttpMethod method, String path, Object body, String operation, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenProvider.getAccessToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    graph.getBaseUrl() + path, method, new HttpEntity<>(body, headers),
                    JsonNode.class, uriVariables);
            JsonNode result = response.getBody();
            return result != null ? result : JsonUtils.mapper().createObjectNode();
        } catch (RestClientResponseException e) {
            throw translate(e, operation);
        } catch (RestClientException e) {
            // connect/read timeouts land here
            throw new MailProviderException("Graph " + operation + " failed: " + e.getMessage(), 0, e);
        }
    }

    private MailProviderException translate(RestClientResponseException e, String operation) {
        int status = e.getStatusCode().value();
        if (status == HttpStatus.NOT_FOUND.value()) {
            return new ProviderItemNotFoundException("Graph " + operation + ": not found", e);
        }
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            long retryAfter = parseRetryAfter(e.getResponseHeaders());
            log.warn("Graph throttled request: operation={}, retryAfter={}s", operation, retryAfter);
            return new ProviderThrottledException("Graph " + operation + ": throttled", retryAfter, e);
        }
        if (status == HttpStatus.UNAUTHORIZED.value()) {
            tokenProvider.invalidate();
        }
        return new MailProviderException("Graph " + operation + " failed with status " + status, status, e);
    }

    private long parseRetryAfter(HttpHeaders headers) {
        String value = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (value == null) {
            return graph.getDefaultRetryAfterSeconds();
        }
        try {
            return Math.max(1, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return graph.getDefaultRetryAfterSeconds();
        }
    }
}
