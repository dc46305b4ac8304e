package com.acme.invoicemail.core.graph;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.exception.MailProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * OAuth2 client-credentials token source for the Graph API. The token is
 * cached until {@code token-refresh-skew} before it expires.
 */
@Component
public class GraphTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(GraphTokenProvider.class);

    private final RestTemplate restTemplate;
    private final InvoiceMailProperties.Graph graph;
    private final Clock clock;

    private String cachedToken;
    private Instant refreshAt = Instant.EPOCH;

    public GraphTokenProvider(
            @Qualifier("graphRestTemplate") RestTemplate restTemplate,
            InvoiceMailProperties properties,
            Clock clock) {
        this.restTemplate = restTemplate;
        this.graph = properties.getGraph();
        this.clock = clock;
    }

    public synchronized String getAccessToken() {
        Instant now = clock.instant();
        if (cachedToken != null && now.isBefore(refreshAt)) {
            return cachedToken;
        }

        String url = graph.getAuthorityUrl() + "/" + graph.getTenantId() + "/oauth2/v2.0/token";
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", graph.getClientId());
        form.add("client_secret", graph.getClientSecret());
        form.add("scope", graph.getScope());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        JsonNode body;
        try {
            body = restTemplate.postForObject(url, new HttpEntity<>(form, headers), JsonNode.class);
        } catch (RestClientResponseException e) {
            throw new MailProviderException("Token request rejected: " + e.getStatusCode(),
                    e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new MailProviderException("Token request failed: " + e.getMessage(), 0, e);
        }

        if (body == null || body.path("access_token").asText("").isEmpty()) {
            throw new MailProviderException("Token response did not contain an access_token", 0);
        }

        long expiresIn = body.path("expires_in").asLong(3600);
        cachedToken = body.path("access_token").asText();
        refreshAt = now.plusSeconds(expiresIn).minus(graph.getTokenRefreshSkew());
        log.info("Acquired Graph access token: tenant={}, expiresIn={}s", graph.getTenantId(), expiresIn);
        return cachedToken;
    }

    /**
     * Drops the cached token, e.g. after the provider answered 401.
     */
    public synchronized void invalidate() {
        cachedToken = null;
        refreshAt = Instant.EPOCH;
    }
}
