package com.acme.invoicemail.core.graph;

import com.acme.invoicemail.core.model.GraphSubscription;
import com.acme.invoicemail.core.model.MailMessage;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Maps Graph JSON payloads onto gateway models.
 */
final class GraphMessageMapper {

    static final String MESSAGE_SELECT = "id,from,subject,receivedDateTime,hasAttachments,isRead";

    private GraphMessageMapper() {
    }

    static MailMessage toMessage(JsonNode node) {
        return MailMessage.builder()
                .id(node.path("id").asText(null))
                .sender(node.path("from").path("emailAddress").path("address").asText(""))
                .subject(node.path("subject").asText(""))
                .receivedAt(parseInstant(node.path("receivedDateTime").asText(null)))
                .hasAttachments(node.path("hasAttachments").asBoolean(false))
                .read(node.path("isRead").asBoolean(false))
                .build();
    }

    static GraphSubscription toSubscription(JsonNode node) {
        return GraphSubscription.builder()
                .id(node.path("id").asText(null))
                .resource(node.path("resource").asText(null))
                .changeType(node.path("changeType").asText(null))
                .notificationUrl(node.path("notificationUrl").asText(null))
                .expirationDateTime(parseInstant(node.path("expirationDateTime").asText(null)))
                .build();
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(value).toInstant();
    }
}
