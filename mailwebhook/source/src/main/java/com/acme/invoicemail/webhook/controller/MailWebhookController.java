package com.acme.invoicemail.webhook.controller;

import com.acme.invoicemail.core.model.ChangeNotification;
import com.acme.invoicemail.core.model.ChangeNotificationCollection;
import com.acme.invoicemail.core.util.JsonUtils;
import com.acme.invoicemail.webhook.service.NotificationIntakeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Change-notification endpoint registered with the mail provider.
 *
 * <p>Answers the subscription validation handshake and accepts notification
 * batches. Accepted notifications are only queued here; resolving the mail
 * happens in the notification processor.</p>
 */
@RestController
@RequestMapping("/api/v1/mail")
public class MailWebhookController {

    private static final Logger log = LoggerFactory.getLogger(MailWebhookController.class);

    private final NotificationIntakeService intakeService;

    public MailWebhookController(NotificationIntakeService intakeService) {
        this.intakeService = intakeService;
    }

    @PostMapping("/webhook")
    public ResponseEntity<?> receive(
            @RequestParam(value = "validationToken", required = false) String validationToken,
            @RequestBody(required = false) String body) {

        if (validationToken != null) {
            log.info("Webhook validation handshake received");
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(validationToken);
        }

        ChangeNotificationCollection collection;
        try {
            collection = JsonUtils.fromJson(body == null ? "" : body, ChangeNotificationCollection.class);
        } catch (IllegalArgumentException e) {
            log.error("Invalid JSON in webhook request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", "invalid_json"));
        }
        if (collection == null) {
            log.error("Invalid JSON in webhook request: empty body");
            return ResponseEntity.badRequest().body(Map.of("error", "invalid_json"));
        }

        if (!intakeService.isSecretConfigured()) {
            log.error("Webhook client state is not configured");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "configuration_error"));
        }

        List<ChangeNotification> notifications =
                collection.getValue() != null ? collection.getValue() : List.of();
        if (notifications.isEmpty()) {
            log.warn("Webhook received empty notification batch");
            return ResponseEntity.accepted().build();
        }

        try {
            NotificationIntakeService.IntakeResult result = intakeService.enqueue(notifications);
            log.info("Webhook batch handled: received={}, enqueued={}, rejected={}",
                    result.received(), result.enqueued(), result.rejected());
            return ResponseEntity.accepted().body(Map.of(
                    "received", result.received(),
                    "enqueued", result.enqueued(),
                    "rejected", result.rejected()));
        } catch (RuntimeException e) {
            log.error("Failed to enqueue webhook notifications", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "enqueue_failed"));
        }
    }
}
