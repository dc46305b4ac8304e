package com.acme.invoicemail.subscription.controller;

import com.acme.invoicemail.core.model.SubscriptionRecord;
import com.acme.invoicemail.subscription.service.LifecycleOutcome;
import com.acme.invoicemail.subscription.service.SubscriptionLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operator endpoints for the inbox subscription.
 */
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionLifecycleService lifecycleService;

    @GetMapping
    public ResponseEntity<List<SubscriptionRecord>> history() {
        return ResponseEntity.ok(lifecycleService.history());
    }

    @PostMapping("/reconcile")
    public ResponseEntity<Map<String, LifecycleOutcome>> reconcile() {
        return toResponse(lifecycleService.reconcile());
    }

    @PostMapping("/recreate")
    public ResponseEntity<Map<String, LifecycleOutcome>> recreate() {
        return toResponse(lifecycleService.recreate());
    }

    private static ResponseEntity<Map<String, LifecycleOutcome>> toResponse(LifecycleOutcome outcome) {
        HttpStatus status = switch (outcome) {
            case FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
            case CONFLICT -> HttpStatus.CONFLICT;
            default -> HttpStatus.OK;
        };
        return ResponseEntity.status(status).body(Map.of("outcome", outcome));
    }
}
