package com.acme.invoicemail.ingest.controller;

import com.acme.invoicemail.core.exception.MailProviderException;
import com.acme.invoicemail.ingest.service.MailPollerService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual trigger for the fallback poll.
 */
@RestController
@RequestMapping("/api/v1/ingest")
public class IngestController {

    private static final Logger log = LoggerFactory.getLogger(IngestController.class);

    private final MailPollerService pollerService;

    public IngestController(MailPollerService pollerService) {
        this.pollerService = pollerService;
    }

    @PostMapping("/poll")
    public ResponseEntity<?> poll() {
        try {
            return ResponseEntity.ok(pollerService.poll());
        } catch (CallNotPermittedException e) {
            log.warn("Manual poll rejected, circuit open: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "circuit_open", "message", e.getMessage()));
        } catch (MailProviderException e) {
            log.error("Manual poll failed: status={}", e.getStatusCode(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("error", "provider_error", "message", e.getMessage()));
        }
    }
}
