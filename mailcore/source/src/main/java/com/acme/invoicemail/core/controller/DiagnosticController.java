package com.acme.invoicemail.core.controller;

import com.acme.invoicemail.core.model.CircuitState;
import com.acme.invoicemail.core.resilience.CircuitBreakerMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the circuit breakers in this process.
 */
@RestController
@RequestMapping("/api/v1/diagnostics")
@RequiredArgsConstructor
public class DiagnosticController {

    private final CircuitBreakerMonitor circuitBreakerMonitor;

    @GetMapping("/circuits")
    public ResponseEntity<List<CircuitState>> circuits() {
        return ResponseEntity.ok(circuitBreakerMonitor.snapshot());
    }

    @GetMapping("/circuits/{name}")
    public ResponseEntity<CircuitState> circuit(@PathVariable String name) {
        return circuitBreakerMonitor.snapshot().stream()
                .filter(state -> state.getName().equals(name))
                .findFirst()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
