package com.acme.invoicemail.ingest.controller;

import com.acme.invoicemail.core.ledger.DeduplicationLedger;
import com.acme.invoicemail.core.model.ProcessedItemRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator lookups against the deduplication ledger.
 */
@RestController
@RequestMapping("/api/v1/ingest/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final DeduplicationLedger ledger;

    /**
     * Fragments are matched case-insensitively and literally; both may be omitted.
     */
    @GetMapping
    public ResponseEntity<List<ProcessedItemRecord>> search(
            @RequestParam(required = false) String sender,
            @RequestParam(required = false) String subject) {
        return ResponseEntity.ok(ledger.search(sender, subject));
    }

    @GetMapping("/{itemKey}")
    public ResponseEntity<ProcessedItemRecord> get(@PathVariable String itemKey) {
        return ledger.find(itemKey)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
