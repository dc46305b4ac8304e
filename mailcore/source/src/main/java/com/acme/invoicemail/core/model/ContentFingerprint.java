package com.acme.invoicemail.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentFingerprint {

    private String contentHash;
    private String itemKey;
    private Instant firstSeenAt;
}
