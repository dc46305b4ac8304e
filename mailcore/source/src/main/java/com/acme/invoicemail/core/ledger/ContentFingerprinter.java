package com.acme.invoicemail.core.ledger;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.InvoiceMailProperties.FingerprintField;
import com.acme.invoicemail.core.model.MailMessage;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SHA-256 over the configured message fields after normalization, so that
 * resends of the same mail under a new provider id hash alike.
 */
@Component
public class ContentFingerprinter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<FingerprintField> fields;

    public ContentFingerprinter(InvoiceMailProperties properties) {
        this(properties.getDedup().getFingerprintFields());
    }

    ContentFingerprinter(List<FingerprintField> fields) {
        this.fields = List.copyOf(fields);
    }

    /**
     * @return lowercase hex digest, or null if no fields are configured
     */
    public String fingerprint(MailMessage message) {
        if (fields.isEmpty()) {
            return null;
        }
        StringBuilder canonical = new StringBuilder();
        for (FingerprintField field : fields) {
            canonical.append(field.name()).append('=').append(value(field, message)).append('\n');
        }
        return sha256(canonical.toString());
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    private static String value(FingerprintField field, MailMessage message) {
        return switch (field) {
            case SENDER -> normalize(message.getSender());
            case SUBJECT -> normalize(message.getSubject());
            case DATE -> message.getReceivedAt() == null
                    ? ""
                    : message.getReceivedAt().atZone(ZoneOffset.UTC).toLocalDate().toString();
        };
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
