package com.acme.invoicemail.core.ledger;

import java.util.Locale;

/**
 * Builds LIKE patterns from operator input. Pair with {@code ESCAPE '\'}.
 */
final class LikePatterns {

    private LikePatterns() {
    }

    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (char c : value.toCharArray()) {
            if (c == '\\' || c == '%' || c == '_') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Case-insensitive substring pattern; compare against {@code LOWER(column)}.
     */
    static String contains(String fragment) {
        return "%" + escape(fragment.toLowerCase(Locale.ROOT)) + "%";
    }
}
