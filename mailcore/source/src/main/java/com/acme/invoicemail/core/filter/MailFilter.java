package com.acme.invoicemail.core.filter;

import com.acme.invoicemail.core.model.MailMessage;

/**
 * Pluggable loop-prevention check applied before an item is claimed.
 */
public interface MailFilter {

    /**
     * Decide whether the message must be skipped.
     *
     * @param mailbox the monitored system mailbox
     */
    FilterDecision evaluate(MailMessage message, String mailbox);

    String getName();

    /**
     * Higher runs first.
     */
    default int getPriority() {
        return 0;
    }
}
