package com.acme.invoicemail.core.graph;

import com.acme.invoicemail.core.model.GraphSubscription;
import com.acme.invoicemail.core.model.MailMessage;

import java.time.Instant;
import java.util.List;

/**
 * Operations the gateway needs from the mail provider.
 *
 * <p>Implementations throw {@link com.acme.invoicemail.core.exception.ProviderItemNotFoundException}
 * for 404 answers, {@link com.acme.invoicemail.core.exception.ProviderThrottledException}
 * for 429 answers and {@link com.acme.invoicemail.core.exception.MailProviderException}
 * for everything else that fails.</p>
 */
public interface MailProviderClient {

    MailMessage getMessage(String mailbox, String messageId);

    /**
     * Unread messages in the mailbox, oldest first, at most {@code maxResults}.
     */
    List<MailMessage> listUnreadMessages(String mailbox, int maxResults);

    void markAsRead(String mailbox, String messageId);

    GraphSubscription createSubscription(String resource, String notificationUrl, String changeType,
                                         String clientState, Instant expiresAt);

    GraphSubscription renewSubscription(String subscriptionId, Instant expiresAt);

    void deleteSubscription(String subscriptionId);
}
