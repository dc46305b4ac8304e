package com.acme.invoicemail.core.filter;

import com.acme.invoicemail.core.model.MailMessage;
import org.springframework.stereotype.Component;

/**
 * Skips mail sent by the system mailbox itself.
 */
@Component
public class SenderIdentityFilter implements MailFilter {

    @Override
    public FilterDecision evaluate(MailMessage message, String mailbox) {
        String sender = message.getSender();
        if (sender != null && mailbox != null && sender.strip().equalsIgnoreCase(mailbox.strip())) {
            return FilterDecision.skip(getName(), "sent from system mailbox");
        }
        return FilterDecision.pass();
    }

    @Override
    public String getName() {
        return "sender-identity";
    }

    @Override
    public int getPriority() {
        return 300;
    }
}
