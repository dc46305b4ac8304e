package com.acme.invoicemail.core.filter;

import com.acme.invoicemail.core.model.MailMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Runs every {@link MailFilter} in priority order and stops at the first skip.
 */
@Component
public class MailFilterChain {

    private static final Logger log = LoggerFactory.getLogger(MailFilterChain.class);

    private final List<MailFilter> filters;

    public MailFilterChain(List<MailFilter> filters) {
        this.filters = filters.stream()
                .sorted(Comparator.comparingInt(MailFilter::getPriority).reversed())
                .toList();
    }

    public FilterDecision evaluate(MailMessage message, String mailbox) {
        for (MailFilter filter : filters) {
            FilterDecision decision = filter.evaluate(message, mailbox);
            if (decision.isSkip()) {
                log.info("Message filtered: itemKey={}, filter={}, reason={}",
                        message.getId(), decision.getFilterName(), decision.getReason());
                return decision;
            }
        }
        return FilterDecision.pass();
    }
}
