package com.acme.invoicemail.core.filter;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.model.MailMessage;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Skips mail whose subject matches the gateway's own outbound template,
 * e.g. {@code Invoice: Acme Corp - GL 6100}.
 */
@Component
public class OutboundTemplateFilter implements MailFilter {

    private final Pattern subjectPattern;

    public OutboundTemplateFilter(InvoiceMailProperties properties) {
        this.subjectPattern = Pattern.compile(properties.getFilters().getOutboundSubjectPattern());
    }

    @Override
    public FilterDecision evaluate(MailMessage message, String mailbox) {
        String subject = message.getSubject();
        if (subject != null && subjectPattern.matcher(subject.strip()).matches()) {
            return FilterDecision.skip(getName(), "subject matches outbound template");
        }
        return FilterDecision.pass();
    }

    @Override
    public String getName() {
        return "outbound-template";
    }

    @Override
    public int getPriority() {
        return 200;
    }
}
