package com.acme.invoicemail.core.filter;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.model.MailMessage;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Skips replies to notices the gateway sent out.
 */
@Component
public class NoticeReplyFilter implements MailFilter {

    private final String replyPrefix;
    private final String noticeMarker;

    public NoticeReplyFilter(InvoiceMailProperties properties) {
        this.replyPrefix = properties.getFilters().getReplyPrefix().toLowerCase(Locale.ROOT);
        this.noticeMarker = properties.getFilters().getNoticeMarker().toLowerCase(Locale.ROOT);
    }

    @Override
    public FilterDecision evaluate(MailMessage message, String mailbox) {
        if (message.getSubject() == null) {
            return FilterDecision.pass();
        }
        String subject = message.getSubject().strip().toLowerCase(Locale.ROOT);
        if (subject.startsWith(replyPrefix) && subject.contains(noticeMarker)) {
            return FilterDecision.skip(getName(), "reply to system notice");
        }
        return FilterDecision.pass();
    }

    @Override
    public String getName() {
        return "notice-reply";
    }

    @Override
    public int getPriority() {
        return 100;
    }
}
