package com.acme.invoicemail.core.filter;

/**
 * Verdict of a {@link MailFilter}.
 */
public final class FilterDecision {

    private static final FilterDecision PASS = new FilterDecision(false, null, null);

    private final boolean skip;
    private final String filterName;
    private final String reason;

    private FilterDecision(boolean skip, String filterName, String reason) {
        this.skip = skip;
        this.filterName = filterName;
        this.reason = reason;
    }

    public static FilterDecision pass() {
        return PASS;
    }

    public static FilterDecision skip(String filterName, String reason) {
        return new FilterDecision(true, filterName, reason);
    }

    public boolean isSkip() {
        return skip;
    }

    public String getFilterName() {
        return filterName;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return skip ? "SKIP(" + filterName + ": " + reason + ")" : "PASS";
    }
}
