package com.acme.invoicemail.webhook.interceptor;

import jakarta.servlet.http.HttpServletRequest;

import java.util.regex.Pattern;

/**
 * Client key for rate limiting: first X-Forwarded-For hop, then X-Real-IP,
 * then the socket address. Header values that do not look like an IPv4 or
 * IPv6 literal are ignored.
 */
public final class ClientAddressResolver {

    static final String UNKNOWN = "unknown";

    /**
     * Longest textual IPv6 form is 45 characters.
     */
    private static final Pattern IP_LITERAL = Pattern.compile("[0-9A-Fa-f.:]{2,45}");

    private ClientAddressResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].strip();
            if (isIpLiteral(first)) {
                return first;
            }
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && isIpLiteral(realIp.strip())) {
            return realIp.strip();
        }

        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null && !remoteAddr.isBlank() ? remoteAddr : UNKNOWN;
    }

    static boolean isIpLiteral(String value) {
        return IP_LITERAL.matcher(value).matches();
    }
}
