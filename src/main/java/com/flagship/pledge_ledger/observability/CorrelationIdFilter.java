package com.flagship.pledge_ledger.observability;

import com.flagship.pledge_ledger.payment.LedgerKind;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the request's correlation id, and the record named in its path, into
 * MDC for the duration of the request.
 *
 * The correlation id comes from {@code X-Correlation-ID} when the caller sends
 * one and is echoed back on the response either way.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final int MAX_CORRELATION_ID_LENGTH = 64;
    private static final Pattern RECORD_PATH = Pattern.compile("^/api/(entries|outstanding)/(\\d+)(/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = acceptOrGenerate(request.getHeader(LogContext.CORRELATION_ID_HEADER));
        MDC.put(LogContext.CORRELATION_ID_KEY, correlationId);
        response.setHeader(LogContext.CORRELATION_ID_HEADER, correlationId);

        String recordTag = recordTag(request.getRequestURI());
        if (recordTag != null) {
            MDC.put(LogContext.RECORD_KEY, recordTag);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(LogContext.CORRELATION_ID_KEY);
            MDC.remove(LogContext.RECORD_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    static String acceptOrGenerate(String header) {
        if (header == null || header.isBlank() || header.length() > MAX_CORRELATION_ID_LENGTH) {
            return LogContext.newCorrelationId();
        }
        return header.trim();
    }

    static String recordTag(String uri) {
        Matcher matcher = RECORD_PATH.matcher(uri);
        if (!matcher.matches()) {
            return null;
        }
        LedgerKind kind = "entries".equals(matcher.group(1)) ? LedgerKind.PLEDGE : LedgerKind.OUTSTANDING;
        return LogContext.recordTag(kind, Long.parseLong(matcher.group(2)));
    }
}
