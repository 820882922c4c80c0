package com.flagship.wage_ledger.observability;

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
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every log line of a request with its correlation ID and, where the request names
 * one, the worker or settlement it concerns.
 *
 * The worker comes from the {@code X-Worker-ID} header, a {@code worker_id} query
 * parameter, or a worker path ({@code /api/workers/{id}}, {@code /api/ledger/workers/{id}}).
 * The settlement comes from {@code /api/settlements/{id}}. Values that are not UUIDs are
 * ignored so a client cannot write arbitrary text into the log.
 *
 * Ledger postings inside the request overwrite the worker tag for their duration and then
 * restore this one.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern WORKER_PATH =
            Pattern.compile("^/api/(?:ledger/)?workers/([0-9a-fA-F-]{36})(?:/.*)?$");
    private static final Pattern SETTLEMENT_PATH =
            Pattern.compile("^/api/settlements/([0-9a-fA-F-]{36})$");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            String correlationId = extractOrGenerateCorrelationId(request);

            CorrelationContext.setCorrelationId(correlationId);
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            String workerId = resolveWorkerId(request);
            if (workerId != null) {
                MDC.put(CorrelationContext.WORKER_ID_MDC_KEY, workerId);
            }
            String settlementId = uuidOrNull(firstGroup(SETTLEMENT_PATH, request.getRequestURI()));
            if (settlementId != null) {
                MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId);
            }

            filterChain.doFilter(request, response);

        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.WORKER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.SETTLEMENT_ID_MDC_KEY);
        }
    }

    private String extractOrGenerateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);

        if (correlationId == null || correlationId.isBlank()) {
            correlationId = CorrelationContext.generateCorrelationId();
        }

        return correlationId;
    }

    /**
     * Header first, then the path, then the query parameter.
     */
    String resolveWorkerId(HttpServletRequest request) {
        String fromHeader = uuidOrNull(request.getHeader(CorrelationContext.WORKER_ID_HEADER));
        if (fromHeader != null) {
            return fromHeader;
        }
        String fromPath = uuidOrNull(firstGroup(WORKER_PATH, request.getRequestURI()));
        if (fromPath != null) {
            return fromPath;
        }
        return uuidOrNull(request.getParameter("worker_id"));
    }

    private static String firstGroup(Pattern pattern, String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(path);
        return matcher.matches() ? matcher.group(1) : null;
    }

    private static String uuidOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim()).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Actuator scrapes are noise
        String path = request.getRequestURI();
        return path.startsWith("/actuator");
    }
}
