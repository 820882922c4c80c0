package com.flagship.wage_ledger.observability;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request-scoped log tags, checked from inside the filter chain.
 */
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    private Map<String, String> tagsSeenBy(MockHttpServletRequest request, MockHttpServletResponse response)
            throws Exception {
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> {
            seen.put("correlationId", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            seen.put("workerId", MDC.get(CorrelationContext.WORKER_ID_MDC_KEY));
            seen.put("settlementId", MDC.get(CorrelationContext.SETTLEMENT_ID_MDC_KEY));
        };
        filter.doFilter(request, response, chain);
        return seen;
    }

    @Test
    @DisplayName("Correlation ID from the header is tagged and echoed")
    void testCorrelationIdEchoed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/ledger/summary");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = tagsSeenBy(request, response);

        assertEquals("abc-123", seen.get("correlationId"));
        assertEquals("abc-123", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(seen.get("workerId"));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY), "MDC is cleared after the request");
    }

    @Test
    @DisplayName("Worker is taken from the ledger path")
    void testWorkerFromPath() throws Exception {
        UUID workerId = UUID.randomUUID();
        MockHttpServletRequest request =
            new MockHttpServletRequest("GET", "/api/ledger/workers/" + workerId + "/reconciliation");

        Map<String, String> seen = tagsSeenBy(request, new MockHttpServletResponse());

        assertEquals(workerId.toString(), seen.get("workerId"));
        assertNull(MDC.get(CorrelationContext.WORKER_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Worker header wins over the query parameter")
    void testWorkerHeaderPreferred() throws Exception {
        UUID fromHeader = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/attendance");
        request.addHeader(CorrelationContext.WORKER_ID_HEADER, fromHeader.toString());
        request.setParameter("worker_id", UUID.randomUUID().toString());

        assertEquals(fromHeader.toString(), tagsSeenBy(request, new MockHttpServletResponse()).get("workerId"));
    }

    @Test
    @DisplayName("Worker is taken from the worker_id query parameter")
    void testWorkerFromQuery() throws Exception {
        UUID workerId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/attendance/totals");
        request.setParameter("worker_id", workerId.toString());

        assertEquals(workerId.toString(), tagsSeenBy(request, new MockHttpServletResponse()).get("workerId"));
    }

    @Test
    @DisplayName("Values that are not UUIDs never reach the log")
    void testMalformedWorkerIgnored() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/attendance");
        request.addHeader(CorrelationContext.WORKER_ID_HEADER, "W-001\nforged line");

        assertNull(tagsSeenBy(request, new MockHttpServletResponse()).get("workerId"));
    }

    @Test
    @DisplayName("Settlement is taken from the settlement path")
    void testSettlementFromPath() throws Exception {
        UUID settlementId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/api/settlements/" + settlementId);

        Map<String, String> seen = tagsSeenBy(request, new MockHttpServletResponse());

        assertEquals(settlementId.toString(), seen.get("settlementId"));
        assertNull(seen.get("workerId"));
        assertNull(MDC.get(CorrelationContext.SETTLEMENT_ID_MDC_KEY));
    }
}
