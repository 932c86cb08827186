package com.openbudget.aggregates.web;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void reusesWellFormedCallerTraceId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/aggregated-line-items");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "batch-2024.run_7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInContext = new AtomicReference<>();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse res) {
                seenInContext.set(RequestContextHolder.traceId().orElse(null));
                seenInMdc.set(MDC.get(TraceIdFilter.MDC_KEY));
            }
        }));

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("batch-2024.run_7");
        assertThat(seenInContext.get()).isEqualTo("batch-2024.run_7");
        assertThat(seenInMdc.get()).isEqualTo("batch-2024.run_7");
        assertThat(RequestContextHolder.traceId()).isEmpty();
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void replacesMissingOrMalformedTraceIds() {
        assertThat(TraceIdFilter.resolveTraceId(null)).hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId("")).hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId("id with spaces")).isNotEqualTo("id with spaces");
        assertThat(TraceIdFilter.resolveTraceId("x".repeat(65))).hasSize(36);
    }
}
