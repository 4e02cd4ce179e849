package org.example.storyteller.config;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();

    @Test
    void doFilter_reusesCallerRequestIdAndClearsMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/synthesis");
        request.addHeader(RequestCorrelation.HEADER_NAME, "  abc-123  ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInMdc.set(MDC.get(RequestCorrelation.ATTRIBUTE_NAME));
            }
        });

        assertEquals("abc-123", response.getHeader(RequestCorrelation.HEADER_NAME));
        assertEquals("abc-123", RequestCorrelation.resolveRequestId(request));
        assertEquals("abc-123", seenInMdc.get());
        assertNull(MDC.get(RequestCorrelation.ATTRIBUTE_NAME));
    }

    @Test
    void doFilter_withoutHeader_generatesRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertNotNull(response.getHeader(RequestCorrelation.HEADER_NAME));
        assertEquals(36, response.getHeader(RequestCorrelation.HEADER_NAME).length());
    }

    @Test
    void normalize_truncatesLongIdsAndRejectsBlank() {
        assertNull(RequestCorrelation.normalize("   "));
        assertEquals(80, RequestCorrelation.normalize("x".repeat(120)).length());
        assertEquals(RequestCorrelation.UNKNOWN, RequestCorrelation.resolveRequestId(null));
    }

    @Test
    void normalize_stripsCharactersThatCouldForgeLogLines() {
        assertEquals("run-42injected", RequestCorrelation.normalize("run-42\r\ninjected"));
        assertNull(RequestCorrelation.normalize("\n\n"));
    }
}
