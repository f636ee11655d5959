package com.phillippitts.heartbeat.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcFilterTest {

    private MdcFilter filter;
    private MockHttpServletResponse response;
    private Map<String, String> seen;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        response = new MockHttpServletResponse();
        seen = new HashMap<>();
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    private FilterChain capturing() {
        return (req, res) -> seen.putAll(ThreadContext.getImmutableContext());
    }

    @Test
    void usesSuppliedRequestIdAndEchoesIt() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/services/svc-1/heartbeat");
        request.addHeader("X-Request-ID", "req-123");

        filter.doFilter(request, response, capturing());

        assertThat(seen).containsEntry("requestId", "req-123")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/services/svc-1/heartbeat");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo("req-123");
    }

    @Test
    void generatesUuidWhenHeaderMissingOrBlank() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/services");
        request.addHeader("X-Request-ID", "   ");

        filter.doFilter(request, response, capturing());

        assertThat(seen.get("requestId"))
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo(seen.get("requestId"));
    }

    @Test
    void suppliedRequestIdIsFlattenedAndBounded() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/services");
        request.addHeader("X-Request-ID", "forged\nline" + "x".repeat(200));

        filter.doFilter(request, response, capturing());

        assertThat(seen.get("requestId")).doesNotContain("\n").hasSize(64);
    }

    @Test
    void clearsContextAfterRequestEvenWhenChainThrows() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/services");
        FilterChain failing = (req, res) -> {
            throw new ServletException("Test exception");
        };

        assertThatThrownBy(() -> filter.doFilter(request, response, failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
    }
}
