package com.phillippitts.heartbeat.config.logging;

import com.phillippitts.heartbeat.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts request correlation data into Log4j2's ThreadContext for every HTTP request.
 *
 * <p>Keys: {@code requestId} (X-Request-ID header, or a generated UUID), {@code method} and
 * {@code uri}. The request id is echoed back in the response header so callers can quote it.
 * The registry adds {@code serviceId} itself while it handles a heartbeat.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = requestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            ThreadContext.put("requestId", requestId);
            ThreadContext.put("method", request.getMethod());
            ThreadContext.put("uri", request.getRequestURI());
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestId(HttpServletRequest request) {
        String supplied = request.getHeader(REQUEST_ID_HEADER);
        if (supplied == null || supplied.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return LogSanitizer.truncate(supplied.trim(), MAX_REQUEST_ID_LENGTH);
    }
}
