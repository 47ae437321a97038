package com.phillippitts.talkback.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts request-scoped correlation keys into Log4j2's ThreadContext for REST calls.
 *
 * <p>Keys: {@code requestId} (X-Request-ID or a fresh UUID, echoed back in the response),
 * {@code sessionId} (X-Session-ID, when the caller names its voice session), {@code turnId}
 * (for {@code /api/turns/{id}}), {@code method} and {@code uri}. WebSocket traffic is tagged by
 * the socket handler instead, because its messages do not pass through servlet filters.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String SESSION_ID_HEADER = "X-Session-ID";

    private static final String TURNS_PREFIX = "/api/turns/";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = correlate(http);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String correlate(HttpServletRequest http) {
        String requestId = http.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        ThreadContext.put("requestId", requestId);
        putIfPresent("sessionId", http.getHeader(SESSION_ID_HEADER));

        String uri = http.getRequestURI();
        ThreadContext.put("method", http.getMethod());
        ThreadContext.put("uri", uri);
        if (uri != null && uri.startsWith(TURNS_PREFIX)) {
            String tail = uri.substring(TURNS_PREFIX.length());
            if (!tail.equals("stop-all")) {
                putIfPresent("turnId", tail);
            }
        }
        return requestId;
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isBlank()) {
            ThreadContext.put(key, value);
        }
    }
}
