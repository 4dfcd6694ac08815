package com.phillippitts.scriberelay.config.logging;

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
 * Puts a correlation id into Log4j2's ThreadContext for every HTTP request (including the
 * WebSocket upgrade) and echoes it in the response.
 *
 * <p>The id comes from the X-Request-ID header or is generated. The context is removed after the
 * request so pooled container threads do not leak it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String REQUEST_ID_KEY = "requestId";
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = requestIdOf(request);
        ThreadContext.put(REQUEST_ID_KEY, requestId);
        ThreadContext.put("method", request.getMethod());
        ThreadContext.put("uri", request.getRequestURI());
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            chain.doFilter(request, response);
        } finally {
            ThreadContext.remove(REQUEST_ID_KEY);
            ThreadContext.remove("method");
            ThreadContext.remove("uri");
        }
    }

    private static String requestIdOf(HttpServletRequest request) {
        String v = request.getHeader(REQUEST_ID_HEADER);
        if (v == null || v.isBlank() || v.length() > MAX_REQUEST_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return v;
    }
}
