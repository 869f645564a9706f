package com.phillippitts.avifconverter.config.logging;

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
 * Puts a request id into Log4j2's ThreadContext so every log line of one conversion can be
 * correlated, and echoes it back in the {@code X-Request-ID} response header.
 *
 * <p>Values added: {@code requestId} (from X-Request-ID, or a fresh UUID), {@code method}
 * and {@code uri}. The context is cleared after the request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = requestId(http);
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    // Client-supplied ids end up in log lines; only accept short, plain tokens.
    private static String requestId(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        if (v == null || v.isBlank() || v.length() > MAX_REQUEST_ID_LENGTH || !v.matches("[A-Za-z0-9._-]+")) {
            return UUID.randomUUID().toString();
        }
        return v;
    }
}
