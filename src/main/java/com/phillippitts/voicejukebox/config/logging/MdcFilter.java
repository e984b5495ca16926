package com.phillippitts.voicejukebox.config.logging;

import com.phillippitts.voicejukebox.util.LogSanitizer;
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
 * Binds the intent request to Log4j2's ThreadContext so every log line of a play intent, including
 * those of the populator it starts, can be correlated.
 *
 * <ul>
 *   <li>requestId: X-Request-ID header or a fresh UUID, echoed back on the response</li>
 *   <li>sessionId: X-Session-ID header, the voice platform session (if present)</li>
 *   <li>method, uri</li>
 * </ul>
 *
 * Header values are flattened to one line and capped at {@value #MAX_HEADER_CHARS} characters before
 * they reach the log pattern. The context is cleared when the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String SESSION_ID_HEADER = "X-Session-ID";
    static final int MAX_HEADER_CHARS = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                bind(http, response);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static void bind(HttpServletRequest http, ServletResponse response) {
        String requestId = clean(http.getHeader(REQUEST_ID_HEADER));
        if (requestId.isEmpty()) {
            requestId = UUID.randomUUID().toString();
        }
        ThreadContext.put("requestId", requestId);
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        }

        String sessionId = clean(http.getHeader(SESSION_ID_HEADER));
        if (!sessionId.isEmpty()) {
            ThreadContext.put("sessionId", sessionId);
        }
        ThreadContext.put("method", http.getMethod());
        ThreadContext.put("uri", http.getRequestURI());
    }

    private static String clean(String header) {
        if (header == null) {
            return "";
        }
        return LogSanitizer.truncate(header.replaceAll("[\\r\\n\\t]+", " ").strip(), MAX_HEADER_CHARS);
    }
}
