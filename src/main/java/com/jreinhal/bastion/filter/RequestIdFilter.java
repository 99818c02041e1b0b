package com.jreinhal.bastion.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gives every request one id: the caller's {@code X-Request-ID} (for example from a load
 * balancer) or a fresh UUID. The id is echoed on the response, kept as a request attribute
 * and mirrored into the logging MDC.
 *
 * <p>Streaming responses finish on an async dispatch; that dispatch is filtered again and
 * picks the id up from the request attribute, so stream errors log and report the same id
 * as the original request.</p>
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);
    public static final String HEADER_NAME = "X-Request-ID";
    public static final String MDC_KEY = "requestId";
    public static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";
    // Echoed into headers and log lines verbatim
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    public static String requestIdOf(HttpServletRequest request) {
        Object value = request.getAttribute(ATTRIBUTE);
        return value instanceof String id ? id : null;
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestIdOf(request);
        if (requestId == null) {
            requestId = this.assignId(request.getHeader(HEADER_NAME));
            request.setAttribute(ATTRIBUTE, requestId);
        }
        if (!response.isCommitted()) {
            response.setHeader(HEADER_NAME, requestId);
        }
        MDC.put(MDC_KEY, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private String assignId(String presented) {
        if (presented == null || presented.isBlank()) {
            return UUID.randomUUID().toString();
        }
        String candidate = presented.trim();
        if (ACCEPTED_ID.matcher(candidate).matches()) {
            return candidate;
        }
        log.debug("Replacing malformed {} header ({} chars)", HEADER_NAME, presented.length());
        return UUID.randomUUID().toString();
    }
}
