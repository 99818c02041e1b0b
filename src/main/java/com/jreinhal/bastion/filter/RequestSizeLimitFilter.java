package com.jreinhal.bastion.filter;

import com.jreinhal.bastion.exception.ErrorCategory;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects oversized bodies by declared Content-Length before they are read or parsed.
 */
@Component
public class RequestSizeLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RequestSizeLimitFilter.class);
    private final ErrorResponseWriter errorResponseWriter;
    @Value("${bastion.request.max-body-bytes:10240}")
    private long maxBodyBytes;

    public RequestSizeLimitFilter(ErrorResponseWriter errorResponseWriter) {
        this.errorResponseWriter = errorResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        long contentLength = request.getContentLengthLong();
        if (contentLength > this.maxBodyBytes) {
            log.warn("Request body too large: bytes={} limit={} path={}", contentLength, this.maxBodyBytes, request.getRequestURI());
            this.errorResponseWriter.write(response, ErrorCategory.PAYLOAD_TOO_LARGE, null);
            return;
        }
        filterChain.doFilter(request, response);
    }
}
