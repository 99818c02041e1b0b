package com.jreinhal.bastion.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.bastion.dto.ErrorResponse;
import com.jreinhal.bastion.exception.ErrorCategory;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes the same error body the exception handler produces, for rejections that happen
 * in servlet filters before any controller is involved.
 */
@Component
public class ErrorResponseWriter {
    private final ObjectMapper objectMapper;

    public ErrorResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, ErrorCategory category, Long retryAfterSeconds) throws IOException {
        response.setStatus(category.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        if (retryAfterSeconds != null) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        }
        ErrorResponse body = new ErrorResponse(category.getCode(), category.getDefaultMessage(),
                MDC.get(RequestIdFilter.MDC_KEY), retryAfterSeconds);
        response.getWriter().write(this.objectMapper.writeValueAsString(body));
    }
}
