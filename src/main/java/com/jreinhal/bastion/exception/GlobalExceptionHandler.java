package com.jreinhal.bastion.exception;

import com.jreinhal.bastion.dto.ErrorResponse;
import com.jreinhal.bastion.filter.RequestIdFilter;
import com.jreinhal.bastion.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGateway(GatewayException ex) {
        ErrorCategory category = ex.getCategory();
        if (category.getStatus().is5xxServerError()) {
            log.error("Request failed: category={} detail={}", category.getCode(), describe(ex));
        } else if (log.isDebugEnabled()) {
            log.debug("Request rejected: category={}", category.getCode());
        }
        String message = category.getStatus().is5xxServerError() ? category.getDefaultMessage() : ex.getMessage();
        return build(category.getStatus(), category.getCode(), message, ex.getRetryAfterSeconds());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleInvalidBody(Exception ex) {
        log.debug("Invalid request body: {}", ex.getClass().getSimpleName());
        return build(ErrorCategory.INVALID_QUERY.getStatus(), ErrorCategory.INVALID_QUERY.getCode(),
                "Sorgu 2 ile 1000 karakter arasında olmalıdır.", null);
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleRouting(Exception ex) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        return build(status, "request_rejected", "Invalid request", null);
    }

    @ExceptionHandler(AsyncRequestNotUsableException.class)
    public void handleClientGone(AsyncRequestNotUsableException ex) {
        log.debug("Client disconnected before the response completed");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        ErrorCategory category = ErrorCategory.UNCLASSIFIED_INTERNAL;
        return build(category.getStatus(), category.getCode(), category.getDefaultMessage(), null);
    }

    static ResponseEntity<ErrorResponse> build(HttpStatusCode status, String code, String message, Long retryAfter) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON);
        if (retryAfter != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        }
        return builder.body(new ErrorResponse(code, message, MDC.get(RequestIdFilter.MDC_KEY), retryAfter));
    }

    private static String describe(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == ex ? ex.getClass().getSimpleName() : ex.getClass().getSimpleName() + " <- " + root.getClass().getSimpleName() + ": " + LogSanitizer.sanitize(root.getMessage());
    }
}
