package com.jreinhal.bastion.exception;

import org.springframework.http.HttpStatus;

/**
 * Client-visible failure classes. Each maps to a machine-readable code, an HTTP status
 * and a generic message that is safe to return to untrusted callers.
 */
public enum ErrorCategory {
    AUTH_MISSING("auth_rejected", HttpStatus.UNAUTHORIZED, "API anahtarı eksik. 'X-API-Key' başlığını ekleyin."),
    AUTH_INVALID("auth_rejected", HttpStatus.FORBIDDEN, "Geçersiz API anahtarı."),
    RATE_LIMITED("rate_limited", HttpStatus.TOO_MANY_REQUESTS, "Çok fazla istek gönderdiniz. Lütfen bir dakika sonra tekrar deneyin."),
    QUOTA_EXCEEDED("quota_exceeded", HttpStatus.TOO_MANY_REQUESTS, "Günlük istek limitine ulaşıldı. Yarın tekrar deneyebilirsiniz."),
    PAYLOAD_TOO_LARGE("payload_too_large", HttpStatus.PAYLOAD_TOO_LARGE, "İstek gövdesi çok büyük. En fazla 10KB gönderebilirsiniz."),
    INVALID_QUERY("invalid_query", HttpStatus.UNPROCESSABLE_ENTITY, "Geçersiz sorgu."),
    QUERY_TOO_LARGE("query_too_large", HttpStatus.BAD_REQUEST, "Sorgunuz çok uzun. Lütfen daha kısa bir soru sorun."),
    RETRIEVAL_ERROR("retrieval_error", HttpStatus.SERVICE_UNAVAILABLE, "Arama servisi geçici olarak kullanılamıyor. Lütfen tekrar deneyin."),
    GENERATION_ERROR("generation_error", HttpStatus.SERVICE_UNAVAILABLE, "Yanıt servisi geçici olarak kullanılamıyor. Lütfen tekrar deneyin."),
    DEPENDENCY_UNAVAILABLE("dependency_unavailable", HttpStatus.SERVICE_UNAVAILABLE, "Servis geçici olarak erişilemiyor. Lütfen tekrar deneyin."),
    UNCLASSIFIED_INTERNAL("internal_server_error", HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.");

    private final String code;
    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCategory(String code, HttpStatus status, String defaultMessage) {
        this.code = code;
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return this.code;
    }

    public HttpStatus getStatus() {
        return this.status;
    }

    public String getDefaultMessage() {
        return this.defaultMessage;
    }
}
