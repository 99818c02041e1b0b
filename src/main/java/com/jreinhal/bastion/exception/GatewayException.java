package com.jreinhal.bastion.exception;

/**
 * Base type for failures that terminate a request with a classified error response.
 * The message is rendered to the client verbatim, so it must never carry internal detail.
 */
public abstract class GatewayException extends RuntimeException {
    private final ErrorCategory category;

    protected GatewayException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected GatewayException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return this.category;
    }

    /**
     * Seconds the client should wait before retrying, or {@code null} when the failure
     * carries no retry hint.
     */
    public Long getRetryAfterSeconds() {
        return null;
    }
}
