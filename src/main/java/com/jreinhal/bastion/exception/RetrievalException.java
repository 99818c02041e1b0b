package com.jreinhal.bastion.exception;

public class RetrievalException extends GatewayException {
    public RetrievalException(String message, Throwable cause) {
        super(ErrorCategory.RETRIEVAL_ERROR, message, cause);
    }
}
