package com.jreinhal.bastion.exception;

public class GenerationException extends GatewayException {
    public GenerationException(String message, Throwable cause) {
        super(ErrorCategory.GENERATION_ERROR, message, cause);
    }
}
