package com.jreinhal.bastion.exception;

public class InvalidQueryException extends GatewayException {
    public InvalidQueryException(String message) {
        super(ErrorCategory.INVALID_QUERY, message);
    }
}
