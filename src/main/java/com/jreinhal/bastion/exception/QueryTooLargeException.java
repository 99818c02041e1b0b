package com.jreinhal.bastion.exception;

public class QueryTooLargeException extends GatewayException {
    public QueryTooLargeException(String message) {
        super(ErrorCategory.QUERY_TOO_LARGE, message);
    }
}
