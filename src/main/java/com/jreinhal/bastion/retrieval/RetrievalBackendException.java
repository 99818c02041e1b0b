package com.jreinhal.bastion.retrieval;

/**
 * Malformed or unexpected answer from the vector backend. Retried like a transport failure.
 */
public class RetrievalBackendException extends RuntimeException {
    public RetrievalBackendException(String message) {
        super(message);
    }

    public RetrievalBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
