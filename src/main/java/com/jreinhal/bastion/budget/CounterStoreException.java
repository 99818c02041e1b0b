package com.jreinhal.bastion.budget;

public class CounterStoreException extends RuntimeException {
    public CounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
