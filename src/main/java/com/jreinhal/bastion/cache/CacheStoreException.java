package com.jreinhal.bastion.cache;

public class CacheStoreException extends RuntimeException {
    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
