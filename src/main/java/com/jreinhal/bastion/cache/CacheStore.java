package com.jreinhal.bastion.cache;

import java.util.Optional;

/**
 * Key/value store with per-entry TTL backing the response cache.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, long ttlSeconds);

    boolean isAvailable();
}
