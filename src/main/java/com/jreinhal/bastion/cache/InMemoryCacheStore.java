package com.jreinhal.bastion.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

public class InMemoryCacheStore implements CacheStore {
    private final Cache<String, String> entries;

    public InMemoryCacheStore() {
        this(Ticker.systemTicker());
    }

    public InMemoryCacheStore(Ticker ticker) {
        this.entries = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .maximumSize(10_000L)
                .expireAfter(new Expiry<String, String>() {
                    @Override
                    public long expireAfterCreate(String key, String value, long currentTime) {
                        return Long.MAX_VALUE;
                    }

                    @Override
                    public long expireAfterUpdate(String key, String value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }

                    @Override
                    public long expireAfterRead(String key, String value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(this.entries.getIfPresent(key));
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        this.entries.policy().expireVariably()
                .ifPresent(policy -> policy.put(key, value, ttlSeconds, TimeUnit.SECONDS));
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
