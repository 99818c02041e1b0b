package com.jreinhal.bastion.budget;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Single-process counter store for development and tests. Counters never expire
 * until {@link #expire(String, long)} assigns them a lifetime.
 */
public class InMemoryCounterStore implements CounterStore {
    private final Cache<String, Long> counters;

    public InMemoryCounterStore() {
        this(Ticker.systemTicker());
    }

    public InMemoryCounterStore(Ticker ticker) {
        this.counters = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .maximumSize(100_000L)
                .expireAfter(new Expiry<String, Long>() {
                    @Override
                    public long expireAfterCreate(String key, Long value, long currentTime) {
                        return Long.MAX_VALUE;
                    }

                    @Override
                    public long expireAfterUpdate(String key, Long value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }

                    @Override
                    public long expireAfterRead(String key, Long value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public long increment(String key) {
        return this.counters.asMap().merge(key, 1L, Long::sum);
    }

    @Override
    public void expire(String key, long seconds) {
        this.counters.policy().expireVariably()
                .ifPresent(policy -> policy.setExpiresAfter(key, seconds, TimeUnit.SECONDS));
    }

    @Override
    public OptionalLong get(String key) {
        Long value = this.counters.getIfPresent(key);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
