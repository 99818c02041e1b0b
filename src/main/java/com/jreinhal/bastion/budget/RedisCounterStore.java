package com.jreinhal.bastion.budget;

import java.util.OptionalLong;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;

public class RedisCounterStore implements CounterStore {
    private static final String HEALTH_KEY = "budget:health";
    private final UnifiedJedis jedis;

    public RedisCounterStore(UnifiedJedis jedis) {
        this.jedis = jedis;
    }

    @Override
    public long increment(String key) {
        try {
            return this.jedis.incr(key);
        } catch (JedisException e) {
            throw new CounterStoreException("INCR failed for " + key, e);
        }
    }

    @Override
    public void expire(String key, long seconds) {
        try {
            this.jedis.expire(key, seconds);
        } catch (JedisException e) {
            throw new CounterStoreException("EXPIRE failed for " + key, e);
        }
    }

    @Override
    public OptionalLong get(String key) {
        try {
            String value = this.jedis.get(key);
            if (value == null) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Long.parseLong(value));
        } catch (JedisException e) {
            throw new CounterStoreException("GET failed for " + key, e);
        } catch (NumberFormatException e) {
            throw new CounterStoreException("Counter " + key + " holds a non-numeric value", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            this.jedis.exists(HEALTH_KEY);
            return true;
        } catch (JedisException e) {
            return false;
        }
    }
}
