package com.jreinhal.bastion.cache;

import java.util.Optional;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

public class RedisCacheStore implements CacheStore {
    private static final String HEALTH_KEY = "chat:cache:health";
    private final UnifiedJedis jedis;

    public RedisCacheStore(UnifiedJedis jedis) {
        this.jedis = jedis;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(this.jedis.get(key));
        } catch (JedisException e) {
            throw new CacheStoreException("GET failed", e);
        }
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        try {
            this.jedis.set(key, value, SetParams.setParams().ex(ttlSeconds));
        } catch (JedisException e) {
            throw new CacheStoreException("SET failed", e);
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
