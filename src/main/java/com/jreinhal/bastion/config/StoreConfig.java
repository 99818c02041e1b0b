package com.jreinhal.bastion.config;

import com.jreinhal.bastion.budget.CounterStore;
import com.jreinhal.bastion.budget.InMemoryCounterStore;
import com.jreinhal.bastion.budget.RedisCounterStore;
import com.jreinhal.bastion.cache.CacheStore;
import com.jreinhal.bastion.cache.InMemoryCacheStore;
import com.jreinhal.bastion.cache.RedisCacheStore;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPooled;

/**
 * Counter and cache stores. {@code bastion.store.type=redis} (default) shares state across
 * instances; {@code memory} keeps it in-process for development and tests.
 */
@Configuration
public class StoreConfig {
    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Configuration
    @ConditionalOnProperty(name = "bastion.store.type", havingValue = "redis", matchIfMissing = true)
    static class RedisStores {

        @Bean(destroyMethod = "close")
        public JedisPooled jedis(@Value("${bastion.redis.url:redis://localhost:6379/0}") String redisUrl) {
            URI uri = URI.create(redisUrl);
            log.info("Redis stores at {}:{}", uri.getHost(), uri.getPort());
            return new JedisPooled(uri);
        }

        @Bean
        public CounterStore counterStore(JedisPooled jedis) {
            return new RedisCounterStore(jedis);
        }

        @Bean
        public CacheStore cacheStore(JedisPooled jedis) {
            return new RedisCacheStore(jedis);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "bastion.store.type", havingValue = "memory")
    static class InMemoryStores {

        @Bean
        public CounterStore counterStore() {
            log.info("Using in-memory counter store");
            return new InMemoryCounterStore();
        }

        @Bean
        public CacheStore cacheStore() {
            log.info("Using in-memory cache store");
            return new InMemoryCacheStore();
        }
    }
}
