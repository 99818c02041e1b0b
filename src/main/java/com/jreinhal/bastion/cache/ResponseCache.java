package com.jreinhal.bastion.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.bastion.security.QueryNormalizer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Fingerprint-keyed answer cache. Store failures degrade to a miss on read and a
 * no-op on write; they never fail the request.
 */
@Component
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);
    public static final String KEY_PREFIX = "chat:cache:";
    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    @Value("${bastion.cache.ttl-seconds:300}")
    private long ttlSeconds = 300L;

    public ResponseCache(CacheStore cacheStore, ObjectMapper objectMapper, Clock clock) {
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Optional<CacheEntry> lookup(String query) {
        String key = fingerprint(query);
        try {
            Optional<String> raw = this.cacheStore.get(key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(this.objectMapper.readValue(raw.get(), CacheEntry.class));
        } catch (CacheStoreException e) {
            log.warn("Cache read error (continuing without cache): {}", e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public void store(String query, String response, List<String> sources) {
        String key = fingerprint(query);
        try {
            String json = this.objectMapper.writeValueAsString(new CacheEntry(response, sources, this.clock.millis()));
            this.cacheStore.set(key, json, this.ttlSeconds);
        } catch (CacheStoreException e) {
            log.warn("Cache write error (continuing without cache): {}", e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Cache entry serialization failed: {}", e.getOriginalMessage());
        }
    }

    public boolean isAvailable() {
        return this.cacheStore.isAvailable();
    }

    public static String fingerprint(String query) {
        String canonical = QueryNormalizer.canonical(query);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return KEY_PREFIX + HexFormat.of().formatHex(hash).toLowerCase(Locale.ROOT);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
