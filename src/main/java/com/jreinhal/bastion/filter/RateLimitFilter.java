package com.jreinhal.bastion.filter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.bastion.exception.ErrorCategory;
import com.jreinhal.bastion.security.OriginResolver;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-origin requests-per-minute limit. Chat endpoints share one tighter budget; other
 * API paths use the default budget. Health checks are exempt.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);
    static final long RETRY_AFTER_SECONDS = 60L;
    private final OriginResolver originResolver;
    private final ErrorResponseWriter errorResponseWriter;
    @Value("${bastion.rate-limit.enabled:true}")
    private boolean enabled;
    @Value("${bastion.rate-limit.chat-rpm:20}")
    private int chatRpm;
    @Value("${bastion.rate-limit.default-rpm:100}")
    private int defaultRpm;
    private final Cache<String, Bucket> bucketCache = Caffeine.newBuilder().maximumSize(10000L).expireAfterAccess(1L, TimeUnit.HOURS).build();

    public RateLimitFilter(OriginResolver originResolver, ErrorResponseWriter errorResponseWriter) {
        this.originResolver = originResolver;
        this.errorResponseWriter = errorResponseWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !this.enabled || path == null || !path.startsWith("/api/") || "/api/v1/health".equals(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws ServletException, IOException {
        String path = request.getRequestURI();
        boolean chatPath = path.startsWith("/api/v1/chat");
        int allowedRpm = chatPath ? this.chatRpm : this.defaultRpm;
        String rateLimitKey = (chatPath ? "chat:" : "api:") + this.originResolver.resolve(request);
        Bucket bucket = this.bucketCache.get(rateLimitKey, k -> this.createBucket(allowedRpm));
        if (bucket.tryConsume(1L)) {
            response.setHeader("X-RateLimit-Limit", String.valueOf(allowedRpm));
            response.setHeader("X-RateLimit-Remaining", String.valueOf(bucket.getAvailableTokens()));
            chain.doFilter(request, response);
            return;
        }
        log.warn("Rate limit exceeded for key: {} on path: {}", rateLimitKey, path);
        response.setHeader("X-RateLimit-Limit", String.valueOf(allowedRpm));
        response.setHeader("X-RateLimit-Remaining", "0");
        this.errorResponseWriter.write(response, ErrorCategory.RATE_LIMITED, RETRY_AFTER_SECONDS);
    }

    private Bucket createBucket(int requestsPerMinute) {
        long capacity = requestsPerMinute;
        Bandwidth limit = Bandwidth.builder().capacity(capacity).refillGreedy(capacity, Duration.ofMinutes(1L)).build();
        return Bucket.builder().addLimit(limit).build();
    }
}
