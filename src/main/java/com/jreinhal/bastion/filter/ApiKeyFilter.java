package com.jreinhal.bastion.filter;

import com.jreinhal.bastion.exception.ErrorCategory;
import com.jreinhal.bastion.security.OriginResolver;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Shared-secret authentication via the {@code X-API-Key} header. A missing key is a 401,
 * an unknown key a 403. Keys are compared in constant time against every configured key.
 */
@Component
public class ApiKeyFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);
    public static final String HEADER_NAME = "X-API-Key";
    public static final String API_CLIENT_AUTHORITY = "ROLE_API_CLIENT";
    private static final Set<String> PUBLIC_API_PATHS = Set.of("/api/v1/health");
    private final ErrorResponseWriter errorResponseWriter;
    private final OriginResolver originResolver;
    @Value("${bastion.security.api-keys:}")
    private String apiKeyList;
    private List<byte[]> apiKeys = List.of();

    public ApiKeyFilter(ErrorResponseWriter errorResponseWriter, OriginResolver originResolver) {
        this.errorResponseWriter = errorResponseWriter;
        this.originResolver = originResolver;
    }

    @PostConstruct
    public void init() {
        if (this.apiKeyList == null || this.apiKeyList.isBlank()) {
            this.apiKeys = List.of();
            return;
        }
        this.apiKeys = Arrays.stream(this.apiKeyList.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(value -> value.getBytes(StandardCharsets.UTF_8))
                .toList();
        log.info("API key authentication enabled ({} keys configured)", this.apiKeys.size());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/") || PUBLIC_API_PATHS.contains(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws ServletException, IOException {
        String presented = request.getHeader(HEADER_NAME);
        if (presented == null || presented.isBlank()) {
            log.warn("Missing API key: path={} ip={}", request.getRequestURI(), this.originResolver.resolve(request));
            this.errorResponseWriter.write(response, ErrorCategory.AUTH_MISSING, null);
            return;
        }
        if (!this.isKnownKey(presented)) {
            log.warn("Invalid API key: path={} ip={}", request.getRequestURI(), this.originResolver.resolve(request));
            this.errorResponseWriter.write(response, ErrorCategory.AUTH_INVALID, null);
            return;
        }
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(UsernamePasswordAuthenticationToken.authenticated(
                "api-client", null, List.of(new SimpleGrantedAuthority(API_CLIENT_AUTHORITY))));
        SecurityContextHolder.setContext(context);
        try {
            chain.doFilter(request, response);
        } finally {
            SecurityContextHolder.clearContext();
        }
    }

    boolean isKnownKey(String presented) {
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] key : this.apiKeys) {
            match |= MessageDigest.isEqual(key, candidate);
        }
        return match;
    }
}
