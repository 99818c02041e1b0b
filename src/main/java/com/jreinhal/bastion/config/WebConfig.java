package com.jreinhal.bastion.config;

import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the browser front end. Only the configured origins may call the API, and
 * only with the two headers the chat client needs.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
    private static final Logger log = LoggerFactory.getLogger(WebConfig.class);
    @Value("${bastion.cors.allowed-origins:http://localhost:3000}")
    private String[] allowedOrigins;
    @Value("${bastion.cors.allow-credentials:true}")
    private boolean allowCredentials;

    @PostConstruct
    public void validateCorsConfiguration() {
        boolean hasWildcard = Arrays.asList(this.allowedOrigins).contains("*");
        if (hasWildcard) {
            log.error("=================================================================");
            log.error("  SECURITY WARNING: CORS wildcard (*) configured!");
            log.error("=================================================================");
            log.error("  Allowed Origins: {}", Arrays.toString(this.allowedOrigins));
            log.error("  This allows ANY website to spend this gateway's daily budget.");
            log.error("  To fix: set bastion.cors.allowed-origins to explicit domains");
            log.error("=================================================================");
        }
        if (this.allowCredentials && hasWildcard) {
            log.error("  CRITICAL: credentials cannot be combined with a wildcard origin; browsers will reject it.");
        }
        log.info("CORS Configuration:");
        log.info("  Allowed Origins: {}", Arrays.toString(this.allowedOrigins));
        log.info("  Allow Credentials: {}", this.allowCredentials);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(this.allowedOrigins)
                .allowedMethods("GET", "POST")
                .allowedHeaders("X-API-Key", "Content-Type")
                .exposedHeaders("X-Request-ID", "Retry-After")
                .allowCredentials(this.allowCredentials)
                .maxAge(600);
    }
}
