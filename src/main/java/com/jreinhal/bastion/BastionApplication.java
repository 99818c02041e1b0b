package com.jreinhal.bastion;

import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class BastionApplication {
    private static final Logger log = LoggerFactory.getLogger(BastionApplication.class);
    private final Environment environment;

    public BastionApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(BastionApplication.class, args);
    }

    @PostConstruct
    public void validateSecurityConfiguration() {
        boolean isDevProfile = Arrays.stream(this.environment.getActiveProfiles()).anyMatch(profile -> "dev".equalsIgnoreCase(profile));
        String apiKeys = this.environment.getProperty("bastion.security.api-keys", "");
        String storeType = this.environment.getProperty("bastion.store.type", "redis");
        if (apiKeys.isBlank()) {
            log.error("=================================================================");
            log.error("  SECURITY WARNING: NO API KEYS CONFIGURED");
            log.error("=================================================================");
            log.error("  Every request to /api/v1/chat will be rejected with 403.");
            log.error("  Set BASTION_API_KEYS to a comma-separated list of keys.");
            log.error("=================================================================");
        }
        if (this.environment.getProperty("bastion.pinecone.api-key", "").isBlank()) {
            log.warn("=================================================================");
            log.warn("  NO PINECONE API KEY CONFIGURED");
            log.warn("=================================================================");
            log.warn("  Retrieval is disabled; chat requests that miss the cache will");
            log.warn("  fail with 503. Set PINECONE_API_KEY to enable it.");
            log.warn("=================================================================");
        }
        if ("memory".equalsIgnoreCase(storeType) && !isDevProfile) {
            log.warn("=================================================================");
            log.warn("  IN-MEMORY STORES OUTSIDE DEV PROFILE");
            log.warn("=================================================================");
            log.warn("  Daily budgets and cached answers are per-instance and are lost");
            log.warn("  on restart. Set bastion.store.type=redis for shared deployments.");
            log.warn("=================================================================");
        }
        log.info("Bastion gateway configured (store={}, profiles={})", storeType, Arrays.toString(this.environment.getActiveProfiles()));
    }
}
