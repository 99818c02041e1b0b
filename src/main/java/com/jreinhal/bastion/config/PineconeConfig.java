package com.jreinhal.bastion.config;

import io.pinecone.clients.Pinecone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pinecone SDK client. Without an API key no client is created and retrieval fails as a
 * dependency outage instead of at startup.
 */
@Configuration
public class PineconeConfig {
    private static final Logger log = LoggerFactory.getLogger(PineconeConfig.class);

    @Bean
    @ConditionalOnExpression("!'${bastion.pinecone.api-key:}'.isBlank()")
    public Pinecone pinecone(@Value("${bastion.pinecone.api-key}") String apiKey,
                             @Value("${bastion.pinecone.index-name:gelisim-bot-index}") String indexName) {
        log.info("Pinecone client configured for index '{}'", indexName);
        return new Pinecone.Builder(apiKey).build();
    }
}
