package com.jreinhal.bastion.service;

import com.jreinhal.bastion.exception.GenerationException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Grounded answer generation. Sampling settings are fixed here and are not caller-tunable.
 */
@Service
public class GenerationService {
    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);
    static final int MAX_TOKENS = 500;
    static final double TEMPERATURE = 0.3;
    private final ChatClient chatClient;
    private final Executor executor;
    private final ChatOptions llmOptions;
    private final long timeoutSeconds;

    public GenerationService(ChatClient.Builder builder, @Qualifier("upstreamExecutor") Executor executor,
                             @Value("${bastion.llm.model:gpt-4o-mini}") String model,
                             @Value("${bastion.llm.timeout-seconds:30}") long timeoutSeconds) {
        this.chatClient = builder.build();
        this.executor = executor;
        this.timeoutSeconds = timeoutSeconds;
        this.llmOptions = ChatOptions.builder()
                .model(model)
                .maxTokens(MAX_TOKENS)
                .temperature(TEMPERATURE)
                .build();
        log.info("=== LLM Configuration ===");
        log.info("  Model: {}", this.llmOptions.getModel());
        log.info("  Temperature: {}", this.llmOptions.getTemperature());
        log.info("  Max Tokens: {}", this.llmOptions.getMaxTokens());
        log.info("  Timeout: {}s", this.timeoutSeconds);
        log.info("=========================");
    }

    public String generate(String query, String context) {
        String userPrompt = PromptTemplates.userPrompt(query, context);
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> this.chatClient.prompt()
                    .system(PromptTemplates.SYSTEM_PROMPT)
                    .user(userPrompt)
                    .options(this.llmOptions)
                    .call()
                    .content(), this.executor);
        } catch (RuntimeException e) {
            log.error("LLM generation could not be scheduled: {}", e.getMessage());
            throw new GenerationException("LLM generation could not be scheduled", e);
        }
        try {
            String answer = future.get(this.timeoutSeconds, TimeUnit.SECONDS);
            if (answer == null || answer.isEmpty()) {
                throw new GenerationException("LLM returned no content", null);
            }
            log.info("LLM response generated: chars={}", answer.length());
            return answer;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("LLM generation timed out after {}s", this.timeoutSeconds);
            throw new GenerationException("LLM generation timed out", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("LLM generation failed: {}", cause.toString());
            throw new GenerationException("LLM generation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("LLM generation interrupted", e);
        }
    }

    /**
     * Lazily streams answer fragments; nothing is sent upstream until subscription.
     * Any failure, including one after fragments were emitted, terminates the flux with a
     * {@link GenerationException}.
     */
    public Flux<String> generateStream(String query, String context) {
        String userPrompt = PromptTemplates.userPrompt(query, context);
        return Flux.defer(() -> this.chatClient.prompt()
                        .system(PromptTemplates.SYSTEM_PROMPT)
                        .user(userPrompt)
                        .options(this.llmOptions)
                        .stream()
                        .content())
                .filter(fragment -> !fragment.isEmpty())
                .timeout(Duration.ofSeconds(this.timeoutSeconds))
                .onErrorMap(error -> !(error instanceof GenerationException), error -> {
                    log.error("LLM streaming failed: {}", error.toString());
                    return new GenerationException("LLM streaming failed", error);
                });
    }
}
