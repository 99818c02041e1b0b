package com.jreinhal.bastion.retrieval;

import com.jreinhal.bastion.exception.RetrievalException;
import com.jreinhal.bastion.util.LogSanitizer;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Category-filtered semantic search with bounded retries.
 *
 * <p>Each attempt (embed, then query) runs on the upstream executor under its own timeout.
 * Failed attempts back off exponentially from {@code bastion.retrieval.initial-backoff-ms};
 * the category is detected once, outside the retry loop.
 */
@Service
public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);
    static final String FILTER_FIELD = "brand";
    private final CategoryDetector categoryDetector;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex vectorIndex;
    private final Executor executor;
    private final Sleeper sleeper;
    @Value("${bastion.retrieval.max-attempts:3}")
    private int maxAttempts = 3;
    @Value("${bastion.retrieval.initial-backoff-ms:1000}")
    private long initialBackoffMs = 1000L;
    @Value("${bastion.retrieval.attempt-timeout-ms:15000}")
    private long attemptTimeoutMs = 15000L;

    public RetrievalService(CategoryDetector categoryDetector, EmbeddingProvider embeddingProvider, VectorIndex vectorIndex,
                            @Qualifier("upstreamExecutor") Executor executor, Sleeper sleeper) {
        this.categoryDetector = categoryDetector;
        this.embeddingProvider = embeddingProvider;
        this.vectorIndex = vectorIndex;
        this.executor = executor;
        this.sleeper = sleeper;
    }

    public List<SearchResult> search(String query, int topK) {
        String category = this.categoryDetector.detect(query);
        log.info("Searching: query='{}' category={} topK={}", LogSanitizer.preview(query), category, topK);
        Throwable lastError = null;
        for (int attempt = 1; attempt <= this.maxAttempts; ++attempt) {
            try {
                List<SearchResult> results = this.runAttempt(query, category, topK);
                log.info("Search returned {} results", results.size());
                return results;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetrievalException("Search interrupted", e);
            } catch (RuntimeException | ExecutionException | TimeoutException e) {
                lastError = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            }
            if (attempt < this.maxAttempts) {
                Duration backoff = this.backoffAfter(attempt);
                log.warn("Search attempt {}/{} failed: {} | retrying in {}ms", attempt, this.maxAttempts, describe(lastError), backoff.toMillis());
                try {
                    this.sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RetrievalException("Search interrupted during backoff", e);
                }
            }
        }
        log.error("Search failed after {} attempts: {}", this.maxAttempts, describe(lastError));
        throw new RetrievalException("Search operation failed after " + this.maxAttempts + " attempts", lastError);
    }

    private List<SearchResult> runAttempt(String query, String category, int topK)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<List<SearchResult>> future = CompletableFuture.supplyAsync(() -> {
            float[] vector = this.embeddingProvider.embed(query);
            return this.vectorIndex.query(vector, topK, Map.of(FILTER_FIELD, category)).stream()
                    .map(SearchResult::fromMatch)
                    .toList();
        }, this.executor);
        try {
            return future.get(this.attemptTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    Duration backoffAfter(int attempt) {
        return Duration.ofMillis(this.initialBackoffMs << (attempt - 1));
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + LogSanitizer.sanitize(message));
    }
}
