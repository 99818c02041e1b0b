package com.jreinhal.bastion.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.bastion.exception.ErrorCategory;
import com.jreinhal.bastion.exception.RetrievalException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class RetrievalServiceTest {
    private static final float[] VECTOR = {0.1f, 0.2f, 0.3f};
    private CategoryDetector categoryDetector;
    private EmbeddingProvider embeddingProvider;
    private VectorIndex vectorIndex;
    private List<Duration> sleeps;
    private RetrievalService service;

    @BeforeEach
    void setUp() {
        this.categoryDetector = mock(CategoryDetector.class);
        this.embeddingProvider = mock(EmbeddingProvider.class);
        this.vectorIndex = mock(VectorIndex.class);
        this.sleeps = new ArrayList<>();
        when(this.categoryDetector.detect(anyString())).thenReturn("pepsi");
        this.service = new RetrievalService(this.categoryDetector, this.embeddingProvider, this.vectorIndex, Runnable::run, this.sleeps::add);
    }

    @Test
    @DisplayName("Matches are mapped to results and filtered by the detected brand")
    void searchMapsMatches() {
        when(this.embeddingProvider.embed("Pepsi ürünleri")).thenReturn(VECTOR);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("text", "Pepsi Max şekersizdir.");
        metadata.put("brand", "pepsi");
        metadata.put("doc_type", "product");
        metadata.put("url", "https://gelisim.com/pepsi");
        when(this.vectorIndex.query(VECTOR, 3, Map.of("brand", "pepsi")))
                .thenReturn(List.of(new VectorMatch("doc-1", 0.92, metadata)));

        List<SearchResult> results = this.service.search("Pepsi ürünleri", 3);

        assertThat(results).containsExactly(
                new SearchResult("Pepsi Max şekersizdir.", "pepsi", "product", "https://gelisim.com/pepsi", 0.92));
        assertThat(this.sleeps).isEmpty();
    }

    @Test
    @DisplayName("Missing metadata falls back to empty text and url, unknown brand and doc type")
    void missingMetadataDefaults() {
        when(this.embeddingProvider.embed(anyString())).thenReturn(VECTOR);
        when(this.vectorIndex.query(any(), anyInt(), anyMap())).thenReturn(List.of(new VectorMatch("doc-2", 0.4, null)));

        List<SearchResult> results = this.service.search("soru", 3);

        assertThat(results).containsExactly(new SearchResult("", "unknown", "unknown", "", 0.4));
    }

    @Test
    @DisplayName("Transient failure is retried after a one second backoff")
    void retriesAfterFailure() {
        when(this.embeddingProvider.embed(anyString()))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(VECTOR);
        when(this.vectorIndex.query(any(), anyInt(), anyMap())).thenReturn(List.of());

        assertThat(this.service.search("soru", 3)).isEmpty();
        assertThat(this.sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Three failed attempts back off 1s then 2s and surface as retrieval_error")
    void exhaustsAttempts() {
        when(this.embeddingProvider.embed(anyString())).thenThrow(new RetrievalBackendException("503 from index"));

        assertThatThrownBy(() -> this.service.search("soru", 3))
                .isInstanceOfSatisfying(RetrievalException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.RETRIEVAL_ERROR);
                    assertThat(e.getCause()).isInstanceOf(RetrievalBackendException.class);
                });
        assertThat(this.sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        verify(this.embeddingProvider, times(3)).embed("soru");
    }

    @Test
    @DisplayName("The category is detected once, not per attempt")
    void detectsCategoryOnce() {
        when(this.embeddingProvider.embed(anyString())).thenThrow(new IllegalStateException("down"));

        assertThatThrownBy(() -> this.service.search("soru", 3)).isInstanceOf(RetrievalException.class);
        verify(this.categoryDetector, times(1)).detect("soru");
    }

    @Test
    @DisplayName("An attempt that exceeds its timeout counts as a failure")
    void attemptTimeout() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            RetrievalService timed = new RetrievalService(this.categoryDetector, this.embeddingProvider, this.vectorIndex, pool, this.sleeps::add);
            ReflectionTestUtils.setField(timed, "attemptTimeoutMs", 50L);
            ReflectionTestUtils.setField(timed, "maxAttempts", 2);
            when(this.embeddingProvider.embed(anyString())).thenAnswer(invocation -> {
                Thread.sleep(2000L);
                return VECTOR;
            });

            assertThatThrownBy(() -> timed.search("soru", 3))
                    .isInstanceOf(RetrievalException.class)
                    .hasCauseInstanceOf(TimeoutException.class);
            assertThat(this.sleeps).containsExactly(Duration.ofSeconds(1));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void backoffDoublesPerAttempt() {
        assertThat(this.service.backoffAfter(1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(this.service.backoffAfter(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(this.service.backoffAfter(3)).isEqualTo(Duration.ofMillis(4000));
    }

    @Test
    @DisplayName("Interrupted backoff stops retrying and restores the interrupt flag")
    void interruptedBackoff() {
        RetrievalService interrupted = new RetrievalService(this.categoryDetector, this.embeddingProvider, this.vectorIndex, Runnable::run,
                duration -> {
                    throw new InterruptedException("shutdown");
                });
        when(this.embeddingProvider.embed(anyString())).thenThrow(new IllegalStateException("down"));

        try {
            assertThatThrownBy(() -> interrupted.search("soru", 3)).isInstanceOf(RetrievalException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            verify(this.embeddingProvider, times(1)).embed(eq("soru"));
        } finally {
            Thread.interrupted();
        }
    }
}
