package com.jreinhal.bastion.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.pinecone.clients.Inference;
import io.pinecone.clients.Pinecone;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openapitools.inference.client.ApiException;
import org.openapitools.inference.client.model.Embedding;
import org.openapitools.inference.client.model.EmbeddingsList;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class PineconeEmbeddingProviderTest {
    private Pinecone pinecone;
    private Inference inference;
    private PineconeEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        this.pinecone = mock(Pinecone.class);
        this.inference = mock(Inference.class);
        when(this.pinecone.getInferenceClient()).thenReturn(this.inference);
        StaticListableBeanFactory beans = new StaticListableBeanFactory(Map.<String, Object>of("pinecone", this.pinecone));
        this.provider = new PineconeEmbeddingProvider(beans.getBeanProvider(Pinecone.class));
    }

    private static EmbeddingsList embeddings(List<BigDecimal> values) {
        Embedding embedding = mock(Embedding.class);
        when(embedding.getValues()).thenReturn(values);
        EmbeddingsList list = mock(EmbeddingsList.class);
        when(list.getData()).thenReturn(List.of(embedding));
        return list;
    }

    @Test
    void embedsQueryWithHostedModelAsQueryInput() throws Exception {
        EmbeddingsList response = embeddings(List.of(new BigDecimal("0.25"), new BigDecimal("-0.5"), BigDecimal.ONE));
        when(this.inference.embed(anyString(), anyMap(), anyList())).thenReturn(response);

        float[] vector = this.provider.embed("Pepsi ürünleri");

        assertThat(vector).containsExactly(0.25f, -0.5f, 1.0f);
        verify(this.inference).embed(eq("multilingual-e5-large"),
                eq(Map.of("input_type", "query", "truncate", "END")), eq(List.of("Pepsi ürünleri")));
    }

    @Test
    void inferenceClientIsCreatedOnce() throws Exception {
        EmbeddingsList response = embeddings(List.of(BigDecimal.ONE));
        when(this.inference.embed(anyString(), anyMap(), anyList())).thenReturn(response);

        this.provider.embed("pepsi");
        this.provider.embed("lipton");

        verify(this.pinecone, times(1)).getInferenceClient();
    }

    @Test
    void emptyVectorIsBackendError() throws Exception {
        EmbeddingsList response = mock(EmbeddingsList.class);
        when(response.getData()).thenReturn(List.of());
        when(this.inference.embed(anyString(), anyMap(), anyList())).thenReturn(response);

        assertThatThrownBy(() -> this.provider.embed("soru")).isInstanceOf(RetrievalBackendException.class);
    }

    @Test
    void apiErrorBecomesRetryableBackendError() throws Exception {
        when(this.inference.embed(anyString(), anyMap(), anyList())).thenThrow(new ApiException(503, "Service Unavailable"));

        assertThatThrownBy(() -> this.provider.embed("soru"))
                .isInstanceOf(RetrievalBackendException.class)
                .hasMessageContaining("503")
                .hasCauseInstanceOf(ApiException.class);
    }

    @Test
    void missingClientIsBackendError() {
        PineconeEmbeddingProvider unconfigured = new PineconeEmbeddingProvider(
                new StaticListableBeanFactory().getBeanProvider(Pinecone.class));

        assertThatThrownBy(() -> unconfigured.embed("soru"))
                .isInstanceOf(RetrievalBackendException.class)
                .hasMessageContaining("not configured");
    }
}
