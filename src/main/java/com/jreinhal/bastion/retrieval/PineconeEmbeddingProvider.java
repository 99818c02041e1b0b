package com.jreinhal.bastion.retrieval;

import io.pinecone.clients.Inference;
import io.pinecone.clients.Pinecone;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.openapitools.inference.client.ApiException;
import org.openapitools.inference.client.model.Embedding;
import org.openapitools.inference.client.model.EmbeddingsList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Query embeddings from Pinecone Inference, using the same hosted model the index was built with.
 */
@Component
public class PineconeEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(PineconeEmbeddingProvider.class);
    private static final Map<String, Object> QUERY_PARAMETERS = Map.of("input_type", "query", "truncate", "END");
    private final ObjectProvider<Pinecone> pinecone;
    @Value("${bastion.pinecone.embedding-model:multilingual-e5-large}")
    private String model = "multilingual-e5-large";
    private volatile Inference inference;

    public PineconeEmbeddingProvider(ObjectProvider<Pinecone> pinecone) {
        this.pinecone = pinecone;
    }

    @Override
    public float[] embed(String text) {
        EmbeddingsList embeddings;
        try {
            embeddings = this.inference().embed(this.model, QUERY_PARAMETERS, List.of(text));
        } catch (ApiException e) {
            throw new RetrievalBackendException("Embedding request failed with status " + e.getCode(), e);
        }
        List<Embedding> data = embeddings == null ? null : embeddings.getData();
        if (data == null || data.isEmpty() || data.get(0).getValues() == null || data.get(0).getValues().isEmpty()) {
            throw new RetrievalBackendException("Embedding response carried no vector");
        }
        List<BigDecimal> values = data.get(0).getValues();
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; ++i) {
            vector[i] = values.get(i).floatValue();
        }
        log.debug("Embedded query into {} dimensions", vector.length);
        return vector;
    }

    private Inference inference() {
        Inference client = this.inference;
        if (client == null) {
            Pinecone pineconeClient = this.pinecone.getIfAvailable();
            if (pineconeClient == null) {
                throw new RetrievalBackendException("Pinecone API key is not configured");
            }
            client = pineconeClient.getInferenceClient();
            this.inference = client;
        }
        return client;
    }
}
