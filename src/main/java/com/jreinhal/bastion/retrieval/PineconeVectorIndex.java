package com.jreinhal.bastion.retrieval;

import io.pinecone.clients.Index;
import io.pinecone.clients.Pinecone;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Metadata-filtered similarity queries against one Pinecone serverless index.
 *
 * <p>The index connection is opened on first use; the SDK resolves the data-plane host
 * from the index name at that point and the connection is reused afterwards.</p>
 */
@Component
public class PineconeVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(PineconeVectorIndex.class);
    private final ObjectProvider<Pinecone> pinecone;
    @Value("${bastion.pinecone.index-name:gelisim-bot-index}")
    private String indexName = "gelisim-bot-index";
    @Value("${bastion.pinecone.namespace:}")
    private String namespace = "";
    private volatile Index connection;

    public PineconeVectorIndex(ObjectProvider<Pinecone> pinecone) {
        this.pinecone = pinecone;
    }

    @Override
    public List<VectorMatch> query(float[] vector, int topK, Map<String, String> filter) {
        List<Float> values = new ArrayList<>(vector.length);
        for (float component : vector) {
            values.add(component);
        }
        QueryResponseWithUnsignedIndices response = this.connection()
                .queryByVector(topK, values, this.namespace, PineconeMetadata.equalityFilter(filter), false, true);
        if (response == null || response.getMatchesList() == null) {
            throw new RetrievalBackendException("Index query returned no response");
        }
        List<VectorMatch> results = new ArrayList<>();
        for (ScoredVectorWithUnsignedIndices match : response.getMatchesList()) {
            String id = match.getId() == null ? "" : match.getId();
            results.add(new VectorMatch(id, match.getScore(), PineconeMetadata.toMap(match.getMetadata())));
        }
        return results;
    }

    private Index connection() {
        Index index = this.connection;
        if (index == null) {
            synchronized (this) {
                index = this.connection;
                if (index == null) {
                    Pinecone client = this.pinecone.getIfAvailable();
                    if (client == null) {
                        throw new RetrievalBackendException("Pinecone API key is not configured");
                    }
                    index = client.getIndexConnection(this.indexName);
                    this.connection = index;
                    log.info("Pinecone index '{}' connected", this.indexName);
                }
            }
        }
        return index;
    }
}
