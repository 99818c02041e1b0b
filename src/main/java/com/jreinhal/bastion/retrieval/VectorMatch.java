package com.jreinhal.bastion.retrieval;

import java.util.Map;

public record VectorMatch(String id, double score, Map<String, Object> metadata) {
    public VectorMatch {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
