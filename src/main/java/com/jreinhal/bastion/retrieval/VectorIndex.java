package com.jreinhal.bastion.retrieval;

import java.util.List;
import java.util.Map;

public interface VectorIndex {

    /**
     * Nearest-neighbour query restricted to entries whose metadata equals every
     * filter pair. Results are ordered by descending score.
     */
    List<VectorMatch> query(float[] vector, int topK, Map<String, String> filter);
}
