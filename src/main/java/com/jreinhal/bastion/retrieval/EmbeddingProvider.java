package com.jreinhal.bastion.retrieval;

public interface EmbeddingProvider {

    /**
     * Embeds a single search query. Implementations throw unchecked exceptions on
     * transport or backend failure; the caller decides whether to retry.
     */
    float[] embed(String text);
}
