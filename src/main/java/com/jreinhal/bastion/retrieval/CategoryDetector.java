package com.jreinhal.bastion.retrieval;

/**
 * Maps a query to the category label used to narrow the vector search.
 */
public interface CategoryDetector {
    String DEFAULT_CATEGORY = "sirket_genel";

    /**
     * @return a known category label, or {@link #DEFAULT_CATEGORY} when none is recognized
     */
    String detect(String query);
}
