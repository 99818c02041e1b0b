package com.jreinhal.bastion.retrieval;

/**
 * One retrieved passage. Absent metadata is coerced to empty strings or {@code "unknown"},
 * never {@code null}.
 */
public record SearchResult(String text, String category, String docType, String url, double score) {
    static final String UNKNOWN = "unknown";

    static SearchResult fromMatch(VectorMatch match) {
        return new SearchResult(
                stringOrDefault(match.metadata().get("text"), ""),
                stringOrDefault(match.metadata().get("brand"), UNKNOWN),
                stringOrDefault(match.metadata().get("doc_type"), UNKNOWN),
                stringOrDefault(match.metadata().get("url"), ""),
                match.score());
    }

    private static String stringOrDefault(Object value, String fallback) {
        return value == null ? fallback : value.toString();
    }
}
