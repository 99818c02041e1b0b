package com.jreinhal.bastion.util;

import com.jreinhal.bastion.retrieval.SearchResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders retrieved passages into the numbered context block the model is grounded on.
 */
public final class ContextFormatter {
    public static final String NO_CONTEXT = "Veritabanında ilgili bilgi bulunamadı.";
    static final String SEPARATOR = "\n\n---\n\n";

    private ContextFormatter() {
    }

    public static String format(List<SearchResult> results) {
        if (results == null || results.isEmpty()) {
            return NO_CONTEXT;
        }
        List<String> parts = new ArrayList<>(results.size());
        int index = 1;
        for (SearchResult result : results) {
            StringBuilder part = new StringBuilder()
                    .append("[Kaynak ").append(index++).append("] (Skor: ")
                    .append(String.format(Locale.ROOT, "%.2f", result.score())).append(")\n")
                    .append("Marka: ").append(result.category()).append('\n')
                    .append("İçerik: ").append(result.text());
            if (!result.url().isEmpty()) {
                part.append("\nURL: ").append(result.url());
            }
            parts.add(part.toString());
        }
        return String.join(SEPARATOR, parts);
    }

    /**
     * Distinct non-empty source URLs in first-seen order.
     */
    public static List<String> sources(List<SearchResult> results) {
        if (results == null) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        for (SearchResult result : results) {
            if (!result.url().isEmpty()) {
                urls.add(result.url());
            }
        }
        return List.copyOf(urls);
    }
}
