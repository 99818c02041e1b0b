package com.jreinhal.bastion.retrieval;

import com.jreinhal.bastion.util.LogSanitizer;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Word-level fuzzy matcher over the known brand labels. Tolerates typos such as
 * "pepsii" or "lipon" without an embedding round-trip.
 */
@Component
public class FuzzyCategoryDetector implements CategoryDetector {
    private static final Logger log = LoggerFactory.getLogger(FuzzyCategoryDetector.class);
    private final List<String> categories;
    private final double scoreCutoff;

    public FuzzyCategoryDetector(
            @Value("${bastion.retrieval.categories:pepsi,pürsu,doğanay,kızılay,pınar,golf,lipton,fruko,erikli,fritolay,yedigün}") List<String> categories,
            @Value("${bastion.retrieval.category-score-cutoff:84}") double scoreCutoff) {
        this.categories = categories.stream()
                .map(String::trim)
                .filter(category -> !category.isEmpty())
                .map(category -> category.toLowerCase(Locale.ROOT))
                .toList();
        this.scoreCutoff = scoreCutoff;
    }

    @Override
    public String detect(String query) {
        if (query == null || query.isBlank()) {
            return DEFAULT_CATEGORY;
        }
        for (String word : query.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            String best = null;
            double bestScore = -1.0;
            for (String category : this.categories) {
                double score = ratio(word, category);
                if (score >= this.scoreCutoff && score > bestScore) {
                    best = category;
                    bestScore = score;
                }
            }
            if (best != null) {
                log.info("Fuzzy category match: '{}' -> '{}' (score: {})", LogSanitizer.sanitize(word), best, Math.round(bestScore));
                return best;
            }
        }
        return DEFAULT_CATEGORY;
    }

    /**
     * Normalized insertion/deletion similarity on a 0-100 scale: {@code 200 * LCS / (|a| + |b|)}.
     */
    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 100.0;
        }
        return 200.0 * longestCommonSubsequence(a, b) / total;
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); ++i) {
            for (int j = 1; j <= b.length(); ++j) {
                curr[j] = a.charAt(i - 1) == b.charAt(j - 1)
                        ? prev[j - 1] + 1
                        : Math.max(prev[j], curr[j - 1]);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
