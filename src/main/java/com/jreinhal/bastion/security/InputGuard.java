package com.jreinhal.bastion.security;

import com.jreinhal.bastion.exception.InvalidQueryException;
import com.jreinhal.bastion.exception.QueryTooLargeException;
import com.jreinhal.bastion.util.LogSanitizer;
import java.text.Normalizer;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Size limits and prompt-injection screening for normalized queries.
 *
 * <p>Size violations are errors. An injection match is not: callers branch on
 * {@link #detectInjection(String)} and answer with a fixed refusal.
 */
@Component
public class InputGuard {
    private static final Logger log = LoggerFactory.getLogger(InputGuard.class);
    public static final int MIN_QUERY_CHARS = 2;
    @Value("${bastion.guard.max-query-chars:1000}")
    private int maxQueryChars = 1000;
    @Value("${bastion.guard.max-query-tokens:350}")
    private int maxQueryTokens = 350;
    @Value("${bastion.guard.chars-per-token:3}")
    private int charsPerToken = 3;

    public void validateSize(String query) {
        int length = characterCount(query);
        if (length < MIN_QUERY_CHARS) {
            throw new InvalidQueryException("Sorgu en az " + MIN_QUERY_CHARS + " karakter olmalıdır.");
        }
        if (length > this.maxQueryChars) {
            log.warn("Query too long: chars={} limit={}", length, this.maxQueryChars);
            throw new QueryTooLargeException("Sorgunuz çok uzun (" + length + " karakter). Maksimum " + this.maxQueryChars + " karakter gönderebilirsiniz.");
        }
        int estimatedTokens = this.estimateTokens(query);
        if (estimatedTokens > this.maxQueryTokens) {
            log.warn("Query estimated tokens too high: estTokens={} limit={}", estimatedTokens, this.maxQueryTokens);
            throw new QueryTooLargeException("Sorgunuz çok karmaşık/uzun. Lütfen daha kısa bir soru sorun.");
        }
    }

    public boolean detectInjection(String query) {
        if (query == null || query.isEmpty()) {
            return false;
        }
        // NFKC folds fullwidth and compatibility forms onto the ASCII the patterns expect
        String normalized = Normalizer.normalize(query, Normalizer.Form.NFKC);
        for (Pattern pattern : PromptInjectionPatterns.getPatterns()) {
            if (pattern.matcher(normalized).find()) {
                log.warn("Prompt injection detected: pattern={} query='{}'", pattern.pattern(), LogSanitizer.preview(query));
                return true;
            }
        }
        return false;
    }

    /**
     * Length in Unicode code points; an emoji or other supplementary character counts once.
     */
    public static int characterCount(String query) {
        return query == null ? 0 : query.codePointCount(0, query.length());
    }

    int estimateTokens(String query) {
        return (characterCount(query) + this.charsPerToken - 1) / this.charsPerToken;
    }
}
