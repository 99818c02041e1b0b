package com.jreinhal.bastion.security;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw user queries before they reach admission, guard and cache.
 */
public final class QueryNormalizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    // Unicode-aware so no-break and other non-ASCII spaces collapse too
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private QueryNormalizer() {
    }

    /**
     * Trims, strips control characters and collapses whitespace runs to a single space.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String stripped = CONTROL_CHARS.matcher(raw).replaceAll("");
        return WHITESPACE_RUN.matcher(stripped).replaceAll(" ").strip();
    }

    /**
     * Identity form used for cache fingerprints: normalized and lower-cased.
     */
    public static String canonical(String raw) {
        return normalize(raw).toLowerCase(Locale.ROOT);
    }
}
