package com.jreinhal.bastion.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // Control characters enable log injection/forging
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int PREVIEW_CHARS = 50;

    private LogSanitizer() {
    }

    /**
     * Short, single-line excerpt of a user query for log lines.
     */
    public static String preview(String query) {
        String clean = sanitize(query);
        if (clean.length() <= PREVIEW_CHARS) {
            return clean;
        }
        return clean.substring(0, PREVIEW_CHARS) + "...";
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }
}
