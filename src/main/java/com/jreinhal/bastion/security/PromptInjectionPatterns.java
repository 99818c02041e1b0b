package com.jreinhal.bastion.security;

import java.util.List;
import java.util.regex.Pattern;

public final class PromptInjectionPatterns {
    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("ignore\\s+(all\\s+)?(previous|above|prior)\\s+(instructions?|prompts?)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard\\s+(all\\s+)?(previous|above|prior)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("you\\s+are\\s+now\\s+(?:a|an)\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("system\\s*:\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<\\|system\\|>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("act\\s+as\\s+(?:a|an)\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("forget\\s+(everything|all|your|previous)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("new\\s+instructions?\\s*:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("override\\s+(your|system|all)\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("pretend\\s+(you|that|to)\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("jailbreak", Pattern.CASE_INSENSITIVE),
            Pattern.compile("DAN\\s+mode", Pattern.CASE_INSENSITIVE)
    );

    private PromptInjectionPatterns() {
    }

    public static List<Pattern> getPatterns() {
        return PATTERNS;
    }
}
