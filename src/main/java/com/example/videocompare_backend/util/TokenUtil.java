package com.example.videocompare_backend.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Whitespace tokenization shared by the summarizer's token budget and the comparator's
 * word-level signals.
 */
public final class TokenUtil {

    private TokenUtil() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.asList(text.strip().split("\\s+"));
    }

    public static int count(String text) {
        return tokenize(text).size();
    }

    public static String join(List<String> tokens) {
        return String.join(" ", tokens);
    }

    /** Fixed-size, non-overlapping windows in order; the last one may be shorter. */
    public static List<List<String>> windows(List<String> tokens, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("window size must be positive: " + size);
        }
        List<List<String>> out = new ArrayList<>();
        for (int start = 0; start < tokens.size(); start += size) {
            out.add(tokens.subList(start, Math.min(tokens.size(), start + size)));
        }
        return out;
    }

    public static List<String> truncate(List<String> tokens, int limit) {
        return tokens.size() <= limit ? tokens : tokens.subList(0, limit);
    }

    public static Set<String> distinctLowercase(String text) {
        Set<String> out = new LinkedHashSet<>();
        for (String token : tokenize(text)) {
            out.add(token.toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
