package com.itembank.tos.text;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SEPARATORS = Pattern.compile("[_\\-]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");

    public static final int MIN_SEARCH_TOKEN_LENGTH = 3;

    private TextNormalizer() {}

    public static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    public static List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();
        return Arrays.stream(WHITESPACE.split(text.trim()))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    public static int wordCount(String text) {
        return words(text).size();
    }

    public static String normalizeLabel(String text) {
        if (text == null) return "";
        String s = SEPARATORS.matcher(lower(text)).replaceAll(" ");
        s = NON_ALPHANUMERIC.matcher(s).replaceAll("");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    public static List<String> searchTokens(String text) {
        if (text == null || text.isBlank()) return List.of();
        String cleaned = NON_WORD.matcher(lower(text)).replaceAll(" ");
        return Arrays.stream(WHITESPACE.split(cleaned))
                .filter(t -> t.length() >= MIN_SEARCH_TOKEN_LENGTH)
                .toList();
    }
}
