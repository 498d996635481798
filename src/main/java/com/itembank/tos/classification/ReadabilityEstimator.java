package com.itembank.tos.classification;

import com.itembank.tos.text.TextNormalizer;

import java.util.Arrays;
import java.util.regex.Pattern;

public final class ReadabilityEstimator {
    static final double NO_SENTENCE_GRADE = 8.0;

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern NON_LETTER = Pattern.compile("[^a-z]");
    private static final Pattern VOWEL_RUN = Pattern.compile("[aeiou]{2,}");
    private static final Pattern CONSONANT = Pattern.compile("[^aeiou]");

    private ReadabilityEstimator() {}

    public static double grade(String text) {
        int sentences = sentenceCount(text);
        if (sentences == 0) return NO_SENTENCE_GRADE;

        int words = TextNormalizer.wordCount(text);
        int syllables = syllableEstimate(text);
        double grade = 0.39 * ((double) words / sentences) + 11.8 * ((double) syllables / words) - 15.59;
        return Math.round(grade * 10) / 10.0;
    }

    static int sentenceCount(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (int) Arrays.stream(SENTENCE_END.split(text))
                .filter(s -> !s.isBlank())
                .count();
    }

    static int syllableEstimate(String text) {
        String letters = NON_LETTER.matcher(TextNormalizer.lower(text)).replaceAll("");
        String collapsed = VOWEL_RUN.matcher(letters).replaceAll("a");
        int vowels = CONSONANT.matcher(collapsed).replaceAll("").length();
        return vowels == 0 ? 1 : vowels;
    }
}
