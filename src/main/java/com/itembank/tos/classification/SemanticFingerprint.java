package com.itembank.tos.classification;

import com.itembank.tos.text.TextNormalizer;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed-length hashed bag-of-words vector. Bucket assignment uses a 32-bit polynomial
 * rolling hash so vectors stay comparable with fingerprints produced elsewhere.
 */
public final class SemanticFingerprint {
    public static final int DIMENSIONS = 50;

    private SemanticFingerprint() {}

    public static List<Double> of(String text) {
        double[] vector = new double[DIMENSIONS];
        for (String token : TextNormalizer.words(TextNormalizer.lower(text))) {
            vector[bucket(token)] += 1.0;
        }

        double magnitude = Math.sqrt(Arrays.stream(vector).map(v -> v * v).sum());
        return Arrays.stream(vector)
                .map(v -> magnitude > 0 ? v / magnitude : v)
                .boxed()
                .toList();
    }

    static int bucket(String token) {
        return (int) (Math.abs((long) hash(token)) % DIMENSIONS);
    }

    static int hash(String token) {
        int hash = 0;
        for (int i = 0; i < token.length(); i++) {
            hash = 31 * hash + token.charAt(i);
        }
        return hash;
    }
}
