package com.itembank.tos.taxonomy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public class TaxonomyModels {

    public enum CognitiveLevel {
        REMEMBERING, UNDERSTANDING, APPLYING, ANALYZING, EVALUATING, CREATING;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static CognitiveLevel fromKey(String key) {
            return lookup(values(), key).orElseThrow(() -> new IllegalArgumentException("Unknown cognitive level: " + key));
        }

        public static Optional<CognitiveLevel> find(String key) {
            return lookup(values(), key);
        }
    }

    public enum KnowledgeDimension {
        FACTUAL, CONCEPTUAL, PROCEDURAL, METACOGNITIVE;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static KnowledgeDimension fromKey(String key) {
            return lookup(values(), key).orElseThrow(() -> new IllegalArgumentException("Unknown knowledge dimension: " + key));
        }

        public static Optional<KnowledgeDimension> find(String key) {
            return lookup(values(), key);
        }
    }

    public enum Difficulty {
        EASY, AVERAGE, DIFFICULT;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Difficulty fromKey(String key) {
            return lookup(values(), key).orElseThrow(() -> new IllegalArgumentException("Unknown difficulty: " + key));
        }

        public static Optional<Difficulty> find(String key) {
            return lookup(values(), key);
        }
    }

    public enum QuestionType {
        MCQ, TRUE_FALSE, ESSAY, SHORT_ANSWER;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static QuestionType fromKey(String key) {
            return lookup(values(), key).orElseThrow(() -> new IllegalArgumentException("Unknown question type: " + key));
        }
    }

    // Accepts "Remembering", "true-false", " ESSAY " and the like.
    private static <E extends Enum<E>> Optional<E> lookup(E[] values, String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        String wanted = key.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return Arrays.stream(values).filter(v -> v.name().equals(wanted)).findFirst();
    }
}
