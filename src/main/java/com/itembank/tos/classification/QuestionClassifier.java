package com.itembank.tos.classification;

import com.itembank.tos.classification.ClassificationModels.Classification;
import com.itembank.tos.classification.ClassificationModels.ClassifiedQuestion;
import com.itembank.tos.classification.ClassificationModels.RawQuestion;
import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import com.itembank.tos.taxonomy.TaxonomyModels.Difficulty;
import com.itembank.tos.taxonomy.TaxonomyModels.KnowledgeDimension;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;
import com.itembank.tos.taxonomy.TaxonomyTables;
import com.itembank.tos.text.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Rule-based classifier for short assessment items.
 * <p>
 * Stateless and total: any text, including the empty string, yields a classification.
 * Confidence and quality are accumulated in hundredths so that equal inputs always land
 * on the same two-decimal value.
 */
@Component
public class QuestionClassifier {
    public static final double REVIEW_THRESHOLD = 0.7;

    private static final String COMPLEXITY_CHARS = ",:;()-";

    public Classification classify(String text, QuestionType declaredType) {
        String source = text == null ? "" : text;
        QuestionType type = declaredType == null ? QuestionType.SHORT_ANSWER : declaredType;
        String t = TextNormalizer.lower(source);
        int wordCount = TextNormalizer.wordCount(source);

        CognitiveLevel level = CognitiveLevel.UNDERSTANDING;
        KnowledgeDimension dimension = KnowledgeDimension.CONCEPTUAL;
        int verbHits = 0;
        int dimensionHits = 0;

        Map.Entry<String, CognitiveLevel> levelCue = firstCue(t, TaxonomyTables.LEVEL_CUE_VERBS);
        if (levelCue != null) {
            level = levelCue.getValue();
            verbHits++;
        }

        Map.Entry<String, KnowledgeDimension> dimensionCue = firstCue(t, TaxonomyTables.DIMENSION_CUE_VERBS);
        if (dimensionCue != null) {
            dimension = dimensionCue.getValue();
            dimensionHits++;
        }

        if (verbHits == 0) {
            for (Map.Entry<KnowledgeDimension, List<String>> indicators : TaxonomyTables.DIMENSION_INDICATORS) {
                if (indicators.getValue().stream().anyMatch(t::contains)) {
                    dimension = indicators.getKey();
                    dimensionHits++;
                    break;
                }
            }
        }

        if (type == QuestionType.ESSAY && dimension == KnowledgeDimension.FACTUAL) {
            dimension = KnowledgeDimension.CONCEPTUAL;
        }

        double confidence = confidence(t, type, level, wordCount, verbHits, dimensionHits);
        return new Classification(
                level,
                dimension,
                difficulty(t, type, level, wordCount),
                confidence,
                qualityScore(source, type, wordCount),
                ReadabilityEstimator.grade(source),
                SemanticFingerprint.of(source),
                confidence < REVIEW_THRESHOLD);
    }

    public ClassifiedQuestion classify(RawQuestion question) {
        return new ClassifiedQuestion(question, classify(question.text(), question.declaredType()));
    }

    public List<ClassifiedQuestion> classifyAll(List<RawQuestion> questions) {
        return questions.stream().map(this::classify).toList();
    }

    // Whole word inside the text, verb at the very start, or verb followed by a colon.
    private static <V> Map.Entry<String, V> firstCue(String t, List<Map.Entry<String, V>> table) {
        for (Map.Entry<String, V> cue : table) {
            String verb = cue.getKey();
            if (t.contains(" " + verb + " ") || t.startsWith(verb) || t.contains(verb + ":")) {
                return cue;
            }
        }
        return null;
    }

    private double confidence(String t, QuestionType type, CognitiveLevel level, int wordCount,
                              int verbHits, int dimensionHits) {
        int points = 50 + 20 * verbHits + 10 * dimensionHits;
        if (wordCount < 8) points -= 10;
        if (wordCount > 25) points += 10;
        if (type == QuestionType.MCQ && t.contains("which of the following")) points += 10;
        if (type == QuestionType.ESSAY && level == CognitiveLevel.CREATING) points += 10;
        return Math.min(100, Math.max(10, points)) / 100.0;
    }

    private Difficulty difficulty(String t, QuestionType type, CognitiveLevel level, int wordCount) {
        if (TaxonomyTables.EASY_KEYWORDS.stream().anyMatch(t::contains)) return Difficulty.EASY;
        if (TaxonomyTables.DIFFICULT_KEYWORDS.stream().anyMatch(t::contains)) return Difficulty.DIFFICULT;

        long complexity = t.chars().filter(c -> COMPLEXITY_CHARS.indexOf(c) >= 0).count();
        if (type == QuestionType.ESSAY || complexity > 6 || wordCount > 30) return Difficulty.DIFFICULT;
        if (wordCount > 15 || complexity > 3) return Difficulty.AVERAGE;

        return switch (level) {
            case REMEMBERING, UNDERSTANDING -> Difficulty.EASY;
            case EVALUATING, CREATING -> Difficulty.DIFFICULT;
            default -> Difficulty.AVERAGE;
        };
    }

    private double qualityScore(String text, QuestionType type, int wordCount) {
        int points = 100;
        if (wordCount < 5) points -= 30;
        if (wordCount > 50) points -= 20;

        String trimmed = text.trim();
        char last = trimmed.isEmpty() ? ' ' : trimmed.charAt(trimmed.length() - 1);
        if (last != '.' && last != '?' && last != '!') points -= 10;
        if (text.contains("  ")) points -= 5;

        if (type == QuestionType.MCQ && !text.contains("?") && !TextNormalizer.lower(text).contains("which")) {
            points -= 10;
        }
        return Math.max(0, Math.min(100, points)) / 100.0;
    }
}
