package com.itembank.tos.classification;

import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import com.itembank.tos.taxonomy.TaxonomyModels.Difficulty;
import com.itembank.tos.taxonomy.TaxonomyModels.KnowledgeDimension;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;

import java.util.List;

public class ClassificationModels {
    public record RawQuestion(String text, QuestionType declaredType, String topic) {}

    public record Classification(CognitiveLevel cognitiveLevel,
                                 KnowledgeDimension knowledgeDimension,
                                 Difficulty difficulty,
                                 double confidence,
                                 double qualityScore,
                                 double readabilityScore,
                                 List<Double> fingerprint,
                                 boolean needsReview) {}

    public record ClassifiedQuestion(RawQuestion question, Classification classification) {}
}
