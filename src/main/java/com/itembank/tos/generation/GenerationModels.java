package com.itembank.tos.generation;

import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import com.itembank.tos.taxonomy.TaxonomyModels.Difficulty;
import com.itembank.tos.taxonomy.TaxonomyModels.KnowledgeDimension;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;

import java.util.List;
import java.util.Map;

public class GenerationModels {
    public record GenerationRequest(String topic,
                                    CognitiveLevel cognitiveLevel,
                                    KnowledgeDimension knowledgeDimension,
                                    Difficulty difficulty,
                                    int count,
                                    QuestionType questionType,
                                    String bloomInstructions,
                                    String knowledgeInstructions,
                                    String difficultyInstructions) {}

    public record GeneratedQuestion(String text,
                                    Map<String, String> choices,
                                    String correctAnswer,
                                    CognitiveLevel cognitiveLevel,
                                    KnowledgeDimension knowledgeDimension,
                                    Difficulty difficulty,
                                    String topic) {}

    public record ConstraintCheck(boolean valid, List<String> issues) {}
}
