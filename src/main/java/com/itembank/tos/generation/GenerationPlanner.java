package com.itembank.tos.generation;

import com.itembank.tos.generation.GenerationModels.ConstraintCheck;
import com.itembank.tos.generation.GenerationModels.GeneratedQuestion;
import com.itembank.tos.generation.GenerationModels.GenerationRequest;
import com.itembank.tos.sufficiency.SufficiencyModels.GenerationTarget;
import com.itembank.tos.sufficiency.SufficiencyModels.SufficiencyAnalysis;
import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import com.itembank.tos.taxonomy.TaxonomyModels.Difficulty;
import com.itembank.tos.taxonomy.TaxonomyModels.KnowledgeDimension;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class GenerationPlanner {
    private static final int MIN_TEXT_LENGTH = 10;

    private static final Map<CognitiveLevel, String> BLOOM_INSTRUCTIONS = new EnumMap<>(Map.of(
            CognitiveLevel.REMEMBERING, "Focus on recall and recognition. Use verbs: define, list, identify, name, state, recall.",
            CognitiveLevel.UNDERSTANDING, "Focus on comprehension. Use verbs: explain, summarize, describe, interpret, classify.",
            CognitiveLevel.APPLYING, "Focus on using knowledge. Use verbs: apply, solve, implement, demonstrate, use.",
            CognitiveLevel.ANALYZING, "Focus on breaking down information. Use verbs: analyze, compare, examine, differentiate.",
            CognitiveLevel.EVALUATING, "Focus on making judgments. Use verbs: evaluate, justify, critique, assess, argue.",
            CognitiveLevel.CREATING, "Focus on producing new work. Use verbs: design, create, compose, formulate, construct."
    ));

    private static final Map<KnowledgeDimension, String> KNOWLEDGE_INSTRUCTIONS = new EnumMap<>(Map.of(
            KnowledgeDimension.FACTUAL, "Target factual knowledge: terminology, specific details, basic elements. "
                    + "Questions should test recall of facts, definitions, or specific information.",
            KnowledgeDimension.CONCEPTUAL, "Target conceptual knowledge: theories, principles, models, classifications. "
                    + "Questions should test understanding of relationships and interrelations.",
            KnowledgeDimension.PROCEDURAL, "Target procedural knowledge: methods, techniques, algorithms, processes. "
                    + "Questions should test ability to apply procedures or solve problems step-by-step.",
            KnowledgeDimension.METACOGNITIVE, "Target metacognitive knowledge: self-awareness, strategic thinking. "
                    + "Questions should require reflection on thinking processes, strategy evaluation, or learning approach assessment."
    ));

    private static final Map<Difficulty, String> DIFFICULTY_INSTRUCTIONS = new EnumMap<>(Map.of(
            Difficulty.EASY, "Simple, straightforward questions with clear answers. Basic application of knowledge.",
            Difficulty.AVERAGE, "Moderate complexity requiring thought and understanding. May involve some analysis.",
            Difficulty.DIFFICULT, "Complex questions requiring deep analysis, synthesis, or evaluation. May have nuanced answers."
    ));

    public List<GenerationRequest> plan(SufficiencyAnalysis analysis) {
        return plan(analysis, QuestionType.MCQ);
    }

    public List<GenerationRequest> plan(SufficiencyAnalysis analysis, QuestionType questionType) {
        if (analysis == null) return List.of();
        return analysis.generationTargets().stream()
                .map(target -> request(target, questionType))
                .toList();
    }

    public GenerationRequest request(GenerationTarget target, QuestionType questionType) {
        CognitiveLevel level = target.cognitiveLevel();
        KnowledgeDimension dimension = defaultDimension(level);
        Difficulty difficulty = defaultDifficulty(level);
        return new GenerationRequest(target.topic(), level, dimension, difficulty, target.count(),
                questionType == null ? QuestionType.MCQ : questionType,
                BLOOM_INSTRUCTIONS.get(level), KNOWLEDGE_INSTRUCTIONS.get(dimension), DIFFICULTY_INSTRUCTIONS.get(difficulty));
    }

    public ConstraintCheck validateGenerated(GeneratedQuestion question) {
        List<String> issues = new ArrayList<>();
        if (question.text() == null || question.text().length() < MIN_TEXT_LENGTH) {
            issues.add("Question text too short");
        }
        if (question.cognitiveLevel() == null) {
            issues.add("Missing Bloom level");
        }
        if (question.knowledgeDimension() == null) {
            issues.add("Missing knowledge dimension");
        }
        if (question.choices() != null) {
            if (question.choices().size() < 2) {
                issues.add("MCQ requires at least 2 choices");
            }
            if (question.correctAnswer() == null || !question.choices().containsKey(question.correctAnswer())) {
                issues.add("Invalid or missing correct answer");
            }
        }
        return new ConstraintCheck(issues.isEmpty(), List.copyOf(issues));
    }

    static KnowledgeDimension defaultDimension(CognitiveLevel level) {
        return switch (level) {
            case REMEMBERING -> KnowledgeDimension.FACTUAL;
            case UNDERSTANDING, ANALYZING -> KnowledgeDimension.CONCEPTUAL;
            case APPLYING, CREATING -> KnowledgeDimension.PROCEDURAL;
            case EVALUATING -> KnowledgeDimension.METACOGNITIVE;
        };
    }

    static Difficulty defaultDifficulty(CognitiveLevel level) {
        return switch (level) {
            case REMEMBERING, UNDERSTANDING -> Difficulty.EASY;
            case APPLYING, ANALYZING -> Difficulty.AVERAGE;
            case EVALUATING, CREATING -> Difficulty.DIFFICULT;
        };
    }
}
