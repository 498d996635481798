package com.itembank.tos.review;

import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import com.itembank.tos.taxonomy.TaxonomyModels.Difficulty;
import com.itembank.tos.taxonomy.TaxonomyModels.KnowledgeDimension;

import java.util.List;

public class ReviewModels {
    public record ValidateRequest(String questionId,
                                  CognitiveLevel cognitiveLevel,
                                  KnowledgeDimension knowledgeDimension,
                                  Difficulty difficulty,
                                  Double confidence,
                                  String notes,
                                  String validatorId) {}

    public record RejectRequest(String questionId, String notes, String validatorId) {}

    public record BatchValidateRequest(List<String> questionIds, Double autoApproveThreshold, String validatorId) {}

    public record BatchValidateResult(int validated, int needsReview, int rejected) {}

    public record ReviewOutcome(String questionId, String message) {}
}
