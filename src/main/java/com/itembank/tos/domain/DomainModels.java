package com.itembank.tos.domain;

import com.itembank.tos.classification.ClassificationModels.Classification;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;

import java.time.Instant;

public class DomainModels {
    /**
     * A stored question. Label fields are kept as the raw strings found in storage because
     * older rows and human edits do not always use canonical spelling.
     */
    public record InventoryItem(String id,
                                String text,
                                QuestionType type,
                                String topic,
                                String cognitiveLevel,
                                String knowledgeDimension,
                                String difficulty,
                                Double confidence,
                                ValidationStatus validationStatus,
                                boolean needsReview,
                                boolean deleted,
                                boolean approved,
                                Instant createdAt) {

        public static InventoryItem of(String id, String topic, String cognitiveLevel) {
            return new InventoryItem(id, null, null, topic, cognitiveLevel, null, null, null,
                    ValidationStatus.PENDING, false, false, false, null);
        }

        public InventoryItem markDeleted() {
            return new InventoryItem(id, text, type, topic, cognitiveLevel, knowledgeDimension, difficulty, confidence,
                    validationStatus, needsReview, true, approved, createdAt);
        }
    }

    public record StoredQuestion(InventoryItem item, Classification classification) {}

    public enum ValidationStatus { PENDING, VALIDATED, REJECTED }
}
