package com.itembank.tos.review;

import com.itembank.tos.config.ItemBankProperties;
import com.itembank.tos.domain.DomainModels.InventoryItem;
import com.itembank.tos.repository.QuestionJdbcRepository;
import com.itembank.tos.repository.ReviewJdbcRepository;
import com.itembank.tos.repository.ReviewJdbcRepository.ValidationRow;
import com.itembank.tos.review.ReviewModels.*;
import com.itembank.tos.service.QuestionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);
    private static final int MAX_BATCH = 100;
    private static final int MAX_NOTES_LENGTH = 1000;
    private static final int MAX_VALIDATOR_LENGTH = 128;

    private final QuestionJdbcRepository questions;
    private final ReviewJdbcRepository reviews;
    private final double defaultAutoApproveThreshold;

    public ReviewService(QuestionJdbcRepository questions, ReviewJdbcRepository reviews, ItemBankProperties properties) {
        this.questions = questions;
        this.reviews = reviews;
        this.defaultAutoApproveThreshold = properties.review().autoApproveThreshold();
    }

    @Transactional
    public ReviewOutcome validate(ValidateRequest request) {
        if (request.confidence() == null) {
            throw new IllegalArgumentException("confidence is required");
        }
        requireUnitInterval(request.confidence(), "confidence");
        requireMaxLength(request.notes(), MAX_NOTES_LENGTH, "notes");
        requireMaxLength(request.validatorId(), MAX_VALIDATOR_LENGTH, "validatorId");
        InventoryItem original = questions.findById(request.questionId())
                .orElseThrow(() -> new QuestionNotFoundException(request.questionId()));

        String level = request.cognitiveLevel() == null ? null : request.cognitiveLevel().key();
        String dimension = request.knowledgeDimension() == null ? null : request.knowledgeDimension().key();
        String difficulty = request.difficulty() == null ? null : request.difficulty().key();

        reviews.saveValidation(new ValidationRow(
                original.id(),
                describe(original.cognitiveLevel(), original.knowledgeDimension(), original.difficulty()),
                describe(Optional.ofNullable(level).orElse(original.cognitiveLevel()),
                        Optional.ofNullable(dimension).orElse(original.knowledgeDimension()),
                        Optional.ofNullable(difficulty).orElse(original.difficulty())),
                request.validatorId(), request.confidence(), request.notes(), "manual"));
        questions.applyValidation(original.id(), level, dimension, difficulty, request.confidence(), request.validatorId());

        log.info("Question {} validated by {}", original.id(), request.validatorId());
        return new ReviewOutcome(original.id(), "Classification validated");
    }

    @Transactional
    public ReviewOutcome reject(RejectRequest request) {
        requireMaxLength(request.notes(), MAX_NOTES_LENGTH, "notes");
        requireMaxLength(request.validatorId(), MAX_VALIDATOR_LENGTH, "validatorId");
        InventoryItem original = questions.findById(request.questionId())
                .orElseThrow(() -> new QuestionNotFoundException(request.questionId()));
        questions.applyRejection(original.id(), request.notes(), request.validatorId());
        reviews.saveValidation(new ValidationRow(
                original.id(),
                describe(original.cognitiveLevel(), original.knowledgeDimension(), original.difficulty()),
                null, request.validatorId(), null, request.notes(), "rejection"));

        log.info("Question {} rejected by {}", original.id(), request.validatorId());
        return new ReviewOutcome(original.id(), "Classification rejected");
    }

    @Transactional
    public BatchValidateResult batchValidate(BatchValidateRequest request) {
        requireMaxLength(request.validatorId(), MAX_VALIDATOR_LENGTH, "validatorId");
        List<String> ids = request.questionIds() == null ? List.of() : request.questionIds();
        if (ids.isEmpty() || ids.size() > MAX_BATCH) {
            throw new IllegalArgumentException("Batch validation takes between 1 and " + MAX_BATCH + " question ids, got " + ids.size());
        }
        double threshold = request.autoApproveThreshold() == null ? defaultAutoApproveThreshold : request.autoApproveThreshold();
        requireUnitInterval(threshold, "autoApproveThreshold");

        int validated = 0;
        int needsReview = 0;
        for (String id : ids) {
            Optional<InventoryItem> item = questions.findById(id);
            if (item.isPresent() && item.get().confidence() != null && item.get().confidence() >= threshold) {
                questions.markValidated(id, request.validatorId());
                validated++;
            } else {
                needsReview++;
            }
        }
        log.info("Batch validation at threshold {}: {} validated, {} need review", threshold, validated, needsReview);
        return new BatchValidateResult(validated, needsReview, 0);
    }

    public List<ValidationRow> history(String questionId) {
        return reviews.loadValidations(questionId);
    }

    private String describe(String level, String dimension, String difficulty) {
        return "bloom_level=" + level + ";knowledge_dimension=" + dimension + ";difficulty=" + difficulty;
    }

    private void requireMaxLength(String value, int max, String name) {
        if (value != null && value.length() > max) {
            throw new IllegalArgumentException(name + " must be at most " + max + " characters, got " + value.length());
        }
    }

    private void requireUnitInterval(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 1, got " + value);
        }
    }
}
