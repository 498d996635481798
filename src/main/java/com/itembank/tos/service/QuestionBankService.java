package com.itembank.tos.service;

import com.itembank.tos.classification.ClassificationModels.ClassifiedQuestion;
import com.itembank.tos.classification.ClassificationModels.RawQuestion;
import com.itembank.tos.classification.QuestionClassifier;
import com.itembank.tos.domain.DomainModels.InventoryItem;
import com.itembank.tos.domain.DomainModels.StoredQuestion;
import com.itembank.tos.repository.QuestionJdbcRepository;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
public class QuestionBankService {
    private static final Logger log = LoggerFactory.getLogger(QuestionBankService.class);
    private static final int MAX_TEXT_LENGTH = 5000;
    private static final int MAX_TOPIC_LENGTH = 200;

    private final QuestionClassifier classifier;
    private final QuestionJdbcRepository repository;

    public QuestionBankService(QuestionClassifier classifier, QuestionJdbcRepository repository) {
        this.classifier = classifier;
        this.repository = repository;
    }

    public List<ClassifiedQuestion> classifyBatch(List<RawQuestion> questions) {
        if (questions == null || questions.isEmpty()) return List.of();
        List<ClassifiedQuestion> classified = classifier.classifyAll(questions.stream().filter(Objects::nonNull).toList());
        log.info("Classified {} questions, {} flagged for review", classified.size(),
                classified.stream().filter(c -> c.classification().needsReview()).count());
        return classified;
    }

    public StoredQuestion classifyAndStore(RawQuestion question) {
        requireMaxLength(question.text(), MAX_TEXT_LENGTH, "Question text");
        requireMaxLength(question.topic(), MAX_TOPIC_LENGTH, "Topic");
        RawQuestion normalized = new RawQuestion(
                question.text() == null ? "" : question.text(),
                question.declaredType() == null ? QuestionType.SHORT_ANSWER : question.declaredType(),
                question.topic());
        ClassifiedQuestion classified = classifier.classify(normalized);
        String id = UUID.randomUUID().toString();
        repository.insert(id, normalized, classified.classification(), Instant.now());
        log.debug("Stored question {} as {} / {} (confidence {})", id,
                classified.classification().cognitiveLevel().key(),
                classified.classification().knowledgeDimension().key(),
                classified.classification().confidence());

        InventoryItem item = repository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Question " + id + " vanished after insert"));
        return new StoredQuestion(item, classified.classification());
    }

    private static void requireMaxLength(String value, int max, String name) {
        if (value != null && value.length() > max) {
            throw new IllegalArgumentException(name + " must be at most " + max + " characters, got " + value.length());
        }
    }

    public List<StoredQuestion> classifyAndStoreAll(List<RawQuestion> questions) {
        if (questions == null || questions.isEmpty()) return List.of();
        List<StoredQuestion> stored = questions.stream()
                .filter(Objects::nonNull)
                .map(this::classifyAndStore)
                .toList();
        log.info("Stored {} classified questions", stored.size());
        return stored;
    }

    public List<InventoryItem> inventory() {
        return repository.loadInventory(false);
    }

    public InventoryItem get(String id) {
        return repository.findById(id).orElseThrow(() -> new QuestionNotFoundException(id));
    }

    public void softDelete(String id) {
        if (!repository.softDelete(id)) {
            throw new QuestionNotFoundException(id);
        }
        log.info("Soft-deleted question {}", id);
    }
}
