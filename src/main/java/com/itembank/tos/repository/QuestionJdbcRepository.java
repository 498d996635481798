package com.itembank.tos.repository;

import com.itembank.tos.classification.ClassificationModels.Classification;
import com.itembank.tos.classification.ClassificationModels.RawQuestion;
import com.itembank.tos.domain.DomainModels.InventoryItem;
import com.itembank.tos.domain.DomainModels.ValidationStatus;
import com.itembank.tos.similarity.SimilarityModels.CorpusEntry;
import com.itembank.tos.similarity.SimilarityModels.SimilarityPair;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class QuestionJdbcRepository {
    private static final String ITEM_COLUMNS = "id, question_text, question_type, topic, bloom_level, knowledge_dimension, difficulty, " +
            "classification_confidence, validation_status, needs_review, deleted, approved, created_at";

    private static final RowMapper<InventoryItem> ITEM_MAPPER = (rs, n) -> new InventoryItem(
            rs.getString(1), rs.getString(2), QuestionType.fromKey(rs.getString(3)), rs.getString(4),
            rs.getString(5), rs.getString(6), rs.getString(7),
            (Double) rs.getObject(8),
            ValidationStatus.valueOf(rs.getString(9).toUpperCase(Locale.ROOT)),
            rs.getBoolean(10), rs.getBoolean(11), rs.getBoolean(12),
            Instant.parse(rs.getString(13)));

    // Fixed-width so that string order in created_at matches time order.
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private final JdbcTemplate jdbcTemplate;

    public QuestionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(String id, RawQuestion question, Classification c, Instant createdAt) {
        jdbcTemplate.update(
                "INSERT INTO questions(id, question_text, question_type, topic, bloom_level, knowledge_dimension, difficulty, " +
                        "classification_confidence, quality_score, readability_score, semantic_vector, needs_review, validation_status, " +
                        "deleted, approved, created_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                id, question.text(), question.declaredType().key(), question.topic(),
                c.cognitiveLevel().key(), c.knowledgeDimension().key(), c.difficulty().key(),
                c.confidence(), c.qualityScore(), c.readabilityScore(), toVectorString(c.fingerprint()), c.needsReview(),
                statusKey(ValidationStatus.PENDING), false, false, timestamp(createdAt));
    }

    public List<InventoryItem> loadInventory(boolean includeDeleted) {
        return jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM questions WHERE (? OR deleted = FALSE) ORDER BY created_at, id",
                ITEM_MAPPER, includeDeleted);
    }

    public Optional<InventoryItem> findById(String id) {
        return jdbcTemplate.query("SELECT " + ITEM_COLUMNS + " FROM questions WHERE id = ?", ITEM_MAPPER, id)
                .stream().findFirst();
    }

    public List<CorpusEntry> loadCorpus() {
        return jdbcTemplate.query(
                "SELECT id, question_text FROM questions WHERE deleted = FALSE ORDER BY created_at, id",
                (rs, n) -> new CorpusEntry(rs.getString(1), rs.getString(2)));
    }

    public boolean softDelete(String id) {
        return jdbcTemplate.update("UPDATE questions SET deleted = TRUE WHERE id = ?", id) > 0;
    }

    public void saveSimilarities(List<SimilarityPair> pairs) {
        String now = timestamp(Instant.now());
        pairs.forEach(p -> jdbcTemplate.update(
                "MERGE INTO question_similarities(question1_id, question2_id, similarity_score, algorithm_used, computed_at) " +
                        "KEY(question1_id, question2_id) VALUES (?,?,?,?,?)",
                p.questionId(), p.similarQuestionId(), p.score(), p.algorithm(), now));
    }

    public List<SimilarityPair> loadSimilarities(String questionId) {
        return jdbcTemplate.query(
                "SELECT question1_id, question2_id, similarity_score, algorithm_used FROM question_similarities " +
                        "WHERE question1_id = ? ORDER BY similarity_score DESC",
                (rs, n) -> new SimilarityPair(rs.getString(1), rs.getString(2), rs.getDouble(3), rs.getString(4)),
                questionId);
    }

    public void applyValidation(String id, String cognitiveLevel, String knowledgeDimension, String difficulty,
                                double confidence, String validatorId) {
        jdbcTemplate.update(
                "UPDATE questions SET bloom_level = COALESCE(?, bloom_level), knowledge_dimension = COALESCE(?, knowledge_dimension), " +
                        "difficulty = COALESCE(?, difficulty), classification_confidence = ?, validation_status = ?, validated_by = ?, " +
                        "validation_timestamp = ?, needs_review = FALSE WHERE id = ?",
                cognitiveLevel, knowledgeDimension, difficulty, confidence, statusKey(ValidationStatus.VALIDATED),
                validatorId, timestamp(Instant.now()), id);
    }

    public void applyRejection(String id, String notes, String validatorId) {
        jdbcTemplate.update(
                "UPDATE questions SET validation_status = ?, validated_by = ?, validation_timestamp = ?, needs_review = TRUE, " +
                        "review_notes = ? WHERE id = ?",
                statusKey(ValidationStatus.REJECTED), validatorId, timestamp(Instant.now()), notes, id);
    }

    public void markValidated(String id, String validatorId) {
        jdbcTemplate.update(
                "UPDATE questions SET validation_status = ?, validated_by = ?, validation_timestamp = ?, needs_review = FALSE WHERE id = ?",
                statusKey(ValidationStatus.VALIDATED), validatorId, timestamp(Instant.now()), id);
    }

    public Optional<String> loadReviewNotes(String id) {
        return jdbcTemplate.query("SELECT review_notes FROM questions WHERE id = ?", (rs, n) -> rs.getString(1), id)
                .stream().filter(v -> v != null).findFirst();
    }

    static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    private String statusKey(ValidationStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private String toVectorString(List<Double> vector) {
        return vector.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
