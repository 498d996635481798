package com.itembank.tos.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class ReviewJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ReviewJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveValidation(ValidationRow row) {
        jdbcTemplate.update(
                "INSERT INTO classification_validations(question_id, original_classification, validated_classification, validator_id, " +
                        "validation_confidence, notes, validation_type, created_at) VALUES (?,?,?,?,?,?,?,?)",
                row.questionId(), row.originalClassification(), row.validatedClassification(), row.validatorId(),
                row.confidence(), row.notes(), row.validationType(), QuestionJdbcRepository.timestamp(Instant.now()));
    }

    public List<ValidationRow> loadValidations(String questionId) {
        return jdbcTemplate.query(
                "SELECT question_id, original_classification, validated_classification, validator_id, validation_confidence, notes, validation_type " +
                        "FROM classification_validations WHERE question_id = ? ORDER BY id",
                (rs, n) -> new ValidationRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        (Double) rs.getObject(5), rs.getString(6), rs.getString(7)),
                questionId);
    }

    public record ValidationRow(String questionId,
                                String originalClassification,
                                String validatedClassification,
                                String validatorId,
                                Double confidence,
                                String notes,
                                String validationType) {}
}
