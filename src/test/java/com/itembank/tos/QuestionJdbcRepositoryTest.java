package com.itembank.tos;

import com.itembank.tos.classification.ClassificationModels.RawQuestion;
import com.itembank.tos.classification.QuestionClassifier;
import com.itembank.tos.domain.DomainModels.InventoryItem;
import com.itembank.tos.repository.QuestionJdbcRepository;
import com.itembank.tos.similarity.SimilarityModels.CorpusEntry;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class QuestionJdbcRepositoryTest {
    @Autowired
    private QuestionJdbcRepository repository;
    @Autowired
    private QuestionClassifier classifier;

    @Test
    void ordersByCreationTimeRegardlessOfFractionalSeconds() {
        String wholeSecond = UUID.randomUUID().toString();
        String withMillis = UUID.randomUUID().toString();
        Instant base = Instant.parse("2020-03-01T10:15:05Z");

        insert(withMillis, base.plusMillis(123));
        insert(wholeSecond, base);

        Set<String> ids = Set.of(wholeSecond, withMillis);
        List<String> inventoryOrder = repository.loadInventory(false).stream()
                .map(InventoryItem::id).filter(ids::contains).toList();
        List<String> corpusOrder = repository.loadCorpus().stream()
                .map(CorpusEntry::id).filter(ids::contains).toList();

        assertEquals(List.of(wholeSecond, withMillis), inventoryOrder);
        assertEquals(List.of(wholeSecond, withMillis), corpusOrder);
        assertEquals(base, repository.findById(wholeSecond).orElseThrow().createdAt());
        assertEquals(base.plusMillis(123), repository.findById(withMillis).orElseThrow().createdAt());
    }

    private void insert(String id, Instant createdAt) {
        RawQuestion question = new RawQuestion("State Ohm's law.", QuestionType.SHORT_ANSWER, "circuits");
        repository.insert(id, question, classifier.classify(question).classification(), createdAt);
    }
}
