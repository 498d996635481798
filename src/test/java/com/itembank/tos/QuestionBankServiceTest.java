package com.itembank.tos;

import com.itembank.tos.classification.ClassificationModels.RawQuestion;
import com.itembank.tos.domain.DomainModels.StoredQuestion;
import com.itembank.tos.domain.DomainModels.ValidationStatus;
import com.itembank.tos.service.QuestionBankService;
import com.itembank.tos.service.QuestionNotFoundException;
import com.itembank.tos.taxonomy.TaxonomyModels.QuestionType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class QuestionBankServiceTest {
    @Autowired
    private QuestionBankService service;

    @Test
    void classifiesAndStoresQuestionWithLabels() {
        StoredQuestion stored = service.classifyAndStore(
                new RawQuestion("Define the term requirements engineering.", QuestionType.MCQ, "Requirements Engineering"));

        assertNotNull(stored.item().id());
        assertEquals("remembering", stored.item().cognitiveLevel());
        assertEquals("factual", stored.item().knowledgeDimension());
        assertEquals("easy", stored.item().difficulty());
        assertEquals(0.7, stored.item().confidence());
        assertEquals(ValidationStatus.PENDING, stored.item().validationStatus());
        assertFalse(stored.item().needsReview());
        assertFalse(stored.item().deleted());
        assertEquals(stored.classification().needsReview(), stored.item().needsReview());

        assertTrue(service.inventory().stream().anyMatch(i -> i.id().equals(stored.item().id())));
    }

    @Test
    void batchClassificationKeepsInputOrderWithoutStoring() {
        int before = service.inventory().size();
        var classified = service.classifyBatch(List.of(
                new RawQuestion("Design a bridge for a river crossing.", QuestionType.ESSAY, "engineering"),
                new RawQuestion("List three prime numbers.", QuestionType.SHORT_ANSWER, "math")));

        assertEquals(2, classified.size());
        assertEquals("Design a bridge for a river crossing.", classified.get(0).question().text());
        assertEquals("creating", classified.get(0).classification().cognitiveLevel().key());
        assertEquals("remembering", classified.get(1).classification().cognitiveLevel().key());
        assertEquals(before, service.inventory().size());
    }

    @Test
    void softDeletedQuestionsLeaveTheInventory() {
        StoredQuestion stored = service.classifyAndStore(
                new RawQuestion("Explain the greenhouse effect.", QuestionType.SHORT_ANSWER, "climate"));

        service.softDelete(stored.item().id());

        assertTrue(service.inventory().stream().noneMatch(i -> i.id().equals(stored.item().id())));
        assertTrue(service.get(stored.item().id()).deleted());
        assertThrows(QuestionNotFoundException.class, () -> service.softDelete("no-such-question"));
    }

    @Test
    void storesDegenerateInputInsteadOfFailing() {
        StoredQuestion stored = service.classifyAndStore(new RawQuestion("", null, null));

        assertEquals("understanding", stored.item().cognitiveLevel());
        assertEquals(QuestionType.SHORT_ANSWER, stored.item().type());
        assertTrue(stored.item().needsReview());
    }

    @Test
    void rejectsTextAndTopicLongerThanStorageAllows() {
        String essay = "Discuss the causes of the industrial revolution. ".repeat(125);
        assertTrue(essay.length() > 5000);

        assertThrows(IllegalArgumentException.class,
                () -> service.classifyAndStore(new RawQuestion(essay, QuestionType.ESSAY, "history")));
        assertThrows(IllegalArgumentException.class,
                () -> service.classifyAndStore(new RawQuestion("Explain friction.", QuestionType.ESSAY, "t".repeat(201))));

        StoredQuestion atLimit = service.classifyAndStore(
                new RawQuestion("x".repeat(5000), QuestionType.ESSAY, "k".repeat(200)));
        assertEquals(5000, atLimit.item().text().length());
    }
}
