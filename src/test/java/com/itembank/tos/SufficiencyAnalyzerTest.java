package com.itembank.tos;

import com.itembank.tos.domain.DomainModels.InventoryItem;
import com.itembank.tos.sufficiency.InvalidRequirementMatrixException;
import com.itembank.tos.sufficiency.SufficiencyAnalyzer;
import com.itembank.tos.sufficiency.SufficiencyModels.*;
import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SufficiencyAnalyzerTest {
    private final SufficiencyAnalyzer analyzer = new SufficiencyAnalyzer();

    @Test
    void threeOfFiveIsAFailNotAWarning() {
        RequirementMatrix matrix = matrix(topic("Algebra", Map.of(CognitiveLevel.REMEMBERING, 5)));
        List<InventoryItem> inventory = items("algebra basics", "remembering", 3);

        SufficiencyAnalysis analysis = analyzer.analyze(matrix, inventory);

        assertEquals(1, analysis.results().size());
        SufficiencyResult row = analysis.results().get(0);
        assertEquals("algebra", row.topic());
        assertEquals(5, row.required());
        assertEquals(3, row.available());
        assertEquals(2, row.gap());
        assertEquals(SufficiencyStatus.FAIL, row.status());
        assertEquals(60.0, analysis.overallScore());
        assertEquals(SufficiencyStatus.FAIL, analysis.overallStatus());
    }

    @Test
    void sevenOfTenIsAWarning() {
        RequirementMatrix matrix = matrix(topic("Geometry", Map.of(CognitiveLevel.APPLYING, 10)));
        SufficiencyAnalysis analysis = analyzer.analyze(matrix, items("geometry", "applying", 7));

        assertEquals(SufficiencyStatus.WARNING, analysis.results().get(0).status());
        assertEquals(70.0, analysis.overallScore());
        assertEquals(SufficiencyStatus.WARNING, analysis.overallStatus());
    }

    @Test
    void emptyMatrixIsTriviallySatisfied() {
        SufficiencyAnalysis analysis = analyzer.analyze(new RequirementMatrix(List.of()), items("anything", "remembering", 4));

        assertEquals(SufficiencyStatus.PASS, analysis.overallStatus());
        assertEquals(100.0, analysis.overallScore());
        assertTrue(analysis.results().isEmpty());
        assertEquals(List.of("All required questions exist in the bank."), analysis.recommendations());
        assertTrue(analysis.generationTargets().isEmpty());
    }

    @Test
    void missingTopicsFailsLoudly() {
        assertThrows(InvalidRequirementMatrixException.class, () -> analyzer.analyze(new RequirementMatrix(null), List.of()));
        assertThrows(InvalidRequirementMatrixException.class, () -> analyzer.analyze(null, List.of()));
    }

    @Test
    void zeroRequirementCellsAreSkipped() {
        RequirementMatrix matrix = matrix(topic("Biology", Map.of(
                CognitiveLevel.REMEMBERING, 0,
                CognitiveLevel.ANALYZING, 2)));
        SufficiencyAnalysis analysis = analyzer.analyze(matrix, items("biology", "remembering", 5));

        assertEquals(1, analysis.results().size());
        assertEquals(CognitiveLevel.ANALYZING, analysis.results().get(0).cognitiveLevel());
        assertEquals(2, analysis.totalRequired());
        assertEquals(0, analysis.totalAvailable());
    }

    @Test
    void deletedItemsAreNeverCounted() {
        List<InventoryItem> inventory = new ArrayList<>(items("chemistry", "evaluating", 2));
        inventory.add(InventoryItem.of("gone", "chemistry", "evaluating").markDeleted());

        SufficiencyAnalysis analysis = analyzer.analyze(
                matrix(topic("Chemistry", Map.of(CognitiveLevel.EVALUATING, 3))), inventory);

        assertEquals(2, analysis.results().get(0).available());
    }

    @Test
    void noisyLabelsAreNormalizedBeforeMatching() {
        List<InventoryItem> inventory = List.of(
                InventoryItem.of("1", "Requirements_Engineering", "Remembering"),
                InventoryItem.of("2", "requirements-engineering", " REMEMBERING "),
                InventoryItem.of("3", "Requirements Engineering", "understanding"),
                InventoryItem.of("4", null, "remembering"));

        SufficiencyAnalysis analysis = analyzer.analyze(
                matrix(topic("requirements engineering", Map.of(CognitiveLevel.REMEMBERING, 2))), inventory);

        assertEquals(2, analysis.results().get(0).available());
        assertEquals(SufficiencyStatus.PASS, analysis.overallStatus());
    }

    @Test
    void topicMatchingIsSymmetricContainmentAndMayDoubleCount() {
        assertTrue(SufficiencyAnalyzer.topicsMatch("math", "mathematics"));
        assertTrue(SufficiencyAnalyzer.topicsMatch("mathematics", "math"));
        assertFalse(SufficiencyAnalyzer.topicsMatch("", "math"));

        RequirementMatrix matrix = matrix(
                topic("Math", Map.of(CognitiveLevel.APPLYING, 2)),
                topic("Mathematics", Map.of(CognitiveLevel.APPLYING, 2)));
        SufficiencyAnalysis analysis = analyzer.analyze(matrix, items("mathematics", "applying", 2));

        assertEquals(List.of(2, 2), analysis.results().stream().map(SufficiencyResult::available).toList());
        assertEquals(4, analysis.totalAvailable());
    }

    @Test
    void totalsBeyondIntRangeAreRejectedInsteadOfWrapping() {
        RequirementMatrix matrix = matrix(
                topic("Optics", Map.of(CognitiveLevel.REMEMBERING, 2_000_000_000)),
                topic("Acoustics", Map.of(CognitiveLevel.REMEMBERING, 2_000_000_000)));

        assertThrows(InvalidRequirementMatrixException.class, () -> analyzer.analyze(matrix, List.of()));
    }

    @Test
    void largeTotalsWithinIntRangeStayExact() {
        RequirementMatrix matrix = matrix(
                topic("Optics", Map.of(CognitiveLevel.REMEMBERING, 1_000_000_000)),
                topic("Acoustics", Map.of(CognitiveLevel.REMEMBERING, 1_000_000_000)));

        SufficiencyAnalysis analysis = analyzer.analyze(matrix, List.of());

        assertEquals(2_000_000_000, analysis.totalRequired());
        assertEquals(0.0, analysis.overallScore());
        assertEquals(SufficiencyStatus.FAIL, analysis.overallStatus());
    }

    @Test
    void totalsEqualTheSumOfRows() {
        RequirementMatrix matrix = matrix(
                topic("Physics", Map.of(CognitiveLevel.REMEMBERING, 4, CognitiveLevel.CREATING, 1)),
                topic("History", Map.of(CognitiveLevel.UNDERSTANDING, 6)));
        List<InventoryItem> inventory = new ArrayList<>();
        inventory.addAll(items("physics", "remembering", 6));
        inventory.addAll(items("world history", "understanding", 2));

        SufficiencyAnalysis analysis = analyzer.analyze(matrix, inventory);

        assertEquals(analysis.totalRequired(), analysis.results().stream().mapToInt(SufficiencyResult::required).sum());
        assertEquals(analysis.totalAvailable(), analysis.results().stream().mapToInt(SufficiencyResult::available).sum());
        assertEquals(11, analysis.totalRequired());
        assertEquals(8, analysis.totalAvailable());
    }

    @Test
    void recommendationsItemizeWorstFailingAndWarningCells() {
        RequirementMatrix matrix = matrix(
                topic("t1", Map.of(CognitiveLevel.REMEMBERING, 10)),
                topic("t2", Map.of(CognitiveLevel.REMEMBERING, 8)),
                topic("t3", Map.of(CognitiveLevel.REMEMBERING, 6)),
                topic("t4", Map.of(CognitiveLevel.REMEMBERING, 4)),
                topic("t5", Map.of(CognitiveLevel.REMEMBERING, 10)));
        List<InventoryItem> inventory = new ArrayList<>();
        inventory.addAll(items("t5", "remembering", 8));

        SufficiencyAnalysis analysis = analyzer.analyze(matrix, inventory);

        assertEquals(List.of(10, 8, 6, 4, 2), analysis.generationTargets().stream().map(GenerationTarget::count).toList());
        assertEquals("t1", analysis.generationTargets().get(0).topic());

        List<String> lines = analysis.recommendations();
        assertEquals("Request 30 additional questions from the generator to fill 5 under-supplied cells.", lines.get(0));
        assertEquals("• t1 (remembering) requires 10, but only 0 exist.", lines.get(1));
        assertEquals("• t2 (remembering) requires 8, but only 0 exist.", lines.get(2));
        assertEquals("• t3 (remembering) requires 6, but only 0 exist.", lines.get(3));
        assertEquals("• t5 (remembering) requires 10, but only 8 exist.", lines.get(4));
        assertEquals("… and 1 more under-supplied cell.", lines.get(5));
        assertEquals(6, lines.size());
    }

    private static RequirementMatrix matrix(RequirementTopic... topics) {
        return new RequirementMatrix(List.of(topics));
    }

    private static RequirementTopic topic(String name, Map<CognitiveLevel, Integer> counts) {
        return new RequirementTopic(name, counts);
    }

    private static List<InventoryItem> items(String topic, String level, int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> InventoryItem.of(topic + "-" + level + "-" + i, topic, level))
                .toList();
    }
}
