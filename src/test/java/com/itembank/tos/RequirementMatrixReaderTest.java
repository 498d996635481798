package com.itembank.tos;

import com.itembank.tos.sufficiency.InvalidRequirementMatrixException;
import com.itembank.tos.sufficiency.RequirementMatrixReader;
import com.itembank.tos.sufficiency.SufficiencyModels.RequirementCell;
import com.itembank.tos.sufficiency.SufficiencyModels.RequirementMatrix;
import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequirementMatrixReaderTest {
    private final RequirementMatrixReader reader = new RequirementMatrixReader();

    @Test
    void readsTopicRowsWithPerLevelItemCounts() {
        RequirementMatrix matrix = reader.read("""
                {
                  "topics": [
                    { "topic_name": "Algebra", "remembering_items": 5, "applying_items": 2, "hours": 3 },
                    { "topic": "Geometry", "Evaluating_items": "4" }
                  ]
                }
                """);

        assertEquals(2, matrix.topics().size());
        List<RequirementCell> nonZero = matrix.cells().stream().filter(c -> c.requiredCount() > 0).toList();
        assertEquals(List.of(
                new RequirementCell("Algebra", CognitiveLevel.REMEMBERING, 5),
                new RequirementCell("Algebra", CognitiveLevel.APPLYING, 2),
                new RequirementCell("Geometry", CognitiveLevel.EVALUATING, 4)), nonZero);
    }

    @Test
    void readsNestedMatrixLayout() {
        RequirementMatrix matrix = reader.read("""
                { "matrix": { "Cell Biology": { "remembering": { "count": 3 }, "creating": 1, "notes": "x" } } }
                """);

        assertEquals("Cell Biology", matrix.topics().get(0).topicName());
        assertEquals(3, matrix.topics().get(0).requiredPerLevel().get(CognitiveLevel.REMEMBERING));
        assertEquals(1, matrix.topics().get(0).requiredPerLevel().get(CognitiveLevel.CREATING));
    }

    @Test
    void rejectsCountsThatOverflowWhenMerged() {
        assertThrows(InvalidRequirementMatrixException.class, () -> reader.read(
                "{\"topics\": [{\"topic_name\": \"Optics\", \"remembering_items\": 2000000000, \"Remembering_items\": 2000000000}]}"));
        assertThrows(InvalidRequirementMatrixException.class, () -> reader.read(
                "{\"matrix\": {\"Optics\": {\"remembering\": 2000000000, \"Remembering\": {\"count\": 2000000000}}}}"));
    }

    @Test
    void emptyTopicsArrayIsValid() {
        assertTrue(reader.read("{\"topics\": []}").topics().isEmpty());
    }

    @Test
    void rejectsStructurallyInvalidMatrices() {
        assertThrows(InvalidRequirementMatrixException.class, () -> reader.read("{}"));
        assertThrows(InvalidRequirementMatrixException.class, () -> reader.read("{\"topics\": {}}"));
        assertThrows(InvalidRequirementMatrixException.class, () -> reader.read("[1, 2]"));
        assertThrows(InvalidRequirementMatrixException.class, () -> reader.read("not json"));
        assertThrows(InvalidRequirementMatrixException.class, () -> reader.read(""));
        assertThrows(InvalidRequirementMatrixException.class,
                () -> reader.read("{\"topics\": [{\"remembering_items\": 2}]}"));
        assertThrows(InvalidRequirementMatrixException.class,
                () -> reader.read("{\"topics\": [{\"topic_name\": \"A\", \"remembering_items\": -1}]}"));
        assertThrows(InvalidRequirementMatrixException.class,
                () -> reader.read("{\"topics\": [{\"topic_name\": \"A\", \"remembering_items\": 1.5}]}"));
    }
}
