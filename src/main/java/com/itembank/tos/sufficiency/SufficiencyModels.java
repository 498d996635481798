package com.itembank.tos.sufficiency;

import com.fasterxml.jackson.annotation.JsonValue;
import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class SufficiencyModels {
    public record RequirementCell(String topicName, CognitiveLevel cognitiveLevel, int requiredCount) {}

    public record RequirementTopic(String topicName, Map<CognitiveLevel, Integer> requiredPerLevel) {}

    public record RequirementMatrix(List<RequirementTopic> topics) {

        public List<RequirementCell> cells() {
            List<RequirementCell> cells = new ArrayList<>();
            for (RequirementTopic topic : topics) {
                for (CognitiveLevel level : CognitiveLevel.values()) {
                    Integer required = topic.requiredPerLevel() == null ? null : topic.requiredPerLevel().get(level);
                    cells.add(new RequirementCell(topic.topicName(), level, required == null ? 0 : required));
                }
            }
            return cells;
        }
    }

    public enum SufficiencyStatus {
        PASS, WARNING, FAIL;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Pass when nothing is missing, warning when at least 70% is available, fail otherwise.
         * Compared in integers so 7 of 10 is a warning and 3 of 5 is a fail.
         */
        public static SufficiencyStatus of(long available, long required) {
            if (available >= required) return PASS;
            if (available * 10 >= required * 7) return WARNING;
            return FAIL;
        }
    }

    public record SufficiencyResult(String topic,
                                    CognitiveLevel cognitiveLevel,
                                    int required,
                                    int available,
                                    int gap,
                                    SufficiencyStatus status) {}

    public record GenerationTarget(String topic, CognitiveLevel cognitiveLevel, int count) {}

    public record SufficiencyAnalysis(SufficiencyStatus overallStatus,
                                      double overallScore,
                                      int totalRequired,
                                      int totalAvailable,
                                      List<SufficiencyResult> results,
                                      List<String> recommendations,
                                      List<GenerationTarget> generationTargets) {}
}
