package com.itembank.tos.sufficiency;

import com.itembank.tos.config.ItemBankProperties;
import com.itembank.tos.domain.DomainModels.InventoryItem;
import com.itembank.tos.sufficiency.SufficiencyModels.*;
import com.itembank.tos.text.TextNormalizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class SufficiencyAnalyzer {
    private static final int DEFAULT_FAILING_CELLS = 3;
    private static final int DEFAULT_WARNING_CELLS = 2;

    private final int failingCells;
    private final int warningCells;

    public SufficiencyAnalyzer() {
        this(DEFAULT_FAILING_CELLS, DEFAULT_WARNING_CELLS);
    }

    @Autowired
    public SufficiencyAnalyzer(ItemBankProperties properties) {
        this(properties.recommendations().failingCells(), properties.recommendations().warningCells());
    }

    public SufficiencyAnalyzer(int failingCells, int warningCells) {
        this.failingCells = Math.max(0, failingCells);
        this.warningCells = Math.max(0, warningCells);
    }

    public SufficiencyAnalysis analyze(RequirementMatrix matrix, List<InventoryItem> inventory) {
        if (matrix == null || matrix.topics() == null) {
            throw new InvalidRequirementMatrixException("Requirement matrix must contain a topics array");
        }

        List<NormalizedItem> items = (inventory == null ? List.<InventoryItem>of() : inventory).stream()
                .filter(Objects::nonNull)
                .filter(item -> !item.deleted())
                .map(item -> new NormalizedItem(
                        TextNormalizer.normalizeLabel(item.topic()),
                        TextNormalizer.normalizeLabel(item.cognitiveLevel())))
                .toList();

        List<SufficiencyResult> results = new ArrayList<>();
        long totalRequired = 0;
        long totalAvailable = 0;

        for (RequirementCell cell : matrix.cells()) {
            int required = cell.requiredCount();
            if (required <= 0) continue;

            String topic = TextNormalizer.normalizeLabel(cell.topicName());
            String level = cell.cognitiveLevel().key();
            int available = (int) items.stream()
                    .filter(item -> item.level().equals(level))
                    .filter(item -> topicsMatch(item.topic(), topic))
                    .count();

            totalRequired += required;
            totalAvailable += available;
            if (totalRequired > Integer.MAX_VALUE || totalAvailable > Integer.MAX_VALUE) {
                throw new InvalidRequirementMatrixException("Requirement matrix totals exceed " + Integer.MAX_VALUE);
            }
            results.add(new SufficiencyResult(topic, cell.cognitiveLevel(), required, available,
                    Math.max(0, required - available), SufficiencyStatus.of(available, required)));
        }

        double overallScore = totalRequired > 0 ? 100.0 * totalAvailable / totalRequired : 100.0;
        SufficiencyStatus overallStatus = SufficiencyStatus.of(totalAvailable, totalRequired);

        List<SufficiencyResult> gaps = results.stream()
                .filter(r -> r.gap() > 0)
                .sorted(Comparator.comparingInt(SufficiencyResult::gap).reversed())
                .toList();
        List<GenerationTarget> targets = gaps.stream()
                .map(r -> new GenerationTarget(r.topic(), r.cognitiveLevel(), r.gap()))
                .toList();

        return new SufficiencyAnalysis(overallStatus, overallScore, (int) totalRequired, (int) totalAvailable,
                List.copyOf(results), recommendations(gaps), targets);
    }

    public static boolean topicsMatch(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return false;
        return a.contains(b) || b.contains(a);
    }

    private List<String> recommendations(List<SufficiencyResult> gaps) {
        if (gaps.isEmpty()) {
            return List.of("All required questions exist in the bank.");
        }

        int missing = gaps.stream().mapToInt(SufficiencyResult::gap).sum();
        List<String> lines = new ArrayList<>();
        lines.add("Request " + missing + " additional question" + (missing == 1 ? "" : "s")
                + " from the generator to fill " + gaps.size() + " under-supplied cell" + (gaps.size() == 1 ? "" : "s") + ".");

        List<SufficiencyResult> itemized = new ArrayList<>();
        gaps.stream().filter(r -> r.status() == SufficiencyStatus.FAIL).limit(failingCells).forEach(itemized::add);
        gaps.stream().filter(r -> r.status() == SufficiencyStatus.WARNING).limit(warningCells).forEach(itemized::add);
        itemized.forEach(r -> lines.add("• " + r.topic() + " (" + r.cognitiveLevel().key() + ") requires "
                + r.required() + ", but only " + r.available() + " exist."));

        int remaining = gaps.size() - itemized.size();
        if (remaining > 0) {
            lines.add("… and " + remaining + " more under-supplied cell" + (remaining == 1 ? "" : "s") + ".");
        }
        return lines;
    }

    private record NormalizedItem(String topic, String level) {}
}
