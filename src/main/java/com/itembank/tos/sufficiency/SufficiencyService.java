package com.itembank.tos.sufficiency;

import com.fasterxml.jackson.databind.JsonNode;
import com.itembank.tos.domain.DomainModels.InventoryItem;
import com.itembank.tos.generation.GenerationModels.GenerationRequest;
import com.itembank.tos.generation.GenerationPlanner;
import com.itembank.tos.repository.QuestionJdbcRepository;
import com.itembank.tos.sufficiency.SufficiencyModels.RequirementMatrix;
import com.itembank.tos.sufficiency.SufficiencyModels.SufficiencyAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SufficiencyService {
    private static final Logger log = LoggerFactory.getLogger(SufficiencyService.class);

    private final RequirementMatrixReader reader;
    private final SufficiencyAnalyzer analyzer;
    private final GenerationPlanner planner;
    private final QuestionJdbcRepository repository;

    public SufficiencyService(RequirementMatrixReader reader,
                              SufficiencyAnalyzer analyzer,
                              GenerationPlanner planner,
                              QuestionJdbcRepository repository) {
        this.reader = reader;
        this.analyzer = analyzer;
        this.planner = planner;
        this.repository = repository;
    }

    public SufficiencyReport analyze(JsonNode tosMatrix) {
        return analyze(reader.read(tosMatrix));
    }

    public SufficiencyReport analyze(RequirementMatrix matrix) {
        List<InventoryItem> inventory = repository.loadInventory(false);
        SufficiencyAnalysis analysis = analyzer.analyze(matrix, inventory);
        log.info("TOS sufficiency: {} ({}% of {} required, {} cells analyzed, {} with gaps)",
                analysis.overallStatus().key(),
                String.format(java.util.Locale.US, "%.1f", analysis.overallScore()),
                analysis.totalRequired(),
                analysis.results().size(),
                analysis.generationTargets().size());
        return new SufficiencyReport(analysis, planner.plan(analysis));
    }

    public record SufficiencyReport(SufficiencyAnalysis analysis, List<GenerationRequest> generationRequests) {}
}
