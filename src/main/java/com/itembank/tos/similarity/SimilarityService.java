package com.itembank.tos.similarity;

import com.itembank.tos.config.ItemBankProperties;
import com.itembank.tos.repository.QuestionJdbcRepository;
import com.itembank.tos.similarity.SimilarityModels.CorpusEntry;
import com.itembank.tos.similarity.SimilarityModels.SimilarityPair;
import com.itembank.tos.similarity.SimilarityModels.SimilarityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Near-duplicate search against the stored bank. When the query is itself a stored question,
 * every match at or above the threshold is recorded as a similarity pair, not only the returned ones.
 */
@Service
public class SimilarityService {
    private static final Logger log = LoggerFactory.getLogger(SimilarityService.class);

    private final SimilarityEngine engine;
    private final QuestionJdbcRepository repository;
    private final ItemBankProperties.Similarity settings;

    public SimilarityService(SimilarityEngine engine, QuestionJdbcRepository repository, ItemBankProperties properties) {
        this.engine = engine;
        this.repository = repository;
        this.settings = properties.similarity();
    }

    public SimilarityReport findSimilar(String questionText, String questionId, Double threshold) {
        double effective = threshold == null ? settings.defaultThreshold() : threshold;
        if (effective < 0.0 || effective > 1.0) {
            throw new IllegalArgumentException("Threshold must be between 0 and 1, got " + effective);
        }

        List<CorpusEntry> corpus = repository.loadCorpus().stream()
                .filter(e -> questionId == null || !questionId.equals(e.id()))
                .toList();
        SimilarityReport all = engine.search(questionText, corpus, effective, Integer.MAX_VALUE);
        SimilarityReport report = new SimilarityReport(
                all.matches().stream().limit(Math.max(0, settings.maxResults())).toList(), all.total(), effective);

        if (questionId != null && !all.matches().isEmpty()) {
            repository.saveSimilarities(all.matches().stream()
                    .map(m -> new SimilarityPair(questionId, m.id(), m.score(), SimilarityEngine.ALGORITHM))
                    .toList());
        }
        log.info("Similarity search over {} questions: {} at or above {}", corpus.size(), report.total(), effective);
        return report;
    }

    public double compare(String textA, String textB) {
        return engine.similarity(textA, textB);
    }

    public List<SimilarityPair> recordedPairs(String questionId) {
        return repository.loadSimilarities(questionId);
    }
}
