package com.itembank.tos.similarity;

import com.itembank.tos.similarity.SimilarityModels.CorpusEntry;
import com.itembank.tos.similarity.SimilarityModels.SimilarityMatch;
import com.itembank.tos.similarity.SimilarityModels.SimilarityReport;
import com.itembank.tos.text.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class SimilarityEngine {
    public static final String ALGORITHM = "cosine";
    public static final int DEFAULT_MAX_RESULTS = 10;

    public double similarity(String textA, String textB) {
        Map<String, Long> a = termFrequencies(textA);
        Map<String, Long> b = termFrequencies(textB);
        if (a.isEmpty() || b.isEmpty()) return 0.0;

        double dot = 0.0;
        for (var e : a.entrySet()) {
            dot += e.getValue() * b.getOrDefault(e.getKey(), 0L);
        }
        double normA = squaredNorm(a);
        double normB = squaredNorm(b);
        return Math.min(1.0, dot / Math.sqrt(normA * normB));
    }

    public List<SimilarityMatch> findSimilar(String query, List<CorpusEntry> corpus, double threshold) {
        return search(query, corpus, threshold, DEFAULT_MAX_RESULTS).matches();
    }

    public SimilarityReport search(String query, List<CorpusEntry> corpus, double threshold, int maxResults) {
        if (corpus == null || corpus.isEmpty()) {
            return new SimilarityReport(List.of(), 0, threshold);
        }
        List<SimilarityMatch> all = corpus.stream()
                .filter(Objects::nonNull)
                .map(entry -> new SimilarityMatch(entry.id(), similarity(query, entry.text())))
                .filter(m -> m.score() >= threshold)
                .sorted(Comparator.comparingDouble(SimilarityMatch::score).reversed())
                .toList();
        List<SimilarityMatch> top = all.stream().limit(Math.max(0, maxResults)).toList();
        return new SimilarityReport(top, all.size(), threshold);
    }

    private Map<String, Long> termFrequencies(String text) {
        return TextNormalizer.searchTokens(text).stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }

    private double squaredNorm(Map<String, Long> tf) {
        return tf.values().stream().mapToDouble(v -> (double) v * v).sum();
    }
}
