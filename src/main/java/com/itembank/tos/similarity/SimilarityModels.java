package com.itembank.tos.similarity;

import java.util.List;

public class SimilarityModels {
    public record CorpusEntry(String id, String text) {}

    public record SimilarityMatch(String id, double score) {}

    public record SimilarityReport(List<SimilarityMatch> matches, int total, double threshold) {}

    public record SimilarityPair(String questionId, String similarQuestionId, double score, String algorithm) {}
}
