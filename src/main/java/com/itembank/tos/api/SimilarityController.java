package com.itembank.tos.api;

import com.itembank.tos.similarity.SimilarityModels.SimilarityPair;
import com.itembank.tos.similarity.SimilarityModels.SimilarityReport;
import com.itembank.tos.similarity.SimilarityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/similarity")
public class SimilarityController {
    private final SimilarityService similarityService;

    public SimilarityController(SimilarityService similarityService) {
        this.similarityService = similarityService;
    }

    @PostMapping("/search")
    public ResponseEntity<SimilarityReport> search(@RequestBody SearchRequest request) {
        return ResponseEntity.ok(similarityService.findSimilar(request.questionText(), request.questionId(), request.threshold()));
    }

    @PostMapping("/compare")
    public ResponseEntity<CompareResponse> compare(@RequestBody CompareRequest request) {
        return ResponseEntity.ok(new CompareResponse(similarityService.compare(request.textA(), request.textB())));
    }

    @GetMapping("/{questionId}/pairs")
    public ResponseEntity<List<SimilarityPair>> pairs(@PathVariable String questionId) {
        return ResponseEntity.ok(similarityService.recordedPairs(questionId));
    }

    public record SearchRequest(String questionText, String questionId, Double threshold) {}

    public record CompareRequest(String textA, String textB) {}

    public record CompareResponse(double similarity) {}
}
