package com.itembank.tos.api;

import com.itembank.tos.repository.ReviewJdbcRepository.ValidationRow;
import com.itembank.tos.review.ReviewModels;
import com.itembank.tos.review.ReviewService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/review")
public class ReviewController {
    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping("/validate")
    public ResponseEntity<ReviewModels.ReviewOutcome> validate(@RequestBody ReviewModels.ValidateRequest request) {
        return ResponseEntity.ok(reviewService.validate(request));
    }

    @PostMapping("/reject")
    public ResponseEntity<ReviewModels.ReviewOutcome> reject(@RequestBody ReviewModels.RejectRequest request) {
        return ResponseEntity.ok(reviewService.reject(request));
    }

    @PostMapping("/batch-validate")
    public ResponseEntity<ReviewModels.BatchValidateResult> batchValidate(@RequestBody ReviewModels.BatchValidateRequest request) {
        return ResponseEntity.ok(reviewService.batchValidate(request));
    }

    @GetMapping("/{questionId}/history")
    public ResponseEntity<List<ValidationRow>> history(@PathVariable String questionId) {
        return ResponseEntity.ok(reviewService.history(questionId));
    }
}
