package com.itembank.tos.api;

import com.itembank.tos.classification.ClassificationModels.ClassifiedQuestion;
import com.itembank.tos.classification.ClassificationModels.RawQuestion;
import com.itembank.tos.domain.DomainModels.InventoryItem;
import com.itembank.tos.domain.DomainModels.StoredQuestion;
import com.itembank.tos.service.QuestionBankService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/questions")
public class QuestionController {
    private final QuestionBankService questionBankService;

    public QuestionController(QuestionBankService questionBankService) {
        this.questionBankService = questionBankService;
    }

    @PostMapping("/classify")
    public ResponseEntity<List<ClassifiedQuestion>> classify(@RequestBody List<RawQuestion> questions) {
        return ResponseEntity.ok(questionBankService.classifyBatch(questions));
    }

    @PostMapping
    public ResponseEntity<List<StoredQuestion>> store(@RequestBody List<RawQuestion> questions) {
        return ResponseEntity.ok(questionBankService.classifyAndStoreAll(questions));
    }

    @GetMapping
    public ResponseEntity<List<InventoryItem>> inventory() {
        return ResponseEntity.ok(questionBankService.inventory());
    }

    @GetMapping("/{id}")
    public ResponseEntity<InventoryItem> get(@PathVariable String id) {
        return ResponseEntity.ok(questionBankService.get(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        questionBankService.softDelete(id);
        return ResponseEntity.noContent().build();
    }
}
