package com.itembank.tos.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.itembank.tos.sufficiency.SufficiencyService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sufficiency")
public class SufficiencyController {
    private final SufficiencyService sufficiencyService;

    public SufficiencyController(SufficiencyService sufficiencyService) {
        this.sufficiencyService = sufficiencyService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<SufficiencyService.SufficiencyReport> analyze(@RequestBody JsonNode tosMatrix) {
        return ResponseEntity.ok(sufficiencyService.analyze(tosMatrix));
    }
}
