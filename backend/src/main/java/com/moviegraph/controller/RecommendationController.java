package com.moviegraph.controller;

import com.moviegraph.model.recommendation.ScoredCandidate;
import com.moviegraph.service.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

// ========== Recommendation Controller ==========
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
@Tag(name = "Recommendations", description = "Graph-based movie recommendations")
public class RecommendationController {

    private final RecommendationService recommendationService;

    @GetMapping("/{title}")
    @Operation(summary = "Recommend movies similar to the given movie by shared genres, shared cast, or both")
    public ResponseEntity<List<ScoredCandidate>> recommend(
            @PathVariable String title,
            @RequestParam(defaultValue = "combined") String strategy,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long timeoutMs) {
        return ResponseEntity.ok(recommendationService.recommend(title, strategy, limit, toDuration(timeoutMs)));
    }

    private static Duration toDuration(Long timeoutMs) {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
