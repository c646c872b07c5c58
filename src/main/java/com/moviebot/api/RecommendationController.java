package com.moviebot.api;

import com.moviebot.recommendation.RecommendationModels;
import com.moviebot.recommendation.RecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {
    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping
    public ResponseEntity<RecommendationModels.RecommendationResult> next(@RequestParam String userId,
                                                                          @RequestParam(required = false) Integer k) {
        int size = k == null ? recommendationService.defaultResultSize() : k;
        return ResponseEntity.ok(recommendationService.recommend(userId, size));
    }
}
