package com.marketloop.api.controller;

import com.marketloop.api.dto.request.DenyRequest;
import com.marketloop.domain.model.Recommendation;
import com.marketloop.recommendation.RecommendationService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Human review of recommender proposals. Approve and deny are the only transitions;
 * anything but a pending recommendation answers 409.
 */
@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {

    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping
    public ResponseEntity<List<Recommendation>> list(@RequestParam(defaultValue = "pending") String status) {
        return ResponseEntity.ok(recommendationService.list(status));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Recommendation> approve(@PathVariable String id) {
        return ResponseEntity.ok(recommendationService.approve(id));
    }

    @PostMapping("/{id}/deny")
    public ResponseEntity<Recommendation> deny(@PathVariable String id, @Valid @RequestBody DenyRequest request) {
        return ResponseEntity.ok(recommendationService.deny(id, request.getReason()));
    }
}
