package com.analyticshub.analytics.controller;

import com.analyticshub.analytics.dto.StrategicRecommendationRequest;
import com.analyticshub.analytics.dto.StrategicRecommendationResponse;
import com.analyticshub.analytics.service.StrategicRecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/strategic-recommendations")
public class StrategicRecommendationController {

    private final StrategicRecommendationService strategicRecommendationService;

    public StrategicRecommendationController(StrategicRecommendationService strategicRecommendationService) {
        this.strategicRecommendationService = strategicRecommendationService;
    }

    @PostMapping("/analyze")
    public Mono<ResponseEntity<StrategicRecommendationResponse>> analyze(
            @RequestBody StrategicRecommendationRequest request) {
        return strategicRecommendationService.analyze(request)
            .map(response -> ResponseEntity.ok()
                .headers(AgentHeaders.of(strategicRecommendationService.identity()))
                .body(response));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok()
            .headers(AgentHeaders.of(strategicRecommendationService.identity()))
            .body("OK");
    }
}
