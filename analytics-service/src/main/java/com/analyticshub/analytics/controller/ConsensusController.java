package com.analyticshub.analytics.controller;

import com.analyticshub.analytics.dto.ConsensusRequest;
import com.analyticshub.analytics.dto.ConsensusResponse;
import com.analyticshub.analytics.service.ConsensusService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/consensus")
public class ConsensusController {

    private final ConsensusService consensusService;

    public ConsensusController(ConsensusService consensusService) {
        this.consensusService = consensusService;
    }

    @PostMapping
    public Mono<ResponseEntity<ConsensusResponse>> compute(@RequestBody ConsensusRequest request) {
        return consensusService.computeConsensus(request)
            .map(response -> ResponseEntity.ok()
                .headers(AgentHeaders.of(consensusService.identity()))
                .body(response));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok()
            .headers(AgentHeaders.of(consensusService.identity()))
            .body("OK");
    }
}
