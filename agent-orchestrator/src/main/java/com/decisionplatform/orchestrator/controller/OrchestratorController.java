package com.decisionplatform.orchestrator.controller;

import com.decisionplatform.orchestrator.dto.SignalRequest;
import com.decisionplatform.orchestrator.pipeline.PipelineOutcome;
import com.decisionplatform.orchestrator.service.OrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/orchestrate")
public class OrchestratorController {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorController.class);

    private final OrchestratorService orchestratorService;

    public OrchestratorController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/signal")
    public Mono<ResponseEntity<PipelineOutcome>> signal(@RequestBody SignalRequest request) {
        if (!request.isValid()) {
            log.warn("[OrchestratorController] Rejected invalid signal. symbol={} direction={}",
                request.getSymbol(), request.getDirection());
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return Mono.fromCallable(request::toSignal)
            .flatMap(orchestratorService::process)
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("[OrchestratorController] Rejected signal. error={}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<List<PipelineOutcome>>> batch(@RequestBody List<SignalRequest> requests) {
        if (requests.stream().anyMatch(r -> !r.isValid())) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return Mono.fromCallable(() -> requests.stream().map(SignalRequest::toSignal).toList())
            .flatMap(orchestratorService::processBatch)
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
