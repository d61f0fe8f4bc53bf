package com.decisionplatform.orchestrator.controller;

import com.decisionplatform.orchestrator.dto.ReplayVerifyRequest;
import com.decisionplatform.orchestrator.replay.DeterminismHarness;
import com.decisionplatform.orchestrator.replay.HarnessReport;
import com.decisionplatform.orchestrator.replay.SyntheticInputGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** On-demand determinism check over a seeded synthetic batch. */
@RestController
@RequestMapping("/api/v1/replay")
public class ReplayController {

    private static final Logger log = LoggerFactory.getLogger(ReplayController.class);

    private final DeterminismHarness harness;

    public ReplayController(DeterminismHarness harness) {
        this.harness = harness;
    }

    @PostMapping("/verify")
    public Mono<ResponseEntity<HarnessReport>> verify(@RequestBody ReplayVerifyRequest request) {
        if (request.getRuns() < 2 || request.getBatchSize() < 1) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        log.info("[ReplayController] Verify requested. seed={} batchSize={} runs={}",
            request.getSeed(), request.getBatchSize(), request.getRuns());
        return Mono.fromCallable(() -> harness.replay(
                new SyntheticInputGenerator(request.getSeed()).generate(request.getBatchSize()),
                request.getRuns()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }
}
