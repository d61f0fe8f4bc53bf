package com.decisionplatform.orchestrator.controller;

import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.orchestrator.pipeline.PipelineOutcome;
import com.decisionplatform.orchestrator.replay.DeterminismHarness;
import com.decisionplatform.orchestrator.service.OrchestratorService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OrchestratorControllerTest {

    private final OrchestratorService service = mock(OrchestratorService.class);
    private final DeterminismHarness harness = mock(DeterminismHarness.class);
    private final WebTestClient client = WebTestClient
        .bindToController(new OrchestratorController(service), new ReplayController(harness))
        .build();

    @Test
    @DisplayName("valid signal → 200 with the outcome; missing id is stamped at intake")
    void validSignal_processed() {
        when(service.process(any())).thenReturn(Mono.just(PipelineOutcome.noPrice("stamped")));

        client.post().uri("/api/v1/orchestrate/signal")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"symbol\":\"spy\",\"direction\":\"LONG\",\"timeframe\":\"5m\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.terminalStage").isEqualTo("NO_PRICE");

        ArgumentCaptor<Signal> captor = ArgumentCaptor.forClass(Signal.class);
        verify(service).process(captor.capture());
        assertEquals("SPY", captor.getValue().symbol());
        assertEquals(Direction.LONG, captor.getValue().direction());
        assertNotNull(captor.getValue().signalId());
        assertNotNull(captor.getValue().timestamp());
    }

    @Test
    @DisplayName("missing symbol → 400, nothing processed")
    void missingSymbol_badRequest() {
        client.post().uri("/api/v1/orchestrate/signal")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"direction\":\"LONG\"}")
            .exchange()
            .expectStatus().isBadRequest();
        verify(service, never()).process(any());
    }

    @Test
    @DisplayName("unknown direction → 400")
    void unknownDirection_badRequest() {
        client.post().uri("/api/v1/orchestrate/signal")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"symbol\":\"SPY\",\"direction\":\"SIDEWAYS\"}")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("replay verify with fewer than 2 runs → 400, harness untouched")
    void replaySingleRun_badRequest() {
        client.post().uri("/api/v1/replay/verify")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"seed\":1,\"batchSize\":5,\"runs\":1}")
            .exchange()
            .expectStatus().isBadRequest();
        verifyNoInteractions(harness);
    }

    @Test
    @DisplayName("health → OK")
    void health_ok() {
        client.get().uri("/api/v1/orchestrate/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
