package com.decisionplatform.orchestrator.service;

import com.decisionplatform.analysis.agent.ContextEvaluator;
import com.decisionplatform.analysis.agent.RiskEvaluator;
import com.decisionplatform.analysis.agent.TechnicalEvaluator;
import com.decisionplatform.analysis.service.EvaluatorDispatchService;
import com.decisionplatform.common.audit.InMemoryAuditSink;
import com.decisionplatform.common.config.DecisionConfig;
import com.decisionplatform.common.config.ExecutionMode;
import com.decisionplatform.common.consensus.WeightedMetaDecisionStrategy;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.SessionContext;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.TradeRecommendation;
import com.decisionplatform.orchestrator.TestInputs;
import com.decisionplatform.orchestrator.execution.ExecutionGateway;
import com.decisionplatform.orchestrator.execution.ShadowAwareExecutionDispatcher;
import com.decisionplatform.orchestrator.execution.ShadowLogSink;
import com.decisionplatform.orchestrator.gate.GatingLayer;
import com.decisionplatform.orchestrator.logger.DecisionFlowLogger;
import com.decisionplatform.orchestrator.pipeline.DecisionPipeline;
import com.decisionplatform.orchestrator.pipeline.DecisionPipelineFactory;
import com.decisionplatform.orchestrator.pipeline.DecisionRequest;
import com.decisionplatform.orchestrator.pipeline.PipelineOutcome;
import com.decisionplatform.orchestrator.pipeline.TerminalStage;
import com.decisionplatform.orchestrator.provider.InMemoryMarketDataStore;
import com.decisionplatform.orchestrator.provider.PriceSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrchestratorServiceTest {

    private static final DecisionConfig ENGINE_A_ONLY = DecisionConfig.builder().splitA(1.0).build();

    private final InMemoryMarketDataStore store = new InMemoryMarketDataStore();
    private final ExecutionGateway gateway = mock(ExecutionGateway.class);
    private final ShadowLogSink shadowSink = new ShadowLogSink();
    private final ShadowAwareExecutionDispatcher dispatcher = new ShadowAwareExecutionDispatcher(gateway, shadowSink);
    private final SignalClaimRegistry claims = new SignalClaimRegistry(Duration.ofHours(1), 1_000);

    @BeforeEach
    void seedStore() {
        store.putContext(TestInputs.bullishContext());
        store.putBiasState(TestInputs.bullishBias());
    }

    private static DecisionPipeline pipeline(DecisionConfig config) {
        EvaluatorDispatchService dispatch = new EvaluatorDispatchService(List.of(
            new ContextEvaluator(), new TechnicalEvaluator(), new RiskEvaluator()));
        return new DecisionPipelineFactory(config, dispatch,
            new WeightedMetaDecisionStrategy(config.approvalThreshold(), config.consensusWeights()))
            .create(new InMemoryAuditSink());
    }

    private OrchestratorService service(DecisionPipeline pipeline, DecisionConfig config) {
        return new OrchestratorService(store, store, store, pipeline, dispatcher, new DecisionFlowLogger(), claims, config);
    }

    // ── dispatch ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("shadow isolation")
    class DispatchTests {

        @Test
        @DisplayName("executing engine → recommendation submitted once")
        void primary_submitted() {
            StepVerifier.create(service(pipeline(ENGINE_A_ONLY), ENGINE_A_ONLY).process(TestInputs.signal("sig-1")))
                .assertNext(o -> assertEquals(TerminalStage.RECOMMENDED, o.terminalStage()))
                .verifyComplete();
            verify(gateway, times(1)).submit(any(TradeRecommendation.class));
            assertEquals(0, shadowSink.recordedCount());
        }

        @Test
        @DisplayName("SHADOW_ONLY → recommendation logged to the shadow sink, never submitted")
        void shadow_neverSubmitted() {
            DecisionConfig config = ENGINE_A_ONLY.toBuilder().executionMode(ExecutionMode.SHADOW_ONLY).build();
            StepVerifier.create(service(pipeline(config), config).process(TestInputs.signal("sig-2")))
                .assertNext(o -> assertTrue(o.recommendation().shadow()))
                .verifyComplete();
            verify(gateway, never()).submit(any());
            assertEquals(1, shadowSink.recordedCount());
        }

        @Test
        @DisplayName("no recommendation → nothing dispatched")
        void gated_nothingDispatched() {
            assertEquals(ShadowAwareExecutionDispatcher.Route.NONE,
                dispatcher.dispatch(PipelineOutcome.noPrice("sig-3")));
            verify(gateway, never()).submit(any());
        }
    }

    // ── resubmission ────────────────────────────────────────────────────

    @Nested
    @DisplayName("resubmitted signal id")
    class DuplicateTests {

        @Test
        @DisplayName("same signal processed twice → second run DUPLICATE, submitted once")
        void resubmission_executesOnce() {
            OrchestratorService service = service(pipeline(ENGINE_A_ONLY), ENGINE_A_ONLY);
            Signal signal = TestInputs.signal("sig-dup");

            assertEquals(TerminalStage.RECOMMENDED, service.process(signal).block().terminalStage());
            StepVerifier.create(service.process(signal))
                .assertNext(o -> {
                    assertEquals(TerminalStage.DUPLICATE, o.terminalStage());
                    assertEquals(List.of(PipelineOutcome.DUPLICATE_REASON), o.reasons());
                    assertNull(o.recommendation());
                })
                .verifyComplete();
            verify(gateway, times(1)).submit(any(TradeRecommendation.class));
        }

        @Test
        @DisplayName("duplicate never reaches the pipeline")
        void duplicate_skipsPipeline() {
            DecisionPipeline pipeline = mock(DecisionPipeline.class);
            when(pipeline.run(any())).thenReturn(Mono.just(PipelineOutcome.noPrice("sig-dup")));
            OrchestratorService service = service(pipeline, ENGINE_A_ONLY);

            service.process(TestInputs.signal("sig-dup")).block();
            service.process(TestInputs.signal("sig-dup")).block();

            verify(pipeline, times(1)).run(any());
        }

        @Test
        @DisplayName("id repeated inside one batch → one recommendation, one DUPLICATE")
        void batchRepeat_executesOnce() {
            List<Signal> signals = List.of(TestInputs.signal("b-dup"), TestInputs.signal("b-dup"));
            List<PipelineOutcome> outcomes = service(pipeline(ENGINE_A_ONLY), ENGINE_A_ONLY)
                .processBatch(signals).block();

            assertEquals(1, outcomes.stream().filter(o -> o.terminalStage() == TerminalStage.DUPLICATE).count());
            assertEquals(1, outcomes.stream().filter(o -> o.terminalStage() == TerminalStage.RECOMMENDED).count());
            verify(gateway, times(1)).submit(any(TradeRecommendation.class));
        }
    }

    // ── input resolution ────────────────────────────────────────────────

    @Nested
    @DisplayName("input resolution")
    class InputTests {

        @Test
        @DisplayName("context read fails but a price exists → degraded price-anchored context")
        void contextFailure_fallsBackToPrice() {
            InMemoryMarketDataStore noContext = new InMemoryMarketDataStore();
            noContext.putBiasState(TestInputs.bullishBias());
            noContext.putPrice("SPY", new PriceSnapshot(505.25, SessionContext.regular(90, 300)));

            DecisionPipeline pipeline = mock(DecisionPipeline.class);
            when(pipeline.run(any())).thenReturn(Mono.just(PipelineOutcome.noPrice("sig-4")));
            OrchestratorService service = new OrchestratorService(noContext, noContext, noContext, pipeline,
                dispatcher, new DecisionFlowLogger(), claims, ENGINE_A_ONLY);

            service.process(TestInputs.signal("sig-4")).block();

            ArgumentCaptor<DecisionRequest> captor = ArgumentCaptor.forClass(DecisionRequest.class);
            verify(pipeline).run(captor.capture());
            MarketContext ctx = captor.getValue().context();
            assertTrue(ctx.degraded());
            assertEquals(505.25, ctx.currentPrice(), 1e-9);
            assertEquals(505.25, ctx.latest(MarketContext.EMA_21), 1e-9);
            assertTrue(ctx.candles().isEmpty());
        }

        @Test
        @DisplayName("context and price both unavailable → NO_PRICE, pipeline never run")
        void noPrice_stops() {
            InMemoryMarketDataStore empty = new InMemoryMarketDataStore();
            DecisionPipeline pipeline = mock(DecisionPipeline.class);
            OrchestratorService service = new OrchestratorService(empty, empty, empty, pipeline,
                dispatcher, new DecisionFlowLogger(), claims, ENGINE_A_ONLY);

            StepVerifier.create(service.process(TestInputs.signal("sig-5")))
                .assertNext(o -> {
                    assertEquals(TerminalStage.NO_PRICE, o.terminalStage());
                    assertEquals(List.of(PipelineOutcome.NO_PRICE_REASON), o.reasons());
                })
                .verifyComplete();
            verify(pipeline, never()).run(any());
        }

        @Test
        @DisplayName("bias read error → treated as absent → gated 'no bias state'")
        void biasError_treatedAsAbsent() {
            InMemoryMarketDataStore failingBias = spy(store);
            doReturn(Mono.error(new IllegalStateException("bias feed down"))).when(failingBias).biasState("SPY");
            OrchestratorService service = new OrchestratorService(failingBias, failingBias, failingBias,
                pipeline(ENGINE_A_ONLY), dispatcher, new DecisionFlowLogger(), claims, ENGINE_A_ONLY);

            StepVerifier.create(service.process(TestInputs.signal("sig-6")))
                .assertNext(o -> {
                    assertEquals(TerminalStage.GATED, o.terminalStage());
                    assertEquals(List.of(GatingLayer.NO_BIAS_STATE), o.reasons());
                })
                .verifyComplete();
        }
    }

    // ── failures ────────────────────────────────────────────────────────

    @Test
    @DisplayName("unexpected pipeline exception → pipeline_fault outcome, no error signal")
    void pipelineException_contained() {
        DecisionPipeline pipeline = mock(DecisionPipeline.class);
        when(pipeline.run(any())).thenThrow(new IllegalStateException("wiring bug"));

        StepVerifier.create(service(pipeline, ENGINE_A_ONLY).process(TestInputs.signal("sig-7")))
            .assertNext(o -> {
                assertEquals(TerminalStage.PIPELINE_FAULT, o.terminalStage());
                assertEquals(List.of(PipelineOutcome.PIPELINE_FAULT_REASON), o.reasons());
            })
            .verifyComplete();
        verify(gateway, never()).submit(any());
    }

    @Test
    @DisplayName("batch → one outcome per signal, in input order")
    void batch_preservesOrder() {
        List<Signal> signals = List.of(TestInputs.signal("b-1"), TestInputs.signal("b-2"), TestInputs.signal("b-3"));
        StepVerifier.create(service(pipeline(ENGINE_A_ONLY), ENGINE_A_ONLY).processBatch(signals))
            .assertNext(outcomes -> assertEquals(List.of("b-1", "b-2", "b-3"),
                outcomes.stream().map(PipelineOutcome::signalId).toList()))
            .verifyComplete();
    }
}
