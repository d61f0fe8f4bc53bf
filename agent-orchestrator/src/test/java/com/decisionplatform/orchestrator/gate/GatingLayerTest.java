package com.decisionplatform.orchestrator.gate;

import com.decisionplatform.common.audit.InMemoryAuditSink;
import com.decisionplatform.common.config.DecisionConfig;
import com.decisionplatform.common.config.StalenessPolicy;
import com.decisionplatform.common.guard.PortfolioExposureGuard;
import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.model.BiasDirection;
import com.decisionplatform.common.model.OpenPosition;
import com.decisionplatform.common.model.OptionType;
import com.decisionplatform.common.model.StrategyType;
import com.decisionplatform.common.model.UnifiedBiasState;
import com.decisionplatform.orchestrator.TestInputs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GatingLayerTest {

    private final InMemoryAuditSink sink = new InMemoryAuditSink();
    private final AtomicInteger positionReads = new AtomicInteger();

    private GatingLayer gating(DecisionConfig config) {
        return new GatingLayer(config, new PortfolioExposureGuard(config.maxOpenTrades()), sink);
    }

    private Mono<List<OpenPosition>> positions(List<OpenPosition> snapshot) {
        return Mono.fromCallable(() -> {
            positionReads.incrementAndGet();
            return snapshot;
        });
    }

    private GateDecision evaluate(DecisionConfig config, UnifiedBiasState bias, Mono<List<OpenPosition>> positions) {
        return gating(config).evaluate(TestInputs.signal("sig-1"), bias, positions).block();
    }

    // ── bias presence ───────────────────────────────────────────────────

    @Nested
    @DisplayName("bias presence")
    class BiasPresenceTests {

        @Test
        @DisplayName("required and absent → HOLD 'no bias state', positions never read")
        void requiredAbsent_holds() {
            GateDecision d = evaluate(DecisionConfig.defaults(), null, positions(List.of()));
            assertEquals(GateStatus.HOLD, d.status());
            assertEquals(List.of(GatingLayer.NO_BIAS_STATE), d.reasons());
            assertEquals(0, positionReads.get());
        }

        @Test
        @DisplayName("optional and absent → PASS with a neutral substitute")
        void optionalAbsent_neutral() {
            DecisionConfig config = DecisionConfig.builder().requireMtfBias(false).build();
            GateDecision d = evaluate(config, null, positions(List.of()));
            assertTrue(d.passed());
            assertTrue(d.neutralBias());
            assertEquals(BiasDirection.NEUTRAL, d.bias().bias());
            assertEquals(StrategyType.SWING, d.strategyType());
        }
    }

    // ── suppression and staleness ───────────────────────────────────────

    @Nested
    @DisplayName("suppression and staleness")
    class StateTests {

        @Test
        @DisplayName("suppressed state → HOLD, positions never read")
        void suppressed_holds() {
            UnifiedBiasState suppressed = TestInputs.bullishBias().withSuppression(List.of("FOMC"));
            GateDecision d = evaluate(DecisionConfig.defaults(), suppressed, positions(List.of()));
            assertEquals(List.of(GatingLayer.SUPPRESSED), d.reasons());
            assertEquals(0, positionReads.get());
        }

        @Test
        @DisplayName("stale under BLOCK → HOLD 'stale bias state'")
        void staleBlock_holds() {
            UnifiedBiasState stale = TestInputs.bullishBias().withStaleness(true, 45);
            GateDecision d = evaluate(DecisionConfig.defaults(), stale, positions(List.of()));
            assertEquals(GateStatus.HOLD, d.status());
            assertEquals(List.of(GatingLayer.STALE_BIAS_STATE), d.reasons());
        }

        @Test
        @DisplayName("stale under ALLOW_WITH_DISCOUNT → PASS with confidence and size discounted")
        void staleAllow_discounts() {
            DecisionConfig config = DecisionConfig.builder()
                .stalenessPolicy(StalenessPolicy.ALLOW_WITH_DISCOUNT).staleDiscount(0.7).build();
            UnifiedBiasState stale = TestInputs.bullishBias().withStaleness(true, 45);
            GateDecision d = evaluate(config, stale, positions(List.of()));
            assertTrue(d.passed());
            assertEquals(0.7, d.staleDiscount(), 1e-9);
            assertEquals(0.56, d.bias().effectiveConfidence(), 1e-9);
            assertEquals(0.7, d.sizingFactors().staleDiscount(), 1e-9);
        }
    }

    // ── portfolio guard ─────────────────────────────────────────────────

    @Nested
    @DisplayName("portfolio guard")
    class GuardTests {

        @Test
        @DisplayName("positions read error → HOLD 'portfolio guard unavailable'")
        void readError_failsClosed() {
            GateDecision d = evaluate(DecisionConfig.defaults(), TestInputs.bullishBias(),
                Mono.error(new IllegalStateException("broker down")));
            assertEquals(GateStatus.HOLD, d.status());
            assertEquals(List.of(GatingLayer.GUARD_UNAVAILABLE), d.reasons());
        }

        @Test
        @DisplayName("positions read returns nothing → HOLD 'portfolio guard unavailable'")
        void emptyRead_failsClosed() {
            GateDecision d = evaluate(DecisionConfig.defaults(), TestInputs.bullishBias(), Mono.empty());
            assertEquals(List.of(GatingLayer.GUARD_UNAVAILABLE), d.reasons());
        }

        @Test
        @DisplayName("positions read slower than the timeout → HOLD 'portfolio guard unavailable'")
        void slowRead_failsClosed() {
            DecisionConfig config = DecisionConfig.builder().readTimeout(Duration.ofMillis(50)).build();
            StepVerifier.create(gating(config).evaluate(TestInputs.signal("sig-1"), TestInputs.bullishBias(),
                    Mono.<List<OpenPosition>>never()))
                .assertNext(d -> assertEquals(List.of(GatingLayer.GUARD_UNAVAILABLE), d.reasons()))
                .verifyComplete();
        }

        @Test
        @DisplayName("guard BLOCK → HOLD with the guard's reasons")
        void guardBlock_holds() {
            List<OpenPosition> open = List.of(
                TestInputs.position("p1", "SPY", OptionType.CALL),
                TestInputs.position("p2", "SPY", OptionType.CALL));
            GateDecision d = evaluate(DecisionConfig.defaults(), TestInputs.bullishBias(), positions(open));
            assertEquals(GateStatus.HOLD, d.status());
            assertEquals(List.of(PortfolioExposureGuard.MAX_SAME_DIRECTION_PER_SYMBOL_CLUSTER), d.reasons());
            assertEquals(0.0, d.sizingFactors().exposurePct(), 1e-9);
        }

        @Test
        @DisplayName("guard DOWNGRADE → PASS carrying the reduced exposure")
        void guardDowngrade_passes() {
            UnifiedBiasState drifting = TestInputs.bullishBias().withRegime("TREND", 0, "MACRO_NEUTRAL", 0.3, false, "STABLE");
            GateDecision d = evaluate(DecisionConfig.defaults(), drifting, positions(List.of()));
            assertTrue(d.passed());
            assertEquals(List.of(PortfolioExposureGuard.MACRO_DRIFT_GUARD), d.reasons());
            assertEquals(0.5, d.sizingFactors().exposurePct(), 1e-9);
            assertEquals(1, positionReads.get());
        }

        @Test
        @DisplayName("bias state without regime fields → guard runs on defaults and PASSes")
        void missingRegimeFields_passes() {
            UnifiedBiasState bare = new UnifiedBiasState("SPY", BiasDirection.BULLISH, 0.8, 1.0, false, 0, false,
                "PULLBACK", null, null, null, 0.0, null, 0.0, false, null);
            List<OpenPosition> open = List.of(TestInputs.position("p1", "AAPL", OptionType.PUT));
            GateDecision d = evaluate(DecisionConfig.defaults(), bare, positions(open));
            assertTrue(d.passed());
            assertTrue(d.reasons().isEmpty());
        }

        @Test
        @DisplayName("guard failure → error surfaces instead of 'portfolio guard unavailable'")
        void guardFailure_propagates() {
            PortfolioExposureGuard broken = mock(PortfolioExposureGuard.class);
            when(broken.evaluate(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("bad rule"));
            GatingLayer layer = new GatingLayer(DecisionConfig.defaults(), broken, sink);

            StepVerifier.create(layer.evaluate(TestInputs.signal("sig-1"), TestInputs.bullishBias(),
                    positions(List.of())))
                .expectErrorMessage("bad rule")
                .verify();
            assertEquals(1, positionReads.get());
            assertEquals(0, sink.size());
        }

        @Test
        @DisplayName("guard disabled → PASS without reading positions")
        void guardDisabled_skipsRead() {
            DecisionConfig config = DecisionConfig.builder().portfolioGuardEnabled(false).build();
            GateDecision d = evaluate(config, TestInputs.bullishBias(), positions(List.of()));
            assertTrue(d.passed());
            assertNull(d.exposure());
            assertEquals(0, positionReads.get());
        }
    }

    // ── audit ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("every evaluation writes exactly one GATING record")
    void gatingAudit_writtenOnce() {
        GateDecision d = evaluate(DecisionConfig.defaults(), TestInputs.bullishBias(), positions(List.of()));
        assertEquals(1, sink.size());
        assertSame(d, sink.find("sig-1", AuditStage.GATING).orElseThrow().payload());
    }
}
