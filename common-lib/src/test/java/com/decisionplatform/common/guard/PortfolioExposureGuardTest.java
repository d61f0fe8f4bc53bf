package com.decisionplatform.common.guard;

import com.decisionplatform.common.model.BiasDirection;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.ExposureDecision;
import com.decisionplatform.common.model.ExposureResult;
import com.decisionplatform.common.model.OpenPosition;
import com.decisionplatform.common.model.OptionType;
import com.decisionplatform.common.model.StrategyType;
import com.decisionplatform.common.model.UnifiedBiasState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioExposureGuardTest {

    private final PortfolioExposureGuard guard = new PortfolioExposureGuard(5);

    private static final UnifiedBiasState CALM =
        UnifiedBiasState.of("SPY", BiasDirection.BULLISH, 0.8, 1.0, "PULLBACK");

    private static OpenPosition call(String id, String symbol) {
        return new OpenPosition(id, symbol, OptionType.CALL, 1, 2.0);
    }

    private static OpenPosition put(String id, String symbol) {
        return new OpenPosition(id, symbol, OptionType.PUT, 1, 2.0);
    }

    // ── blocking rules ────────────────────────────────────────────────────

    @Nested
    @DisplayName("BLOCK rules")
    class BlockTests {

        @Test
        @DisplayName("two same-direction positions in the symbol → BLOCK cluster")
        void sameDirectionCluster_blocks() {
            ExposureResult r = guard.evaluate(List.of(call("p1", "SPY"), call("p2", "SPY")),
                "SPY", Direction.LONG, StrategyType.PULLBACK, CALM);
            assertEquals(ExposureDecision.BLOCK, r.result());
            assertEquals(List.of(PortfolioExposureGuard.MAX_SAME_DIRECTION_PER_SYMBOL_CLUSTER), r.reasons());
            assertEquals(0.0, r.allowedNewExposurePct());
        }

        @Test
        @DisplayName("three longs against a bearish macro → BLOCK MACRO_BIAS_CLUSTER")
        void macroBiasCluster_blocks() {
            UnifiedBiasState bearish = CALM.withRegime("TREND", 10, "MACRO_TREND_DOWN", 0.0, false, "STABLE");
            ExposureResult r = guard.evaluate(List.of(call("p1", "AAPL"), call("p2", "NVDA"), call("p3", "TSLA")),
                "SPY", Direction.SHORT, StrategyType.SWING, bearish);
            assertTrue(r.blocked());
            assertEquals(List.of(PortfolioExposureGuard.MACRO_BIAS_CLUSTER), r.reasons());
            assertEquals(3, r.metrics().macroBiasCluster());
        }

        @Test
        @DisplayName("breakout in a choppy range → BLOCK RANGE_BREAKOUT_BLOCKED")
        void rangeBreakout_blocks() {
            UnifiedBiasState range = CALM.withRegime("RANGE", 85, "MACRO_NEUTRAL", 0.0, false, "STABLE");
            ExposureResult r = guard.evaluate(List.of(), "SPY", Direction.LONG, StrategyType.BREAKOUT, range);
            assertTrue(r.blocked());
            assertTrue(r.reasons().contains(PortfolioExposureGuard.RANGE_BREAKOUT_BLOCKED));
        }

        @Test
        @DisplayName("open positions at the configured maximum → BLOCK MAX_OPEN_TRADES")
        void maxOpenTrades_blocks() {
            PortfolioExposureGuard tight = new PortfolioExposureGuard(2);
            ExposureResult r = tight.evaluate(List.of(call("p1", "AAPL"), put("p2", "NVDA")),
                "SPY", Direction.LONG, StrategyType.SWING, CALM);
            assertTrue(r.blocked());
            assertEquals(List.of(PortfolioExposureGuard.MAX_OPEN_TRADES), r.reasons());
        }

        @Test
        @DisplayName("two mixed-direction positions in the symbol → BLOCK MAX_POSITIONS_PER_SYMBOL")
        void maxPerSymbol_blocks() {
            ExposureResult r = guard.evaluate(List.of(call("p1", "SPY"), put("p2", "SPY")),
                "SPY", Direction.LONG, StrategyType.SWING, CALM);
            assertTrue(r.blocked());
            assertEquals(List.of(PortfolioExposureGuard.MAX_POSITIONS_PER_SYMBOL), r.reasons());
        }
    }

    // ── downgrade rules ───────────────────────────────────────────────────

    @Nested
    @DisplayName("DOWNGRADE rules")
    class DowngradeTests {

        @Test
        @DisplayName("macro drift above 0.15 → exposure halved, defined risk only")
        void macroDrift_halvesExposure() {
            UnifiedBiasState drifting = CALM.withRegime("TREND", 10, "MACRO_NEUTRAL", 0.2, false, "STABLE");
            ExposureResult r = guard.evaluate(List.of(), "SPY", Direction.LONG, StrategyType.SWING, drifting);
            assertEquals(ExposureDecision.DOWNGRADE, r.result());
            assertEquals(0.5, r.allowedNewExposurePct(), 1e-12);
            assertTrue(r.metrics().definedRiskOnly());
        }

        @Test
        @DisplayName("macro flip plus expanding ATR in unstable macro → 0.5 × 0.8")
        void flipAndExpansion_compound() {
            UnifiedBiasState unstable = CALM.withRegime("TREND", 10, "MACRO_REVERSAL_RISK", 0.0, true, "EXPANDING");
            ExposureResult r = guard.evaluate(List.of(), "SPY", Direction.LONG, StrategyType.SWING, unstable);
            assertEquals(ExposureDecision.DOWNGRADE, r.result());
            assertEquals(0.4, r.allowedNewExposurePct(), 1e-12);
            assertEquals(List.of(PortfolioExposureGuard.MACRO_DRIFT_GUARD,
                PortfolioExposureGuard.VOLATILITY_EXPANSION_GUARD), r.reasons());
        }

        @Test
        @DisplayName("choppy range at the directional cap → reason only, not a block")
        void rangeDirectionalCap_downgrades() {
            UnifiedBiasState range = CALM.withRegime("RANGE", 90, "MACRO_NEUTRAL", 0.0, false, "STABLE");
            ExposureResult r = guard.evaluate(List.of(call("p1", "AAPL"), call("p2", "NVDA")),
                "SPY", Direction.LONG, StrategyType.PULLBACK, range);
            assertEquals(ExposureDecision.DOWNGRADE, r.result());
            assertEquals(List.of(PortfolioExposureGuard.RANGE_REGIME_DIRECTIONAL_CAP), r.reasons());
            assertEquals(2, r.metrics().maxDirectionalTrades());
        }
    }

    @Test
    @DisplayName("flat book, calm regime → ALLOW with full exposure")
    void flatBook_allows() {
        ExposureResult r = guard.evaluate(List.of(), "SPY", Direction.LONG, StrategyType.PULLBACK, CALM);
        assertEquals(ExposureDecision.ALLOW, r.result());
        assertTrue(r.reasons().isEmpty());
        assertEquals(1.0, r.allowedNewExposurePct(), 1e-12);
    }

    @Test
    @DisplayName("bias state without regime fields → neutral defaults, ALLOW")
    void missingRegimeFields_allows() {
        UnifiedBiasState bare = new UnifiedBiasState("SPY", BiasDirection.BULLISH, 0.8, 1.0, false, 0, false,
            "PULLBACK", null, null, null, 0.0, null, 0.0, false, null);
        assertEquals(UnifiedBiasState.DEFAULT_MACRO_CLASS, bare.macroClass());
        ExposureResult r = guard.evaluate(List.of(call("p1", "AAPL"), put("p2", "NVDA")),
            "SPY", Direction.LONG, StrategyType.PULLBACK, bare);
        assertEquals(ExposureDecision.ALLOW, r.result());
        assertEquals(0, r.metrics().macroBiasCluster());
    }

    @Test
    @DisplayName("metrics report net and gross exposure")
    void metrics_netAndGross() {
        ExposureResult r = guard.evaluate(
            List.of(new OpenPosition("p1", "AAPL", OptionType.CALL, 3, 1.0),
                    new OpenPosition("p2", "NVDA", OptionType.PUT, 1, 1.0)),
            "SPY", Direction.LONG, StrategyType.SWING, CALM);
        assertEquals(2, r.metrics().netDirectionalExposure());
        assertEquals(4, r.metrics().grossExposure());
    }
}
