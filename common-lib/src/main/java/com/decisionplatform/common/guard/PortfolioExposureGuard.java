package com.decisionplatform.common.guard;

import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.ExposureDecision;
import com.decisionplatform.common.model.ExposureMetrics;
import com.decisionplatform.common.model.ExposureResult;
import com.decisionplatform.common.model.OpenPosition;
import com.decisionplatform.common.model.StrategyType;
import com.decisionplatform.common.model.UnifiedBiasState;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Regime-aware portfolio exposure guard for a candidate trade.
 *
 * <h3>Rule order (first BLOCK wins; downgrade rules accumulate)</h3>
 * <ol>
 *   <li>{@code MAX_SAME_DIRECTION_PER_SYMBOL_CLUSTER} — ≥2 same-direction positions in the symbol → BLOCK</li>
 *   <li>{@code MACRO_BIAS_CLUSTER} — ≥3 positions against the macro class → BLOCK</li>
 *   <li>{@code MACRO_DRIFT_GUARD} — drift &gt; 0.15 or macro flip → exposure ×0.5, defined risk only</li>
 *   <li>Range regime with chop &gt; 70 → directional cap 2 ({@code RANGE_REGIME_DIRECTIONAL_CAP});
 *       {@code BREAKOUT} candidates → BLOCK ({@code RANGE_BREAKOUT_BLOCKED})</li>
 *   <li>{@code VOLATILITY_EXPANSION_GUARD} — ATR expanding in an unstable macro class → exposure ×0.8</li>
 *   <li>{@code MAX_OPEN_TRADES} — open positions ≥ configured maximum → BLOCK</li>
 *   <li>{@code MAX_POSITIONS_PER_SYMBOL} — ≥2 positions in the symbol → BLOCK</li>
 * </ol>
 * Any surviving reason yields DOWNGRADE; none yields ALLOW.
 *
 * <p>Pure function of its inputs. Stateless and thread-safe.
 */
public final class PortfolioExposureGuard {

    public static final String MAX_SAME_DIRECTION_PER_SYMBOL_CLUSTER = "MAX_SAME_DIRECTION_PER_SYMBOL_CLUSTER";
    public static final String MACRO_BIAS_CLUSTER          = "MACRO_BIAS_CLUSTER";
    public static final String MACRO_DRIFT_GUARD           = "MACRO_DRIFT_GUARD";
    public static final String RANGE_REGIME_DIRECTIONAL_CAP = "RANGE_REGIME_DIRECTIONAL_CAP";
    public static final String RANGE_BREAKOUT_BLOCKED      = "RANGE_BREAKOUT_BLOCKED";
    public static final String VOLATILITY_EXPANSION_GUARD  = "VOLATILITY_EXPANSION_GUARD";
    public static final String MAX_OPEN_TRADES             = "MAX_OPEN_TRADES";
    public static final String MAX_POSITIONS_PER_SYMBOL    = "MAX_POSITIONS_PER_SYMBOL";

    static final double MACRO_DRIFT_THRESHOLD = 0.15;
    static final double RANGE_CHOP_THRESHOLD  = 70;
    static final int MAX_SAME_DIRECTION_PER_SYMBOL = 2;
    static final int MAX_MACRO_MISALIGNED = 3;
    static final int MAX_PER_SYMBOL = 2;
    static final int RANGE_DIRECTIONAL_CAP = 2;

    private static final Set<String> BEARISH_MACRO  = Set.of("MACRO_BREAKDOWN_CONFIRMED", "MACRO_TREND_DOWN");
    private static final Set<String> BULLISH_MACRO  = Set.of("MACRO_TREND_UP");
    private static final Set<String> UNSTABLE_MACRO = Set.of("MACRO_REVERSAL_RISK", "MACRO_RANGE");

    private final int maxOpenTrades;

    public PortfolioExposureGuard(int maxOpenTrades) {
        this.maxOpenTrades = maxOpenTrades;
    }

    public ExposureResult evaluate(List<OpenPosition> openPositions, String symbol, Direction direction,
                                   StrategyType strategyType, UnifiedBiasState state) {
        List<OpenPosition> positions = openPositions == null ? List.of() : openPositions;
        List<String> reasons = new ArrayList<>();

        int net = 0;
        int gross = 0;
        int longCount = 0;
        int shortCount = 0;
        for (OpenPosition p : positions) {
            int sign = p.directionalSign();
            net += sign;
            gross += Math.abs(p.quantity());
            if (sign > 0) {
                longCount++;
            } else {
                shortCount++;
            }
        }
        int directionalCount = direction == Direction.LONG ? longCount : shortCount;

        String macroClass = state.macroClass() == null ? "" : state.macroClass();
        int macroBiasCluster = 0;
        if (BEARISH_MACRO.contains(macroClass) && longCount > 0) {
            macroBiasCluster = longCount;
        } else if (BULLISH_MACRO.contains(macroClass) && shortCount > 0) {
            macroBiasCluster = shortCount;
        }

        long sameDirectionInSymbol = positions.stream()
            .filter(p -> p.symbol().equals(symbol))
            .filter(p -> p.directionalSign() * direction.sign() > 0)
            .count();
        if (sameDirectionInSymbol >= MAX_SAME_DIRECTION_PER_SYMBOL) {
            reasons.add(MAX_SAME_DIRECTION_PER_SYMBOL_CLUSTER);
            return block(reasons, net, gross, macroBiasCluster, true, maxOpenTrades);
        }

        if (macroBiasCluster >= MAX_MACRO_MISALIGNED) {
            reasons.add(MACRO_BIAS_CLUSTER);
            return block(reasons, net, gross, macroBiasCluster, true, maxOpenTrades);
        }

        double allowedPct = 1.0;
        boolean definedRiskOnly = false;
        int maxDirectional = maxOpenTrades;

        if (state.macroDriftScore() > MACRO_DRIFT_THRESHOLD || state.macroFlip()) {
            allowedPct *= 0.5;
            definedRiskOnly = true;
            reasons.add(MACRO_DRIFT_GUARD);
        }

        if ("RANGE".equals(state.regimeType()) && state.chopScore() > RANGE_CHOP_THRESHOLD) {
            maxDirectional = Math.min(maxDirectional, RANGE_DIRECTIONAL_CAP);
            if (directionalCount >= maxDirectional) {
                reasons.add(RANGE_REGIME_DIRECTIONAL_CAP);
            }
            if (strategyType == StrategyType.BREAKOUT) {
                reasons.add(RANGE_BREAKOUT_BLOCKED);
                return new ExposureResult(ExposureDecision.BLOCK, reasons,
                    new ExposureMetrics(net, gross, macroBiasCluster, allowedPct, definedRiskOnly, maxDirectional));
            }
        }

        if ("EXPANDING".equals(state.atrState()) && UNSTABLE_MACRO.contains(macroClass)) {
            allowedPct *= 0.8;
            reasons.add(VOLATILITY_EXPANSION_GUARD);
        }

        if (positions.size() >= maxOpenTrades) {
            reasons.add(MAX_OPEN_TRADES);
            return block(reasons, net, gross, macroBiasCluster, definedRiskOnly, maxDirectional);
        }

        long inSymbol = positions.stream().filter(p -> p.symbol().equals(symbol)).count();
        if (inSymbol >= MAX_PER_SYMBOL) {
            reasons.add(MAX_POSITIONS_PER_SYMBOL);
            return block(reasons, net, gross, macroBiasCluster, definedRiskOnly, maxDirectional);
        }

        ExposureDecision decision = reasons.isEmpty() ? ExposureDecision.ALLOW : ExposureDecision.DOWNGRADE;
        return new ExposureResult(decision, reasons,
            new ExposureMetrics(net, gross, macroBiasCluster, allowedPct, definedRiskOnly, maxDirectional));
    }

    private static ExposureResult block(List<String> reasons, int net, int gross, int macroBiasCluster,
                                        boolean definedRiskOnly, int maxDirectional) {
        return new ExposureResult(ExposureDecision.BLOCK, reasons,
            new ExposureMetrics(net, gross, macroBiasCluster, 0.0, definedRiskOnly, maxDirectional));
    }
}
