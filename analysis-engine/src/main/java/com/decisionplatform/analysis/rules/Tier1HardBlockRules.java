package com.decisionplatform.analysis.rules;

import com.decisionplatform.analysis.engine.DecisionInput;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.MarketIntel;
import com.decisionplatform.common.model.PortfolioRiskFlags;
import com.decisionplatform.common.model.SessionContext;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tier 1: structural disqualifiers. Any trigger blocks the signal.
 *
 * <p>Rule order: {@value #SESSION_INCOMPATIBLE}, {@value #MISSING_ENRICHMENT},
 * {@value #LOW_SIGNAL_CONFIDENCE}, {@value #REGIME_CONFLICT}, {@value #PORTFOLIO_RISK_LIMIT},
 * {@value #VOLATILITY_MISMATCH}.
 */
public final class Tier1HardBlockRules {

    public static final String SESSION_INCOMPATIBLE  = "SESSION_INCOMPATIBLE";
    public static final String MISSING_ENRICHMENT    = "MISSING_ENRICHMENT";
    public static final String LOW_SIGNAL_CONFIDENCE = "LOW_SIGNAL_CONFIDENCE";
    public static final String REGIME_CONFLICT       = "REGIME_CONFLICT";
    public static final String PORTFOLIO_RISK_LIMIT  = "PORTFOLIO_RISK_LIMIT";
    public static final String VOLATILITY_MISMATCH   = "VOLATILITY_MISMATCH";

    static final int MIN_MINUTES_TO_CLOSE = 15;
    static final double MIN_IV_PERCENTILE = 10;
    static final double MAX_IV_PERCENTILE = 90;

    private static final Set<String> BEARISH_REGIMES = Set.of("BEAR", "STRONG_BEAR", "BREAKDOWN");
    private static final Set<String> BULLISH_REGIMES = Set.of("BULL", "STRONG_BULL", "BREAKOUT");

    private Tier1HardBlockRules() {}

    public static List<EntryRule> rules(double minConfidence) {
        return List.of(
            new NamedRule(SESSION_INCOMPATIBLE, 1, Tier1HardBlockRules::session),
            new NamedRule(MISSING_ENRICHMENT, 1, Tier1HardBlockRules::enrichment),
            new NamedRule(LOW_SIGNAL_CONFIDENCE, 1, in -> confidence(in, minConfidence)),
            new NamedRule(REGIME_CONFLICT, 1, Tier1HardBlockRules::regimeConflict),
            new NamedRule(PORTFOLIO_RISK_LIMIT, 1, Tier1HardBlockRules::portfolioRisk),
            new NamedRule(VOLATILITY_MISMATCH, 1, Tier1HardBlockRules::volatility)
        );
    }

    private static Optional<String> session(DecisionInput in) {
        SessionContext s = in.context().sessionContext();
        if (s == null) {
            return Optional.of("session context unavailable");
        }
        if (!s.isRegularHours()) {
            return Optional.of("session " + s.sessionType() + (s.marketOpen() ? "" : " (closed)") + " not tradable");
        }
        if (s.minutesUntilClose() < MIN_MINUTES_TO_CLOSE) {
            return Optional.of(s.minutesUntilClose() + " minutes to close, below " + MIN_MINUTES_TO_CLOSE);
        }
        return Optional.empty();
    }

    private static Optional<String> enrichment(DecisionInput in) {
        MarketContext ctx = in.context();
        if (ctx.degraded()) {
            return Optional.of("market context degraded to price-anchored fallback");
        }
        if (ctx.indicators().isEmpty()) {
            return Optional.of("no indicator series available");
        }
        return Optional.empty();
    }

    private static Optional<String> confidence(DecisionInput in, double minConfidence) {
        double c = in.bias().effectiveConfidence();
        if (c < minConfidence) {
            return Optional.of(String.format(Locale.ROOT, "bias confidence %.2f below minimum %.2f", c, minConfidence));
        }
        return Optional.empty();
    }

    private static Optional<String> regimeConflict(DecisionInput in) {
        Direction direction = in.signal().direction();
        if (in.bias().bias().conflictsWith(direction)) {
            return Optional.of(direction.value() + " conflicts with " + in.bias().bias() + " bias");
        }
        String regime = in.context().intel().map(MarketIntel::regime).orElse(null);
        if (regime != null) {
            String r = regime.toUpperCase();
            if (direction == Direction.LONG && BEARISH_REGIMES.contains(r)) {
                return Optional.of("long conflicts with regime " + r);
            }
            if (direction == Direction.SHORT && BULLISH_REGIMES.contains(r)) {
                return Optional.of("short conflicts with regime " + r);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> portfolioRisk(DecisionInput in) {
        PortfolioRiskFlags flags = in.context().riskFlags();
        if (flags.positionLimitExceeded()) {
            return Optional.of("portfolio position limit exceeded");
        }
        if (flags.exposureExceeded()) {
            return Optional.of("portfolio exposure limit exceeded");
        }
        return Optional.empty();
    }

    private static Optional<String> volatility(DecisionInput in) {
        return in.context().intel()
            .filter(mi -> mi.ivPercentile() < MIN_IV_PERCENTILE || mi.ivPercentile() > MAX_IV_PERCENTILE)
            .map(mi -> String.format(Locale.ROOT, "IV percentile %.1f outside %.0f-%.0f",
                mi.ivPercentile(), MIN_IV_PERCENTILE, MAX_IV_PERCENTILE));
    }
}
