package com.decisionplatform.analysis;

import com.decisionplatform.analysis.engine.DecisionInput;
import com.decisionplatform.common.model.BiasDirection;
import com.decisionplatform.common.model.Candle;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.GammaContext;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.MarketIntel;
import com.decisionplatform.common.model.OptionsFlow;
import com.decisionplatform.common.model.PortfolioRiskFlags;
import com.decisionplatform.common.model.SessionContext;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.UnifiedBiasState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared test inputs. The baseline is a clean SPY long setup 90 minutes into the session
 * that passes every Engine A rule and every risk check.
 */
public final class Fixtures {

    /** 2024-03-12 11:00 America/New_York. */
    public static final Instant TS = Instant.parse("2024-03-12T15:00:00Z");

    private Fixtures() {}

    public static Signal signal(Direction direction) {
        return Signal.of("sig-1", "SPY", direction, "5m", TS, "exp-1");
    }

    /** Alternating +up / −down closes starting at {@code start}, last candle ending at {@link #TS}. */
    public static List<Candle> zigzag(double start, double up, double down, int count) {
        List<Candle> candles = new ArrayList<>(count);
        double close = start;
        for (int k = 0; k < count; k++) {
            double open = close;
            if (k > 0) {
                close = k % 2 == 1 ? open + up : open - down;
            }
            Instant ts = TS.minus(Duration.ofMinutes((long) (count - 1 - k) * 5));
            candles.add(new Candle(ts, open, Math.max(open, close) + 0.2, Math.min(open, close) - 0.2, close, 50_000));
        }
        return candles;
    }

    public static MarketContext bullishContext() {
        List<Candle> candles = zigzag(500, 1.0, 0.6, 30);
        double price = candles.get(candles.size() - 1).close();
        Map<String, List<Double>> indicators = new TreeMap<>();
        indicators.put(MarketContext.EMA_8, List.of(price - 1));
        indicators.put(MarketContext.EMA_13, List.of(price - 2));
        indicators.put(MarketContext.EMA_21, List.of(price - 3));
        indicators.put(MarketContext.ATR, List.of(1.5));
        return new MarketContext("SPY", TS, candles, indicators, price, SessionContext.regular(90, 300),
            null, null, new MarketIntel("BULL", 40, "NEUTRAL", "NORMAL"), PortfolioRiskFlags.CLEAR, false);
    }

    public static UnifiedBiasState bullishBias() {
        return UnifiedBiasState.of("SPY", BiasDirection.BULLISH, 0.8, 1.0, "PULLBACK");
    }

    public static DecisionInput bullishInput() {
        return new DecisionInput(signal(Direction.LONG), bullishContext(), bullishBias());
    }

    // ── context variations ───────────────────────────────────────────────

    public static MarketContext withSession(MarketContext c, SessionContext session) {
        return new MarketContext(c.symbol(), c.timestamp(), c.candles(), c.indicators(), c.currentPrice(), session,
            c.gammaContext(), c.optionsFlow(), c.marketIntel(), c.riskFlags(), c.degraded());
    }

    public static MarketContext withIntel(MarketContext c, MarketIntel intel) {
        return new MarketContext(c.symbol(), c.timestamp(), c.candles(), c.indicators(), c.currentPrice(),
            c.sessionContext(), c.gammaContext(), c.optionsFlow(), intel, c.riskFlags(), c.degraded());
    }

    public static MarketContext withGammaAndFlow(MarketContext c, GammaContext gamma, OptionsFlow flow) {
        return new MarketContext(c.symbol(), c.timestamp(), c.candles(), c.indicators(), c.currentPrice(),
            c.sessionContext(), gamma, flow, c.marketIntel(), c.riskFlags(), c.degraded());
    }

    public static MarketContext withRiskFlags(MarketContext c, PortfolioRiskFlags flags) {
        return new MarketContext(c.symbol(), c.timestamp(), c.candles(), c.indicators(), c.currentPrice(),
            c.sessionContext(), c.gammaContext(), c.optionsFlow(), c.marketIntel(), flags, c.degraded());
    }

    public static MarketContext withIndicators(MarketContext c, Map<String, List<Double>> indicators) {
        return new MarketContext(c.symbol(), c.timestamp(), c.candles(), indicators, c.currentPrice(),
            c.sessionContext(), c.gammaContext(), c.optionsFlow(), c.marketIntel(), c.riskFlags(), c.degraded());
    }
}
