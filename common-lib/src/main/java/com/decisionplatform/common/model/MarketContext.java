package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only market snapshot for one evaluation. Never mutated mid-decision.
 *
 * <p>Candles and every indicator series are ordered most-recent-last. The gamma,
 * options-flow and market-intel enrichments may be absent and are exposed only through
 * {@link Optional}-returning accessors so evaluators never null-check them ad hoc.
 *
 * <p>{@link #priceAnchored} is the single place a degraded context is synthesized when
 * the candle/indicator read fails but a current price is still obtainable.
 */
public record MarketContext(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("candles") List<Candle> candles,
    @JsonProperty("indicators") Map<String, List<Double>> indicators,
    @JsonProperty("currentPrice") double currentPrice,
    @JsonProperty("sessionContext") SessionContext sessionContext,
    @JsonProperty("gammaContext") GammaContext gammaContext,
    @JsonProperty("optionsFlow") OptionsFlow optionsFlow,
    @JsonProperty("marketIntel") MarketIntel marketIntel,
    @JsonProperty("riskFlags") PortfolioRiskFlags riskFlags,
    @JsonProperty("degraded") boolean degraded
) {
    public static final String EMA_8   = "ema8";
    public static final String EMA_13  = "ema13";
    public static final String EMA_21  = "ema21";
    public static final String EMA_48  = "ema48";
    public static final String EMA_200 = "ema200";
    public static final String ATR     = "atr";

    /** ATR proxy used by the price-anchored fallback: 0.5% of price. */
    static final double FALLBACK_ATR_FRACTION = 0.005;

    public MarketContext {
        candles = candles == null ? List.of() : List.copyOf(candles);
        Map<String, List<Double>> sorted = new TreeMap<>();
        if (indicators != null) {
            indicators.forEach((k, v) -> sorted.put(k, v == null ? List.of() : List.copyOf(v)));
        }
        indicators = Collections.unmodifiableMap(sorted);
        riskFlags = riskFlags == null ? PortfolioRiskFlags.CLEAR : riskFlags;
    }

    /**
     * Builds a degraded context anchored on {@code price}: no candles, every EMA equal to
     * the price and an ATR proxy. Engines treat {@link #degraded()} contexts as missing
     * enrichment rather than aborting.
     */
    public static MarketContext priceAnchored(String symbol, Instant timestamp, double price,
                                              SessionContext session) {
        Map<String, List<Double>> indicators = new TreeMap<>();
        for (String ema : List.of(EMA_8, EMA_13, EMA_21, EMA_48, EMA_200)) {
            indicators.put(ema, List.of(price));
        }
        indicators.put(ATR, List.of(price * FALLBACK_ATR_FRACTION));
        return new MarketContext(symbol, timestamp, List.of(), indicators, price, session,
            null, null, null, PortfolioRiskFlags.CLEAR, true);
    }

    public Optional<GammaContext> gamma() {
        return Optional.ofNullable(gammaContext);
    }

    public Optional<OptionsFlow> flow() {
        return Optional.ofNullable(optionsFlow);
    }

    public Optional<MarketIntel> intel() {
        return Optional.ofNullable(marketIntel);
    }

    /** Latest value of the named indicator series, or {@link Double#NaN} when absent. */
    @JsonIgnore
    public double latest(String indicator) {
        List<Double> series = indicators.get(indicator);
        if (series == null || series.isEmpty()) {
            return Double.NaN;
        }
        return series.get(series.size() - 1);
    }

    @JsonIgnore
    public List<Double> closes() {
        return candles.stream().map(Candle::close).toList();
    }
}
