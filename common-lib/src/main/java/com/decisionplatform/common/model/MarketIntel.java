package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional market-intelligence enrichment.
 *
 * @param regime          regime label, e.g. {@code BULL}, {@code STRONG_BEAR}, {@code BREAKOUT}
 * @param ivPercentile    implied-volatility percentile 0–100
 * @param gexState        e.g. {@code POSITIVE_HIGH}, {@code NEGATIVE_HIGH}, {@code NEUTRAL}
 * @param liquidityState  e.g. {@code NORMAL}, {@code THIN}
 */
public record MarketIntel(
    @JsonProperty("regime") String regime,
    @JsonProperty("ivPercentile") double ivPercentile,
    @JsonProperty("gexState") String gexState,
    @JsonProperty("liquidityState") String liquidityState
) {}
