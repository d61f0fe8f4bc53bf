package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Terminal artifact of an approved decision. {@code shadow} recommendations are computed
 * for comparison only and must never reach the execution collaborator.
 */
public record TradeRecommendation(
    @JsonProperty("experimentId") String experimentId,
    @JsonProperty("signalId") String signalId,
    @JsonProperty("engine") EngineVariant engine,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("optionType") OptionType optionType,
    @JsonProperty("strike") double strike,
    @JsonProperty("expiration") LocalDate expiration,
    @JsonProperty("quantity") int quantity,
    @JsonProperty("entryPrice") double entryPrice,
    @JsonProperty("stopLoss") double stopLoss,
    @JsonProperty("takeProfit") double takeProfit,
    @JsonProperty("shadow") boolean shadow,
    @JsonProperty("exitProfile") ExitProfile exitProfile
) {
    public TradeRecommendation {
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be >= 1, was " + quantity);
        }
    }

    public TradeRecommendation withQuantity(int newQuantity, ExitProfile profile) {
        return new TradeRecommendation(experimentId, signalId, engine, symbol, direction, optionType,
            strike, expiration, newQuantity, entryPrice, stopLoss, takeProfit, shadow, profile);
    }

    public TradeRecommendation asShadow() {
        return new TradeRecommendation(experimentId, signalId, engine, symbol, direction, optionType,
            strike, expiration, quantity, entryPrice, stopLoss, takeProfit, true, exitProfile);
    }
}
