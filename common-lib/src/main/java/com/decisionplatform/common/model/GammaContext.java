package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Dealer-gamma enrichment for a symbol, consumed as data from the options-analytics provider.
 *
 * @param netGamma                 signed net dealer gamma exposure
 * @param gammaFlip                price level where net gamma changes sign (nullable)
 * @param dealerBias               {@code "long"}, {@code "short"} or {@code "neutral"}
 * @param topGammaStrikes          strikes ordered by absolute gamma, largest first
 * @param positionSizeMultiplier   explicit multiplier supplied by upstream enrichment (nullable);
 *                                 takes precedence over the regime-derived default
 */
public record GammaContext(
    @JsonProperty("netGamma") double netGamma,
    @JsonProperty("gammaFlip") Double gammaFlip,
    @JsonProperty("dealerBias") String dealerBias,
    @JsonProperty("topGammaStrikes") List<Double> topGammaStrikes,
    @JsonProperty("positionSizeMultiplier") Double positionSizeMultiplier
) {
    public GammaContext {
        topGammaStrikes = topGammaStrikes == null ? List.of() : List.copyOf(topGammaStrikes);
    }

    public static GammaContext of(double netGamma) {
        return new GammaContext(netGamma, null, "neutral", List.of(), null);
    }
}
