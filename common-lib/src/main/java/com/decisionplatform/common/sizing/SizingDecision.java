package com.decisionplatform.common.sizing;

import com.decisionplatform.common.model.ExitProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audit record of one sizing computation.
 *
 * @param regime            classified regime, {@code null} when no gamma context was available
 * @param multiplierSource  {@code UPSTREAM}, {@code REGIME} or {@code DEFAULT}
 */
public record SizingDecision(
    @JsonProperty("regime") GammaRegime regime,
    @JsonProperty("gammaMultiplier") double gammaMultiplier,
    @JsonProperty("multiplierSource") String multiplierSource,
    @JsonProperty("exitProfile") ExitProfile exitProfile,
    @JsonProperty("baseQuantity") int baseQuantity,
    @JsonProperty("biasRiskMultiplier") double biasRiskMultiplier,
    @JsonProperty("exposurePct") double exposurePct,
    @JsonProperty("staleDiscount") double staleDiscount,
    @JsonProperty("rawQuantity") double rawQuantity,
    @JsonProperty("quantity") int quantity
) {}
