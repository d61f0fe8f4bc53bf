package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk posture attached to a bias state by the bias provider.
 *
 * @param invalidationLevel  price at which the bias thesis is invalidated (nullable)
 * @param sizeMultiplier     provider-side size hint, informational only
 */
public record BiasRiskContext(
    @JsonProperty("invalidationLevel") Double invalidationLevel,
    @JsonProperty("sizeMultiplier") double sizeMultiplier
) {
    public static final BiasRiskContext NONE = new BiasRiskContext(null, 1.0);
}
