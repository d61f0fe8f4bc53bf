package com.decisionplatform.common.sizing;

/**
 * Non-gamma multipliers handed to the sizer by the gating layer.
 *
 * @param biasRiskMultiplier  bias state's risk multiplier
 * @param exposurePct         exposure guard's allowed new exposure (1.0 when the guard is off)
 * @param staleDiscount       discount applied to stale bias state under the allow policy
 */
public record SizingFactors(double biasRiskMultiplier, double exposurePct, double staleDiscount) {

    public static final SizingFactors NEUTRAL = new SizingFactors(1.0, 1.0, 1.0);
}
