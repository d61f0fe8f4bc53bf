package com.decisionplatform.common.sizing;

import com.decisionplatform.common.model.ExitProfile;
import com.decisionplatform.common.model.GammaContext;
import com.decisionplatform.common.model.TradeRecommendation;

/**
 * Post-approval position sizing driven by the dealer-gamma regime.
 *
 * <h3>Formula</h3>
 * <pre>
 *   gammaMult = upstream multiplier if present and positive
 *             | regime multiplier (LONG 0.7, SHORT 1.2, NEUTRAL 0.8)
 *             | 1.0 without gamma context
 *   raw       = base × gammaMult × biasRisk × exposurePct × staleDiscount
 *   quantity  = max(1, min(maxPositionSize, floor(raw)))
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
public final class GammaPositionSizer {

    public static final String SOURCE_UPSTREAM = "UPSTREAM";
    public static final String SOURCE_REGIME   = "REGIME";
    public static final String SOURCE_DEFAULT  = "DEFAULT";

    private final double neutralThreshold;
    private final int baseQuantity;
    private final int maxPositionSize;

    public GammaPositionSizer(double neutralThreshold, int baseQuantity, int maxPositionSize) {
        this.neutralThreshold = neutralThreshold;
        this.baseQuantity = baseQuantity;
        this.maxPositionSize = maxPositionSize;
    }

    public SizingDecision size(GammaContext gamma, SizingFactors factors) {
        GammaRegime regime = null;
        double multiplier = 1.0;
        String source = SOURCE_DEFAULT;
        ExitProfile exitProfile = ExitProfile.MEAN_REVERT;

        if (gamma != null) {
            regime = GammaRegime.classify(gamma.netGamma(), neutralThreshold);
            exitProfile = regime.exitProfile();
            Double upstream = gamma.positionSizeMultiplier();
            if (upstream != null && upstream > 0 && Double.isFinite(upstream)) {
                multiplier = upstream;
                source = SOURCE_UPSTREAM;
            } else {
                multiplier = regime.sizeMultiplier();
                source = SOURCE_REGIME;
            }
        }

        SizingFactors f = factors == null ? SizingFactors.NEUTRAL : factors;
        double raw = baseQuantity * multiplier
            * positiveOr(f.biasRiskMultiplier(), 1.0)
            * positiveOr(f.exposurePct(), 1.0)
            * positiveOr(f.staleDiscount(), 1.0);
        int quantity = (int) Math.max(1, Math.min(maxPositionSize, Math.floor(raw)));

        return new SizingDecision(regime, multiplier, source, exitProfile, baseQuantity,
            f.biasRiskMultiplier(), f.exposurePct(), f.staleDiscount(), raw, quantity);
    }

    public TradeRecommendation apply(TradeRecommendation recommendation, SizingDecision decision) {
        return recommendation.withQuantity(decision.quantity(), decision.exitProfile());
    }

    private static double positiveOr(double value, double fallback) {
        return Double.isFinite(value) && value > 0 ? value : fallback;
    }
}
