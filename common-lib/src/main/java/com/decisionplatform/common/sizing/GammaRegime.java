package com.decisionplatform.common.sizing;

import com.decisionplatform.common.model.ExitProfile;

/**
 * Dealer-gamma regime with its default size multiplier and exit profile.
 * Long gamma dampens moves (smaller size, mean-revert exits); short gamma amplifies them.
 */
public enum GammaRegime {
    LONG_GAMMA(0.7, ExitProfile.MEAN_REVERT),
    SHORT_GAMMA(1.2, ExitProfile.TREND),
    NEUTRAL(0.8, ExitProfile.MEAN_REVERT);

    private final double sizeMultiplier;
    private final ExitProfile exitProfile;

    GammaRegime(double sizeMultiplier, ExitProfile exitProfile) {
        this.sizeMultiplier = sizeMultiplier;
        this.exitProfile = exitProfile;
    }

    public double sizeMultiplier() {
        return sizeMultiplier;
    }

    public ExitProfile exitProfile() {
        return exitProfile;
    }

    public static GammaRegime classify(double netGamma, double neutralThreshold) {
        if (Math.abs(netGamma) < neutralThreshold) {
            return NEUTRAL;
        }
        return netGamma > 0 ? LONG_GAMMA : SHORT_GAMMA;
    }
}
