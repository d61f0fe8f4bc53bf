package com.decisionplatform.analysis.agent;

import com.decisionplatform.analysis.indicator.TechnicalIndicators;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.Recommendation;

import java.util.Locale;

final class EvaluatorSupport {

    private EvaluatorSupport() {}

    /** +1 for bullish labels, −1 for bearish labels, 0 otherwise. */
    static int labelSign(String label) {
        if (label == null) return 0;
        String upper = label.toUpperCase();
        if (upper.contains("BULL")) return 1;
        if (upper.contains("BEAR")) return -1;
        return 0;
    }

    /** Maps a directional read (+1/0/−1) onto a recommendation for the signal's direction. */
    static Recommendation relativeTo(int sign, Direction direction) {
        int aligned = Integer.signum(sign) * direction.sign();
        if (aligned > 0) return Recommendation.APPROVE;
        if (aligned < 0) return Recommendation.REJECT;
        return Recommendation.HOLD;
    }

    /** Provider indicator series first; candle-derived EMA when the provider sent none. */
    static double indicatorOrEma(MarketContext ctx, int period, String indicator) {
        double provided = ctx.latest(indicator);
        return Double.isNaN(provided) ? TechnicalIndicators.ema(ctx.closes(), period) : provided;
    }

    static Object orNa(double value) {
        return Double.isNaN(value) ? "N/A" : value;
    }

    static String fmt(double value) {
        return Double.isNaN(value) ? "N/A" : String.format(Locale.ROOT, "%.2f", value);
    }
}
