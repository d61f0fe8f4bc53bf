package com.decisionplatform.analysis.rules;

import com.decisionplatform.analysis.engine.DecisionInput;
import com.decisionplatform.analysis.indicator.TechnicalIndicators;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.MarketContext;

/**
 * Three-factor entry confluence: EMA stack aligned with the direction, price on the
 * direction's side of EMA21, bias aligned with the direction.
 */
public final class Confluence {

    public static final int FACTORS = 3;

    private Confluence() {}

    public static int count(DecisionInput input) {
        MarketContext ctx = input.context();
        Direction direction = input.signal().direction();
        double ema8  = indicator(ctx, 8, MarketContext.EMA_8);
        double ema13 = indicator(ctx, 13, MarketContext.EMA_13);
        double ema21 = indicator(ctx, 21, MarketContext.EMA_21);

        int count = 0;
        String stack = TechnicalIndicators.emaStack(ema8, ema13, ema21);
        if ((direction == Direction.LONG && "BULLISH".equals(stack))
            || (direction == Direction.SHORT && "BEARISH".equals(stack))) {
            count++;
        }
        if (!Double.isNaN(ema21) && (ctx.currentPrice() - ema21) * direction.sign() > 0) {
            count++;
        }
        if (input.bias().bias().alignsWith(direction)) {
            count++;
        }
        return count;
    }

    public static double ratio(DecisionInput input) {
        return (double) count(input) / FACTORS;
    }

    /** Provider indicator series first; candle-derived EMA when the provider sent none. */
    private static double indicator(MarketContext ctx, int period, String name) {
        double provided = ctx.latest(name);
        return Double.isNaN(provided) ? TechnicalIndicators.ema(ctx.closes(), period) : provided;
    }
}
