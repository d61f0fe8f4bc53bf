package com.decisionplatform.analysis.agent;

import com.decisionplatform.analysis.indicator.TechnicalIndicators;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.Recommendation;
import com.decisionplatform.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Core trend evaluator. Three votes, each +1 bullish / −1 bearish:
 * <ol>
 *   <li>price vs EMA21</li>
 *   <li>EMA8 vs EMA21</li>
 *   <li>EMA stack (8/13/21) ordering, 0 when mixed</li>
 * </ol>
 * The score is read relative to the signal direction. An RSI extreme in the trade's
 * direction downgrades an approval to HOLD (overextended). Always active.
 */
@Component
public class TechnicalEvaluator implements SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TechnicalEvaluator.class);

    private static final double OVEREXTENDED_HIGH = 75;
    private static final double OVEREXTENDED_LOW  = 25;

    @Override
    public EvaluatorType type() { return EvaluatorType.TECHNICAL; }

    @Override
    public boolean shouldActivate(Signal signal, MarketContext context) {
        return true;
    }

    @Override
    public EvaluatorOutput analyze(Signal signal, MarketContext context) {
        log.debug("[TechnicalEvaluator] Analyzing signalId={} symbol={}", signal.signalId(), signal.symbol());

        double price = context.currentPrice();
        double ema8  = EvaluatorSupport.indicatorOrEma(context, 8, MarketContext.EMA_8);
        double ema13 = EvaluatorSupport.indicatorOrEma(context, 13, MarketContext.EMA_13);
        double ema21 = EvaluatorSupport.indicatorOrEma(context, 21, MarketContext.EMA_21);
        List<Double> closes = context.closes();
        double rsi = TechnicalIndicators.rsi(closes, 14);
        String stack = TechnicalIndicators.emaStack(ema8, ema13, ema21);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("ema8", EvaluatorSupport.orNa(ema8));
        metadata.put("ema21", EvaluatorSupport.orNa(ema21));
        metadata.put("emaStack", stack);
        metadata.put("rsi", EvaluatorSupport.orNa(rsi));
        metadata.put("rsiSignal", TechnicalIndicators.rsiSignal(rsi));

        if (Double.isNaN(ema8) || Double.isNaN(ema21)) {
            return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.4, "insufficient technical data", metadata);
        }

        int score = Integer.signum(Double.compare(price, ema21))
                  + Integer.signum(Double.compare(ema8, ema21))
                  + ("BULLISH".equals(stack) ? 1 : "BEARISH".equals(stack) ? -1 : 0);
        int directional = score * signal.direction().sign();
        metadata.put("trendScore", score);

        String summary = String.format(Locale.ROOT, "trend score %d | price=%.2f ema8=%.2f ema21=%.2f stack=%s",
            score, price, ema8, ema21, stack);

        if (directional >= 2) {
            if (overextended(signal.direction(), rsi)) {
                return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.55,
                    "overextended, RSI=" + EvaluatorSupport.fmt(rsi) + " | " + summary, metadata);
            }
            return EvaluatorOutput.of(type(), Recommendation.APPROVE, 0.55 + 0.1 * directional, summary, metadata);
        }
        if (directional <= -2) {
            return EvaluatorOutput.of(type(), Recommendation.REJECT, 0.55 + 0.1 * -directional, summary, metadata);
        }
        return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.5, "mixed trend | " + summary, metadata);
    }

    private static boolean overextended(Direction direction, double rsi) {
        if (Double.isNaN(rsi)) return false;
        return direction == Direction.LONG ? rsi > OVEREXTENDED_HIGH : rsi < OVEREXTENDED_LOW;
    }
}
