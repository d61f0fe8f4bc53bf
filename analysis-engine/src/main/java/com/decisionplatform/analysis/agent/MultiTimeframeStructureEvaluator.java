package com.decisionplatform.analysis.agent;

import com.decisionplatform.common.model.Candle;
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
import java.util.Map;

/**
 * Candle-structure specialist. Classifies the last three candles as inside (1), directional (2)
 * or outside (3) bars and looks for the 2-1-2, 3-1-2 and 3-2-2 continuation setups.
 *
 * <p>After an inside bar the trigger is the current price leaving the inside bar's range; a
 * 3-2-2 takes the direction of the last directional bar. When at least
 * {@value #HTF_LOOKBACK} + 1 candles exist, agreement with the higher-timeframe drift
 * (latest close vs the close {@value #HTF_LOOKBACK} candles earlier) adds confidence.
 */
@Component
public class MultiTimeframeStructureEvaluator implements SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MultiTimeframeStructureEvaluator.class);

    static final int HTF_LOOKBACK = 12;

    @Override
    public EvaluatorType type() { return EvaluatorType.MULTI_TIMEFRAME_STRUCTURE; }

    @Override
    public boolean shouldActivate(Signal signal, MarketContext context) {
        return ActivationRules.hasStructure(context);
    }

    @Override
    public EvaluatorOutput analyze(Signal signal, MarketContext context) {
        log.debug("[StructureEvaluator] Analyzing signalId={} symbol={}", signal.signalId(), signal.symbol());

        List<Candle> candles = context.candles();
        Candle first  = candles.get(candles.size() - 3);
        Candle second = candles.get(candles.size() - 2);
        Candle last   = candles.get(candles.size() - 1);
        int t1 = classify(first, second);
        int t2 = classify(second, last);

        String pattern = "none";
        if (t1 == 2 && t2 == 1) pattern = "2-1-2";
        if (t1 == 3 && t2 == 1) pattern = "3-1-2";
        if (t1 == 3 && t2 == 2) pattern = "3-2-2";

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("pattern", pattern);
        metadata.put("candleSequence", List.of(t1, t2));

        if ("none".equals(pattern)) {
            return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.25, "no structure pattern", metadata);
        }

        int direction;
        if (t2 == 1) {
            double price = context.currentPrice();
            direction = price > last.high() ? 1 : price < last.low() ? -1 : 0;
        } else {
            direction = last.high() > second.high() ? 1 : -1;
        }
        metadata.put("patternDirection", direction);

        if (direction == 0) {
            return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.5,
                pattern + " pending trigger", metadata);
        }

        int htf = higherTimeframeDrift(candles);
        metadata.put("htfDrift", htf);
        double confidence = 0.7 + (htf == direction ? 0.1 : 0.0);

        Recommendation rec = EvaluatorSupport.relativeTo(direction, signal.direction());
        String reasoning = pattern + (direction > 0 ? " triggered up" : " triggered down")
            + (htf == direction ? ", higher timeframe agrees" : "");
        return EvaluatorOutput.of(type(), rec, confidence, reasoning, metadata);
    }

    static int classify(Candle prev, Candle curr) {
        if (curr.high() <= prev.high() && curr.low() >= prev.low()) return 1;
        if (curr.high() > prev.high() && curr.low() < prev.low()) return 3;
        return 2;
    }

    private static int higherTimeframeDrift(List<Candle> candles) {
        if (candles.size() <= HTF_LOOKBACK) return 0;
        double latest = candles.get(candles.size() - 1).close();
        double earlier = candles.get(candles.size() - 1 - HTF_LOOKBACK).close();
        return Integer.signum(Double.compare(latest, earlier));
    }
}
