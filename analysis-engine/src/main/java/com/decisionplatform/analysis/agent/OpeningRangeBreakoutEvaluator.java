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
 * Opening-range breakout specialist for index products. Active for SPY/QQQ/SPX during the
 * first 30 minutes of the regular session; the range is the first five candles after the open.
 */
@Component
public class OpeningRangeBreakoutEvaluator implements SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(OpeningRangeBreakoutEvaluator.class);

    @Override
    public EvaluatorType type() { return EvaluatorType.OPENING_RANGE_BREAKOUT; }

    @Override
    public boolean shouldActivate(Signal signal, MarketContext context) {
        return ActivationRules.inOpeningRangeWindow(signal, context);
    }

    @Override
    public EvaluatorOutput analyze(Signal signal, MarketContext context) {
        log.debug("[ORBEvaluator] Analyzing signalId={} symbol={}", signal.signalId(), signal.symbol());

        List<Candle> range = ActivationRules.openingRange(signal, context);
        double orbHigh = range.stream().mapToDouble(Candle::high).max().orElse(Double.NaN);
        double orbLow  = range.stream().mapToDouble(Candle::low).min().orElse(Double.NaN);
        double price = context.currentPrice();

        int breakout = 0;
        if (!Double.isNaN(orbHigh) && price > orbHigh) breakout = 1;
        else if (!Double.isNaN(orbLow) && price < orbLow) breakout = -1;

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("orbHigh", EvaluatorSupport.orNa(orbHigh));
        metadata.put("orbLow", EvaluatorSupport.orNa(orbLow));
        metadata.put("breakoutDirection", breakout > 0 ? "up" : breakout < 0 ? "down" : "none");

        Recommendation rec = EvaluatorSupport.relativeTo(breakout, signal.direction());
        return switch (rec) {
            case APPROVE -> EvaluatorOutput.of(type(), rec, 0.8, "breakout with trade direction", metadata);
            case REJECT  -> EvaluatorOutput.of(type(), rec, 0.8, "breakout against trade direction", metadata);
            case HOLD    -> EvaluatorOutput.of(type(), rec, 0.4, "price inside opening range", metadata);
        };
    }
}
