package com.decisionplatform.analysis.agent;

import com.decisionplatform.analysis.indicator.TechnicalIndicators;
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
 * Volatility-squeeze specialist (Bollinger inside Keltner). A squeeze that fired on the latest
 * candle is the strongest read; momentum is the latest close against its 20-period SMA.
 */
@Component
public class MomentumSqueezeEvaluator implements SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MomentumSqueezeEvaluator.class);

    private static final int PERIOD = ActivationRules.SQUEEZE_PERIOD;

    @Override
    public EvaluatorType type() { return EvaluatorType.MOMENTUM_SQUEEZE; }

    @Override
    public boolean shouldActivate(Signal signal, MarketContext context) {
        return ActivationRules.hasSqueezeInputs(context);
    }

    @Override
    public EvaluatorOutput analyze(Signal signal, MarketContext context) {
        log.debug("[SqueezeEvaluator] Analyzing signalId={} symbol={}", signal.signalId(), signal.symbol());

        List<Candle> candles = context.candles();
        int n = candles.size();
        boolean on = TechnicalIndicators.squeezeOn(candles, n, PERIOD);
        boolean wasOn = n > PERIOD && TechnicalIndicators.squeezeOn(candles, n - 1, PERIOD);
        boolean fired = wasOn && !on;

        List<Double> closes = context.closes();
        double sma = TechnicalIndicators.sma(closes, PERIOD);
        int momentum = Integer.signum(Double.compare(closes.get(n - 1), sma));

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("squeezeOn", on);
        metadata.put("squeezeFired", fired);
        metadata.put("momentum", momentum);

        Recommendation rec = EvaluatorSupport.relativeTo(momentum, signal.direction());
        if (fired) {
            return switch (rec) {
                case APPROVE -> EvaluatorOutput.of(type(), rec, 0.8, "squeeze fired with momentum", metadata);
                case REJECT  -> EvaluatorOutput.of(type(), rec, 0.7, "squeeze fired against trade", metadata);
                case HOLD    -> EvaluatorOutput.of(type(), rec, 0.45, "squeeze fired without momentum", metadata);
            };
        }
        if (on) {
            return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.5, "squeeze building", metadata);
        }
        if (rec == Recommendation.APPROVE) {
            return EvaluatorOutput.of(type(), rec, 0.55, "momentum aligned, no squeeze", metadata);
        }
        return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.45, "no squeeze, momentum not aligned", metadata);
    }
}
