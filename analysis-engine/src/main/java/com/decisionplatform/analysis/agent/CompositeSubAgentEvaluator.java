package com.decisionplatform.analysis.agent;

import com.decisionplatform.common.model.Candle;
import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.OptionType;
import com.decisionplatform.common.model.Recommendation;
import com.decisionplatform.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sub-agent blending cheap reads of the specialist inputs (dealer positioning, short-term
 * structure, momentum) into one vote. Active when at least two specialist data sets are present.
 * Sub-agents carry no veto: this evaluator approves or holds, never rejects.
 */
@Component
public class CompositeSubAgentEvaluator implements SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(CompositeSubAgentEvaluator.class);

    static final int MIN_SPECIALIST_INPUTS = 2;

    @Override
    public EvaluatorType type() { return EvaluatorType.COMPOSITE_SUB_AGENT; }

    @Override
    public boolean shouldActivate(Signal signal, MarketContext context) {
        return ActivationRules.specialistInputs(signal, context) >= MIN_SPECIALIST_INPUTS;
    }

    @Override
    public EvaluatorOutput analyze(Signal signal, MarketContext context) {
        log.debug("[CompositeSubAgent] Analyzing signalId={} symbol={}", signal.signalId(), signal.symbol());

        int dir = signal.direction().sign();
        int aligned = 0;
        int opposed = 0;

        int positioning = positioningSign(context);
        int structure = structureSign(context.candles());
        int momentum = momentumSign(context);
        for (int vote : new int[] {positioning, structure, momentum}) {
            if (vote * dir > 0) aligned++;
            else if (vote * dir < 0) opposed++;
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("positioning", positioning);
        metadata.put("structure", structure);
        metadata.put("momentum", momentum);
        metadata.put("aligned", aligned);
        metadata.put("opposed", opposed);

        if (aligned > opposed) {
            return EvaluatorOutput.of(type(), Recommendation.APPROVE, 0.5 + 0.1 * (aligned - opposed),
                aligned + " of 3 composite reads aligned", metadata);
        }
        return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.4,
            "composite reads not aligned (" + aligned + " for, " + opposed + " against)", metadata);
    }

    private static int positioningSign(MarketContext context) {
        int sign = context.gamma().map(g -> (int) Math.signum(g.netGamma())).orElse(0);
        if (sign != 0) return sign;
        return context.flow()
            .map(f -> Long.signum(f.volume(OptionType.CALL) - f.volume(OptionType.PUT)))
            .orElse(0);
    }

    private static int structureSign(List<Candle> candles) {
        if (candles.size() < 2) return 0;
        Candle prev = candles.get(candles.size() - 2);
        Candle last = candles.get(candles.size() - 1);
        return Integer.signum(Double.compare(last.close(), prev.close()));
    }

    private static int momentumSign(MarketContext context) {
        double ema8 = EvaluatorSupport.indicatorOrEma(context, 8, MarketContext.EMA_8);
        if (Double.isNaN(ema8)) return 0;
        return Integer.signum(Double.compare(context.currentPrice(), ema8));
    }
}
