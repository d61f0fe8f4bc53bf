package com.decisionplatform.analysis.agent;

import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.GammaContext;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.OptionType;
import com.decisionplatform.common.model.OptionsFlow;
import com.decisionplatform.common.model.Recommendation;
import com.decisionplatform.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dealer positioning specialist. Net gamma sign and call/put volume skew each vote ±1;
 * confidence grows with the absolute score. Activates when gamma or options flow is present.
 */
@Component
public class GammaFlowEvaluator implements SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GammaFlowEvaluator.class);

    @Override
    public EvaluatorType type() { return EvaluatorType.GAMMA_FLOW; }

    @Override
    public boolean shouldActivate(Signal signal, MarketContext context) {
        return ActivationRules.hasGammaOrFlow(context);
    }

    @Override
    public EvaluatorOutput analyze(Signal signal, MarketContext context) {
        log.debug("[GammaFlowEvaluator] Analyzing signalId={} symbol={}", signal.signalId(), signal.symbol());

        List<String> notes = new ArrayList<>();
        Map<String, Object> metadata = new HashMap<>();
        int score = 0;

        GammaContext gamma = context.gamma().orElse(null);
        if (gamma != null) {
            metadata.put("netGamma", gamma.netGamma());
            if (gamma.netGamma() > 0) {
                score += 1;
                notes.add("net gamma positive");
            } else if (gamma.netGamma() < 0) {
                score -= 1;
                notes.add("net gamma negative");
            } else {
                notes.add("net gamma flat");
            }
        } else {
            notes.add("gamma unavailable");
        }

        OptionsFlow flow = context.flow().orElse(null);
        if (flow != null && !flow.entries().isEmpty()) {
            long calls = flow.volume(OptionType.CALL);
            long puts  = flow.volume(OptionType.PUT);
            metadata.put("callVolume", calls);
            metadata.put("putVolume", puts);
            if (calls > puts) {
                score += 1;
                notes.add("flow skewed to calls");
            } else if (puts > calls) {
                score -= 1;
                notes.add("flow skewed to puts");
            } else {
                notes.add("flow balanced");
            }
        } else {
            notes.add("options flow unavailable");
        }

        metadata.put("score", score);
        double confidence = Math.min(0.9, 0.45 + Math.abs(score) * 0.2);
        Recommendation rec = EvaluatorSupport.relativeTo(score, signal.direction());
        return EvaluatorOutput.of(type(), rec, rec == Recommendation.HOLD ? 0.45 : confidence,
            String.join("; ", notes), metadata);
    }
}
