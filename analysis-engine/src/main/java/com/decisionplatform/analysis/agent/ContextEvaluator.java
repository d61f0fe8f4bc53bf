package com.decisionplatform.analysis.agent;

import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.MarketIntel;
import com.decisionplatform.common.model.Recommendation;
import com.decisionplatform.common.model.SessionContext;
import com.decisionplatform.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Core evaluator for the trading environment: session state, context quality and the
 * market-intel regime label relative to the signal direction. Always active.
 */
@Component
public class ContextEvaluator implements SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ContextEvaluator.class);

    private static final double THIN_LIQUIDITY_PENALTY = 0.1;

    @Override
    public EvaluatorType type() { return EvaluatorType.CONTEXT; }

    @Override
    public boolean shouldActivate(Signal signal, MarketContext context) {
        return true;
    }

    @Override
    public EvaluatorOutput analyze(Signal signal, MarketContext context) {
        log.debug("[ContextEvaluator] Analyzing signalId={} symbol={}", signal.signalId(), signal.symbol());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("degraded", context.degraded());

        if (context.degraded()) {
            return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.5,
                "market context degraded to price-anchored fallback", metadata);
        }

        SessionContext session = context.sessionContext();
        metadata.put("session", session == null ? "UNKNOWN" : session.sessionType().name());
        if (session == null || !session.isRegularHours()) {
            return EvaluatorOutput.of(type(), Recommendation.HOLD, 0.6,
                "outside regular trading session", metadata);
        }

        Optional<MarketIntel> intel = context.intel();
        if (intel.isEmpty()) {
            return EvaluatorOutput.of(type(), Recommendation.APPROVE, 0.6,
                "regular session, no regime intel", metadata);
        }

        MarketIntel mi = intel.get();
        metadata.put("regime", mi.regime());
        metadata.put("liquidityState", mi.liquidityState());
        double penalty = "THIN".equalsIgnoreCase(mi.liquidityState()) ? THIN_LIQUIDITY_PENALTY : 0.0;

        Recommendation rec = EvaluatorSupport.relativeTo(EvaluatorSupport.labelSign(mi.regime()), signal.direction());
        return switch (rec) {
            case APPROVE -> EvaluatorOutput.of(type(), rec, 0.75 - penalty,
                "regime " + mi.regime() + " supports " + signal.direction().value(), metadata);
            case REJECT -> EvaluatorOutput.of(type(), rec, 0.65,
                "regime " + mi.regime() + " opposes " + signal.direction().value(), metadata);
            case HOLD -> EvaluatorOutput.of(type(), Recommendation.APPROVE, 0.6 - penalty,
                "regime " + mi.regime() + " neutral", metadata);
        };
    }
}
