package com.decisionplatform.analysis.agent;

import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.Signal;

/**
 * One Engine B evaluator. Implementations are stateless and side-effect free, and never read
 * another evaluator's output, so activated evaluators may run concurrently in any order.
 */
public interface SignalEvaluator {

    EvaluatorType type();

    boolean shouldActivate(Signal signal, MarketContext context);

    EvaluatorOutput analyze(Signal signal, MarketContext context);
}
