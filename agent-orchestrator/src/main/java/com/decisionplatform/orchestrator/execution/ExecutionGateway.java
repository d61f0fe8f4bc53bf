package com.decisionplatform.orchestrator.execution;

import com.decisionplatform.common.model.TradeRecommendation;

/** Outbound port for non-shadow recommendations. Fire-and-forget; failures are logged, not propagated. */
public interface ExecutionGateway {

    void submit(TradeRecommendation recommendation);
}
