package com.decisionplatform.orchestrator.replay;

import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.OpenPosition;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.UnifiedBiasState;
import com.decisionplatform.orchestrator.pipeline.DecisionRequest;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One frozen pipeline input.
 *
 * @param bias  {@code null} models a missing bias state
 */
public record SyntheticInput(Signal signal, MarketContext context, UnifiedBiasState bias,
                             List<OpenPosition> openPositions) {

    public SyntheticInput {
        openPositions = List.copyOf(openPositions);
    }

    public DecisionRequest toRequest() {
        return new DecisionRequest(signal, context, bias, Mono.just(openPositions));
    }
}
