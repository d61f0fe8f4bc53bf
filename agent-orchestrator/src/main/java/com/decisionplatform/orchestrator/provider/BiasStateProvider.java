package com.decisionplatform.orchestrator.provider;

import com.decisionplatform.common.model.UnifiedBiasState;
import reactor.core.publisher.Mono;

public interface BiasStateProvider {

    /** Latest multi-timeframe bias for {@code symbol}; empty when none has been computed. */
    Mono<UnifiedBiasState> biasState(String symbol);
}
