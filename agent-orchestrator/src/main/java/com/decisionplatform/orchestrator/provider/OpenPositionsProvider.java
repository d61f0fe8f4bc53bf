package com.decisionplatform.orchestrator.provider;

import com.decisionplatform.common.model.OpenPosition;
import reactor.core.publisher.Mono;

import java.util.List;

public interface OpenPositionsProvider {

    /** One snapshot of every open position; an empty list when flat. */
    Mono<List<OpenPosition>> openPositions();
}
