package com.decisionplatform.orchestrator.pipeline;

import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.OpenPosition;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.UnifiedBiasState;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Everything one pipeline run needs. {@code positions} is deferred so the gating layer reads
 * it only after the cheap checks pass; the replay harness supplies a frozen {@code Mono.just}.
 *
 * @param bias  {@code null} when the bias read failed or returned nothing
 */
public record DecisionRequest(Signal signal, MarketContext context, UnifiedBiasState bias,
                              Mono<List<OpenPosition>> positions) {

    public DecisionRequest {
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(positions, "positions");
    }
}
