package com.decisionplatform.analysis.engine;

import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.UnifiedBiasState;

import java.util.Objects;

/**
 * Frozen inputs of one engine invocation. The bias state is the one admitted by gating
 * (a neutral placeholder when bias is not required and none exists).
 */
public record DecisionInput(Signal signal, MarketContext context, UnifiedBiasState bias) {

    public DecisionInput {
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(bias, "bias");
    }
}
