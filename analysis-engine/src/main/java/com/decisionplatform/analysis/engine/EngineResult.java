package com.decisionplatform.analysis.engine;

import com.decisionplatform.analysis.rules.EntryDecision;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.TradeRecommendation;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one engine invocation. Exactly one of {@code entryDecision} (Engine A) and
 * {@code consensus} (Engine B) is set. {@code recommendation} is non-null iff approved.
 */
public record EngineResult(
    @JsonProperty("engine") EngineVariant engine,
    @JsonProperty("approved") boolean approved,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasons") List<String> reasons,
    @JsonProperty("entryDecision") EntryDecision entryDecision,
    @JsonProperty("consensus") ConsensusTrace consensus,
    @JsonProperty("recommendation") TradeRecommendation recommendation
) {
    public EngineResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        if (approved != (recommendation != null)) {
            throw new IllegalArgumentException("recommendation must be present iff approved");
        }
    }
}
