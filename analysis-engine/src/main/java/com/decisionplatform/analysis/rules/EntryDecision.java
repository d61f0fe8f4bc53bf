package com.decisionplatform.analysis.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Engine A verdict.
 *
 * @param tier            deciding tier: 1 (BLOCK), 2 (WAIT) or 3 (APPROVE)
 * @param triggeredRules  every triggered rule of the deciding tier, in rule order
 * @param rationale       messages of {@code triggeredRules}, in the same order
 */
public record EntryDecision(
    @JsonProperty("action") EntryAction action,
    @JsonProperty("tier") int tier,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("triggeredRules") List<String> triggeredRules,
    @JsonProperty("rationale") List<String> rationale
) {
    public EntryDecision {
        triggeredRules = triggeredRules == null ? List.of() : List.copyOf(triggeredRules);
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
    }
}
