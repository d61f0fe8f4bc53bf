package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregated Engine B verdict. A deterministic function of the ordered evaluator outputs.
 */
public record MetaDecision(
    @JsonProperty("decision") Verdict decision,
    @JsonProperty("finalConfidence") double finalConfidence,
    @JsonProperty("reasons") List<String> reasons,
    @JsonProperty("contributingAgents") List<EvaluatorType> contributingAgents,
    @JsonProperty("approvalScore") double approvalScore,
    @JsonProperty("rejectionScore") double rejectionScore
) {
    public MetaDecision {
        finalConfidence = Math.max(0.0, Math.min(1.0, finalConfidence));
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        contributingAgents = contributingAgents == null ? List.of() : List.copyOf(contributingAgents);
    }

    public boolean approved() {
        return decision == Verdict.APPROVE;
    }
}
