package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One append-only audit record: the verdict of a single stage for a single signal.
 */
public record DecisionAudit(
    @JsonProperty("signalId") String signalId,
    @JsonProperty("stage") AuditStage stage,
    @JsonProperty("payload") Object payload
) {
    public DecisionAudit {
        Objects.requireNonNull(signalId, "signalId");
        Objects.requireNonNull(stage, "stage");
    }
}
