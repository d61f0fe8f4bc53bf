package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExposureResult(
    @JsonProperty("result") ExposureDecision result,
    @JsonProperty("reasons") List<String> reasons,
    @JsonProperty("metrics") ExposureMetrics metrics
) {
    public ExposureResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public boolean blocked() {
        return result == ExposureDecision.BLOCK;
    }

    /** Fraction of normal new exposure the sizing stage may take; 0 when blocked. */
    public double allowedNewExposurePct() {
        if (blocked()) {
            return 0.0;
        }
        return metrics == null ? 1.0 : metrics.allowedNewExposurePct();
    }
}
