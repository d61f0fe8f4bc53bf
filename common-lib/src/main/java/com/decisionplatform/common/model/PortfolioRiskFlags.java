package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PortfolioRiskFlags(
    @JsonProperty("positionLimitExceeded") boolean positionLimitExceeded,
    @JsonProperty("exposureExceeded") boolean exposureExceeded
) {
    public static final PortfolioRiskFlags CLEAR = new PortfolioRiskFlags(false, false);

    public boolean anyExceeded() {
        return positionLimitExceeded || exposureExceeded;
    }
}
