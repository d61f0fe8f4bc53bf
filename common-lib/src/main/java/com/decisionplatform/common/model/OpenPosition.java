package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OpenPosition(
    @JsonProperty("positionId") String positionId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("optionType") OptionType optionType,
    @JsonProperty("quantity") int quantity,
    @JsonProperty("entryPrice") double entryPrice
) {
    public OpenPosition {
        symbol = symbol == null ? null : symbol.toUpperCase();
    }

    /** Signed directional exposure: calls positive, puts negative. */
    public int directionalSign() {
        return optionType == OptionType.CALL ? quantity : -quantity;
    }
}
