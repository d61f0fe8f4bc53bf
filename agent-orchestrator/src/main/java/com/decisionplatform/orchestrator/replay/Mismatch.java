package com.decisionplatform.orchestrator.replay;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One divergence between run {@code runIndex} and run 0.
 *
 * @param field  JSON leaf path inside the signal snapshot, e.g. {@code engineB.outputs[2].confidence}
 */
public record Mismatch(
    @JsonProperty("runIndex") int runIndex,
    @JsonProperty("signalId") String signalId,
    @JsonProperty("field") String field,
    @JsonProperty("expected") String expected,
    @JsonProperty("actual") String actual
) {
    @Override
    public String toString() {
        return "run=" + runIndex + " signalId=" + signalId + " field=" + field
            + " expected=" + expected + " actual=" + actual;
    }
}
