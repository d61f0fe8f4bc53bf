package com.decisionplatform.orchestrator.replay;

import com.decisionplatform.common.exception.DeterminismViolationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param signalsCompared  number of (run, signal) pairs compared against run 0
 */
public record HarnessReport(
    @JsonProperty("passed") boolean passed,
    @JsonProperty("runs") int runs,
    @JsonProperty("signalsCompared") int signalsCompared,
    @JsonProperty("mismatches") List<Mismatch> mismatches
) {
    private static final int MAX_REPORTED = 10;

    public HarnessReport {
        mismatches = List.copyOf(mismatches);
    }

    /** Throws {@link DeterminismViolationException} listing the first mismatches when not passed. */
    public void assertPassed() {
        if (passed) {
            return;
        }
        String detail = mismatches.stream()
            .limit(MAX_REPORTED)
            .map(Mismatch::toString)
            .collect(Collectors.joining("; "));
        throw new DeterminismViolationException(mismatches.size() + " mismatch(es) across " + runs
            + " runs: " + detail);
    }
}
