package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Inbound trade opportunity candidate. Immutable once created by signal intake.
 *
 * <p>{@code experimentId} may be {@code null} when intake has not yet linked the
 * signal to an experiment; routing then keys on {@code signalId} alone.
 */
public record Signal(
    @JsonProperty("signalId") String signalId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("experimentId") String experimentId
) {
    public Signal {
        Objects.requireNonNull(signalId, "signalId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(timestamp, "timestamp");
        symbol = symbol.toUpperCase();
    }

    public static Signal of(String signalId, String symbol, Direction direction,
                            String timeframe, Instant timestamp, String experimentId) {
        return new Signal(signalId, symbol, direction, timeframe, timestamp, experimentId);
    }

    /** Experiment key used for routing and tagging recommendations. */
    public String experimentKey() {
        return experimentId != null && !experimentId.isBlank() ? experimentId : signalId;
    }
}
