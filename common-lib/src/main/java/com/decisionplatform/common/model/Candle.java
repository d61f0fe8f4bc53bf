package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Candle(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") long volume
) {}
