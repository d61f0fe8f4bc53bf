package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of one activated evaluator for one signal. Confidence is clamped to [0,1] and
 * metadata is copied into a sorted map so serialized outputs are stable across runs.
 */
public record EvaluatorOutput(
    @JsonProperty("agentType") EvaluatorType agentType,
    @JsonProperty("recommendation") Recommendation recommendation,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public EvaluatorOutput {
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    public static EvaluatorOutput of(EvaluatorType agentType, Recommendation recommendation,
                                     double confidence, String reasoning, Map<String, Object> metadata) {
        return new EvaluatorOutput(agentType, recommendation, confidence, reasoning, metadata);
    }

    public static EvaluatorOutput of(EvaluatorType agentType, Recommendation recommendation,
                                     double confidence, String reasoning) {
        return new EvaluatorOutput(agentType, recommendation, confidence, reasoning, Map.of());
    }
}
