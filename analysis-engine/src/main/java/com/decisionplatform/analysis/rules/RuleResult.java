package com.decisionplatform.analysis.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RuleResult(
    @JsonProperty("tier") int tier,
    @JsonProperty("rule") String rule,
    @JsonProperty("message") String message
) {}
