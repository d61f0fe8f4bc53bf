package com.decisionplatform.orchestrator.pipeline;

import com.decisionplatform.common.config.ExecutionMode;
import com.decisionplatform.common.model.EngineVariant;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decides whether a recommendation from a given engine is executed or only shadowed.
 */
public class ExecutionPolicy {

    private final ExecutionMode mode;

    public ExecutionPolicy(ExecutionMode mode) {
        this.mode = mode;
    }

    public ExecutionMode mode() {
        return mode;
    }

    public Verdict evaluate(EngineVariant engine) {
        return new Verdict(mode, engine, !mode.executes(engine));
    }

    /** Audited result of the policy check. */
    public record Verdict(
        @JsonProperty("mode") ExecutionMode mode,
        @JsonProperty("engine") EngineVariant engine,
        @JsonProperty("shadow") boolean shadow
    ) {}
}
