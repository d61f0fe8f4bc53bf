package com.decisionplatform.orchestrator.pipeline;

import com.decisionplatform.analysis.engine.EngineResult;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.TradeRecommendation;
import com.decisionplatform.common.sizing.SizingDecision;
import com.decisionplatform.orchestrator.gate.GateDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final state of one signal. Fields past {@code terminalStage} are {@code null} when the
 * run stopped before producing them.
 */
public record PipelineOutcome(
    @JsonProperty("signalId") String signalId,
    @JsonProperty("variant") EngineVariant variant,
    @JsonProperty("terminalStage") TerminalStage terminalStage,
    @JsonProperty("gate") GateDecision gate,
    @JsonProperty("engineResult") EngineResult engineResult,
    @JsonProperty("sizing") SizingDecision sizing,
    @JsonProperty("recommendation") TradeRecommendation recommendation,
    @JsonProperty("reasons") List<String> reasons
) {
    public static final String DUPLICATE_REASON      = "duplicate_signal";
    public static final String NO_PRICE_REASON       = "no_price";
    public static final String PIPELINE_FAULT_REASON = "pipeline_fault";

    public PipelineOutcome {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static PipelineOutcome duplicate(String signalId) {
        return new PipelineOutcome(signalId, null, TerminalStage.DUPLICATE, null, null, null, null,
            List.of(DUPLICATE_REASON));
    }

    public static PipelineOutcome noPrice(String signalId) {
        return new PipelineOutcome(signalId, null, TerminalStage.NO_PRICE, null, null, null, null,
            List.of(NO_PRICE_REASON));
    }

    public static PipelineOutcome pipelineFault(String signalId) {
        return new PipelineOutcome(signalId, null, TerminalStage.PIPELINE_FAULT, null, null, null, null,
            List.of(PIPELINE_FAULT_REASON));
    }

    static PipelineOutcome gated(String signalId, GateDecision gate) {
        return new PipelineOutcome(signalId, null, TerminalStage.GATED, gate, null, null, null, gate.reasons());
    }
}
