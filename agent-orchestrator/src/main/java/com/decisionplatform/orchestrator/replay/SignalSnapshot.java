package com.decisionplatform.orchestrator.replay;

import com.decisionplatform.analysis.engine.ConsensusTrace;
import com.decisionplatform.analysis.rules.EntryDecision;
import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.TradeRecommendation;
import com.decisionplatform.common.sizing.SizingDecision;
import com.decisionplatform.orchestrator.gate.GateStatus;
import com.decisionplatform.orchestrator.pipeline.TerminalStage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Everything the harness compares for one signal in one run. */
public record SignalSnapshot(
    @JsonProperty("signalId") String signalId,
    @JsonProperty("variant") EngineVariant variant,
    @JsonProperty("terminalStage") TerminalStage terminalStage,
    @JsonProperty("gateStatus") GateStatus gateStatus,
    @JsonProperty("gateReasons") List<String> gateReasons,
    @JsonProperty("engineA") EntryDecision engineA,
    @JsonProperty("engineB") ConsensusTrace engineB,
    @JsonProperty("sizing") SizingDecision sizing,
    @JsonProperty("recommendation") TradeRecommendation recommendation,
    @JsonProperty("reasons") List<String> reasons,
    @JsonProperty("auditStages") List<AuditStage> auditStages
) {}
