package com.decisionplatform.analysis.engine;

import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MetaDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Engine B intermediate state: activation set, per-evaluator outputs, meta-decision. */
public record ConsensusTrace(
    @JsonProperty("activated") List<EvaluatorType> activated,
    @JsonProperty("outputs") List<EvaluatorOutput> outputs,
    @JsonProperty("meta") MetaDecision meta
) {
    public ConsensusTrace {
        activated = List.copyOf(activated);
        outputs = List.copyOf(outputs);
    }
}
