package com.decisionplatform.analysis.engine;

import com.decisionplatform.analysis.agent.SignalEvaluator;
import com.decisionplatform.analysis.contract.ContractSelector;
import com.decisionplatform.analysis.service.EvaluatorDispatchService;
import com.decisionplatform.common.audit.AuditSink;
import com.decisionplatform.common.consensus.ConsensusEngine;
import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MetaDecision;
import com.decisionplatform.common.model.TradeRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Engine B: activation → concurrent evaluation → meta-decision.
 *
 * <p>The activation set, the ordered evaluator outputs and the meta-decision are each written
 * to the audit sink before the engine returns, whatever the verdict. An evaluator failure
 * errors the whole invocation after the activation record.
 */
public class ConsensusDecisionEngine implements DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsensusDecisionEngine.class);

    private final EvaluatorDispatchService dispatchService;
    private final ConsensusEngine consensusEngine;
    private final ContractSelector contractSelector;
    private final AuditSink auditSink;

    public ConsensusDecisionEngine(EvaluatorDispatchService dispatchService, ConsensusEngine consensusEngine,
                                   ContractSelector contractSelector, AuditSink auditSink) {
        this.dispatchService = dispatchService;
        this.consensusEngine = consensusEngine;
        this.contractSelector = contractSelector;
        this.auditSink = auditSink;
    }

    @Override
    public EngineVariant variant() {
        return EngineVariant.B;
    }

    @Override
    public Mono<EngineResult> evaluate(DecisionInput input) {
        String signalId = input.signal().signalId();
        return Mono.defer(() -> {
            List<SignalEvaluator> activated = dispatchService.activate(input.signal(), input.context());
            List<EvaluatorType> activatedTypes = activated.stream().map(SignalEvaluator::type).toList();
            auditSink.record(AuditStage.ENGINE_B_ACTIVATION, signalId, activatedTypes);

            return dispatchService.dispatchAll(activated, input.signal(), input.context())
                .map(outputs -> aggregate(input, activatedTypes, outputs));
        });
    }

    private EngineResult aggregate(DecisionInput input, List<EvaluatorType> activated,
                                   List<EvaluatorOutput> outputs) {
        String signalId = input.signal().signalId();
        auditSink.record(AuditStage.ENGINE_B_EVALUATION, signalId, outputs);

        MetaDecision meta = consensusEngine.compute(outputs);
        auditSink.record(AuditStage.ENGINE_B_META, signalId, meta);
        log.info("[EngineB] signalId={} activated={} decision={} confidence={} approval={} rejection={}",
            signalId, activated, meta.decision(), meta.finalConfidence(),
            meta.approvalScore(), meta.rejectionScore());

        ConsensusTrace trace = new ConsensusTrace(activated, outputs, meta);
        if (!meta.approved()) {
            return new EngineResult(EngineVariant.B, false, meta.finalConfidence(), meta.reasons(),
                null, trace, null);
        }
        TradeRecommendation rec = Recommendations.build(EngineVariant.B, input.signal(),
            contractSelector.select(input.signal(), input.context()));
        return new EngineResult(EngineVariant.B, true, meta.finalConfidence(), meta.reasons(),
            null, trace, rec);
    }
}
