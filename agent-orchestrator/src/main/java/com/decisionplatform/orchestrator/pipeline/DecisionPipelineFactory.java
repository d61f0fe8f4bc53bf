package com.decisionplatform.orchestrator.pipeline;

import com.decisionplatform.analysis.contract.AtTheMoneyContractSelector;
import com.decisionplatform.analysis.contract.ContractSelector;
import com.decisionplatform.analysis.engine.ConsensusDecisionEngine;
import com.decisionplatform.analysis.engine.RuleBasedDecisionEngine;
import com.decisionplatform.analysis.service.EvaluatorDispatchService;
import com.decisionplatform.common.audit.AuditSink;
import com.decisionplatform.common.config.DecisionConfig;
import com.decisionplatform.common.consensus.ConsensusEngine;
import com.decisionplatform.common.guard.PortfolioExposureGuard;
import com.decisionplatform.common.routing.VariantRouter;
import com.decisionplatform.common.sizing.GammaPositionSizer;
import com.decisionplatform.orchestrator.gate.GatingLayer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles a {@link DecisionPipeline} around a given audit sink. Stateless collaborators
 * (router, guard, sizer, evaluator dispatch) are shared; everything that writes audit
 * records is created per pipeline.
 */
@Component
public class DecisionPipelineFactory {

    private final DecisionConfig config;
    private final EvaluatorDispatchService dispatchService;
    private final ConsensusEngine consensusEngine;

    public DecisionPipelineFactory(DecisionConfig config, EvaluatorDispatchService dispatchService,
                                   ConsensusEngine consensusEngine) {
        this.config = config;
        this.dispatchService = dispatchService;
        this.consensusEngine = consensusEngine;
    }

    public DecisionConfig config() {
        return config;
    }

    public DecisionPipeline create(AuditSink auditSink) {
        ContractSelector contracts = new AtTheMoneyContractSelector(config.maxHoldDays());
        GatingLayer gating = new GatingLayer(config, new PortfolioExposureGuard(config.maxOpenTrades()), auditSink);
        return new DecisionPipeline(
            gating,
            new VariantRouter(config.splitA()),
            List.of(
                new RuleBasedDecisionEngine(config.engineAMinConfidence(), contracts, auditSink),
                new ConsensusDecisionEngine(dispatchService, consensusEngine, contracts, auditSink)),
            new ExecutionPolicy(config.executionMode()),
            new GammaPositionSizer(config.gammaNeutralThreshold(), config.baseQuantity(), config.maxPositionSize()),
            auditSink);
    }
}
