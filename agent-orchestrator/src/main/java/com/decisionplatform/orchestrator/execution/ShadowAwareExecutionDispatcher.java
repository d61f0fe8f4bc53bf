package com.decisionplatform.orchestrator.execution;

import com.decisionplatform.common.model.TradeRecommendation;
import com.decisionplatform.orchestrator.pipeline.PipelineOutcome;
import org.springframework.stereotype.Component;

/**
 * Routes a pipeline's recommendation to exactly one destination: shadow recommendations to
 * {@link ShadowLogSink}, all others to the {@link ExecutionGateway}. A shadow recommendation
 * never reaches the gateway.
 */
@Component
public class ShadowAwareExecutionDispatcher {

    public enum Route { NONE, SHADOW, EXECUTION }

    private final ExecutionGateway gateway;
    private final ShadowLogSink shadowSink;

    public ShadowAwareExecutionDispatcher(ExecutionGateway gateway, ShadowLogSink shadowSink) {
        this.gateway = gateway;
        this.shadowSink = shadowSink;
    }

    public Route dispatch(PipelineOutcome outcome) {
        TradeRecommendation rec = outcome.recommendation();
        if (rec == null) {
            return Route.NONE;
        }
        if (rec.shadow()) {
            shadowSink.record(rec);
            return Route.SHADOW;
        }
        gateway.submit(rec);
        return Route.EXECUTION;
    }
}
