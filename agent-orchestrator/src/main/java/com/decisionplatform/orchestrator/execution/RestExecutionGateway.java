package com.decisionplatform.orchestrator.execution;

import com.decisionplatform.common.model.TradeRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Posts recommendations to the execution service. Non-blocking: the POST is subscribed
 * independently so a slow or failing execution service never stalls the decision pipeline.
 */
public class RestExecutionGateway implements ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(RestExecutionGateway.class);

    private final WebClient executionClient;

    public RestExecutionGateway(WebClient executionClient) {
        this.executionClient = executionClient;
    }

    @Override
    public void submit(TradeRecommendation recommendation) {
        executionClient.post()
            .uri("/api/v1/execution/recommendations")
            .bodyValue(recommendation)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r -> log.info("[ExecutionGateway] Recommendation delivered. signalId={} status={}",
                    recommendation.signalId(), r.getStatusCode()),
                e -> log.warn("[ExecutionGateway] Delivery failed. signalId={} error={}",
                    recommendation.signalId(), e.getMessage())
            );
    }
}
