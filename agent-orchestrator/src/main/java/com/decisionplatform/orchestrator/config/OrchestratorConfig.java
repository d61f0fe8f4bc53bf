package com.decisionplatform.orchestrator.config;

import com.decisionplatform.common.audit.AuditSink;
import com.decisionplatform.common.config.ConsensusWeights;
import com.decisionplatform.common.config.DecisionConfig;
import com.decisionplatform.common.config.ExecutionMode;
import com.decisionplatform.common.config.StalenessPolicy;
import com.decisionplatform.common.consensus.ConsensusEngine;
import com.decisionplatform.common.consensus.WeightedMetaDecisionStrategy;
import com.decisionplatform.orchestrator.audit.LoggingAuditSink;
import com.decisionplatform.orchestrator.execution.ExecutionGateway;
import com.decisionplatform.orchestrator.execution.LoggingExecutionGateway;
import com.decisionplatform.orchestrator.execution.RestExecutionGateway;
import com.decisionplatform.orchestrator.pipeline.DecisionPipeline;
import com.decisionplatform.orchestrator.pipeline.DecisionPipelineFactory;
import com.decisionplatform.orchestrator.service.SignalClaimRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Reads the {@code decision.*} properties once at startup into the immutable
 * {@link DecisionConfig} and wires the decision pipeline around it.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${decision.approval-threshold:0.6}")
    private double approvalThreshold;

    @Value("${decision.gamma.neutral-threshold:100000000}")
    private double gammaNeutralThreshold;

    @Value("${decision.bias.staleness-policy:block}")
    private String stalenessPolicy;

    @Value("${decision.bias.stale-discount:0.7}")
    private double staleDiscount;

    @Value("${decision.bias.require-mtf-bias:true}")
    private boolean requireMtfBias;

    @Value("${decision.portfolio.guard-enabled:true}")
    private boolean portfolioGuardEnabled;

    @Value("${decision.portfolio.max-open-trades:5}")
    private int maxOpenTrades;

    @Value("${decision.sizing.max-position-size:10}")
    private int maxPositionSize;

    @Value("${decision.sizing.max-hold-days:5}")
    private int maxHoldDays;

    @Value("${decision.sizing.base-quantity:2}")
    private int baseQuantity;

    @Value("${decision.routing.split-a:0.5}")
    private double splitA;

    @Value("${decision.consensus.core-weight:0.35}")
    private double coreWeight;

    @Value("${decision.consensus.specialist-weight:0.40}")
    private double specialistWeight;

    @Value("${decision.consensus.subagent-weight:0.25}")
    private double subAgentWeight;

    @Value("${decision.engine-a.min-confidence:0.5}")
    private double engineAMinConfidence;

    @Value("${decision.read-timeout:2s}")
    private Duration readTimeout;

    @Value("${decision.execution.mode:engine_a_primary}")
    private String executionMode;

    @Value("${decision.debug-mode:false}")
    private boolean debugMode;

    @Value("${decision.audit.retention:24h}")
    private Duration auditRetention;

    @Value("${decision.audit.max-keys:500000}")
    private long auditMaxKeys;

    @Value("${decision.signals.claim-retention:24h}")
    private Duration claimRetention;

    @Value("${decision.signals.max-claims:100000}")
    private long maxClaims;

    @Value("${services.execution.base-url:}")
    private String executionUrl;

    @Bean
    public DecisionConfig decisionConfig() {
        DecisionConfig config = DecisionConfig.builder()
            .approvalThreshold(approvalThreshold)
            .gammaNeutralThreshold(gammaNeutralThreshold)
            .stalenessPolicy(StalenessPolicy.fromProperty(stalenessPolicy))
            .staleDiscount(staleDiscount)
            .portfolioGuardEnabled(portfolioGuardEnabled)
            .requireMtfBias(requireMtfBias)
            .maxPositionSize(maxPositionSize)
            .maxHoldDays(maxHoldDays)
            .baseQuantity(baseQuantity)
            .splitA(splitA)
            .consensusWeights(new ConsensusWeights(coreWeight, specialistWeight, subAgentWeight))
            .engineAMinConfidence(engineAMinConfidence)
            .maxOpenTrades(maxOpenTrades)
            .readTimeout(readTimeout)
            .executionMode(ExecutionMode.fromProperty(executionMode))
            .debugMode(debugMode)
            .build();
        log.info("[OrchestratorConfig] Decision config loaded. splitA={} approvalThreshold={} executionMode={} "
                 + "stalenessPolicy={} guardEnabled={} readTimeout={}",
            config.splitA(), config.approvalThreshold(), config.executionMode(),
            config.stalenessPolicy(), config.portfolioGuardEnabled(), config.readTimeout());
        return config;
    }

    @Bean
    public ConsensusEngine consensusEngine(DecisionConfig decisionConfig) {
        return new WeightedMetaDecisionStrategy(decisionConfig.approvalThreshold(),
            decisionConfig.consensusWeights());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public AuditSink auditSink(ObjectMapper objectMapper) {
        return new LoggingAuditSink(objectMapper, auditRetention, auditMaxKeys);
    }

    @Bean
    public SignalClaimRegistry signalClaimRegistry() {
        return new SignalClaimRegistry(claimRetention, maxClaims);
    }

    @Bean
    public DecisionPipeline decisionPipeline(DecisionPipelineFactory factory, AuditSink auditSink) {
        return factory.create(auditSink);
    }

    @Bean
    public ExecutionGateway executionGateway(WebClient.Builder builder) {
        if (executionUrl == null || executionUrl.isBlank()) {
            log.info("[OrchestratorConfig] No execution service configured, recommendations will be logged");
            return new LoggingExecutionGateway();
        }
        return new RestExecutionGateway(builder.baseUrl(executionUrl).build());
    }
}
