package com.decisionplatform.orchestrator.pipeline;

import com.decisionplatform.analysis.engine.DecisionEngine;
import com.decisionplatform.analysis.engine.DecisionInput;
import com.decisionplatform.analysis.engine.EngineResult;
import com.decisionplatform.common.audit.AuditSink;
import com.decisionplatform.common.exception.EngineException;
import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.TradeRecommendation;
import com.decisionplatform.common.routing.VariantRouter;
import com.decisionplatform.common.sizing.GammaPositionSizer;
import com.decisionplatform.common.sizing.SizingDecision;
import com.decisionplatform.common.trace.SignalMdc;
import com.decisionplatform.orchestrator.gate.GateDecision;
import com.decisionplatform.orchestrator.gate.GatingLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Linear per-signal chain: Gating → Router → Engine → Execution policy → Sizer.
 *
 * <h3>Failure semantics</h3>
 * <ul>
 *   <li>Gate HOLD and engine rejection are values: the chain stops with no recommendation.</li>
 *   <li>Any error raised by the engine is contained here: logged with signal id and engine,
 *       written to the audit sink as {@link AuditStage#ENGINE_FAULT}, and the outcome carries
 *       no recommendation.</li>
 * </ul>
 *
 * <p>A pipeline owns its audit sink; the replay harness assembles a fresh one per run via
 * {@link DecisionPipelineFactory}.
 */
public class DecisionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipeline.class);

    private final GatingLayer gatingLayer;
    private final VariantRouter router;
    private final Map<EngineVariant, DecisionEngine> engines;
    private final ExecutionPolicy executionPolicy;
    private final GammaPositionSizer sizer;
    private final AuditSink auditSink;

    public DecisionPipeline(GatingLayer gatingLayer, VariantRouter router, List<DecisionEngine> engines,
                            ExecutionPolicy executionPolicy, GammaPositionSizer sizer, AuditSink auditSink) {
        this.gatingLayer = gatingLayer;
        this.router = router;
        this.engines = new EnumMap<>(EngineVariant.class);
        engines.forEach(e -> this.engines.put(e.variant(), e));
        for (EngineVariant v : EngineVariant.values()) {
            if (!this.engines.containsKey(v)) {
                throw new IllegalArgumentException("No engine registered for variant " + v);
            }
        }
        this.executionPolicy = executionPolicy;
        this.sizer = sizer;
        this.auditSink = auditSink;
    }

    public AuditSink auditSink() {
        return auditSink;
    }

    public Mono<PipelineOutcome> run(DecisionRequest request) {
        Signal signal = request.signal();
        return gatingLayer.evaluate(signal, request.bias(), request.positions())
            .flatMap(gate -> gate.passed()
                ? route(request, gate)
                : Mono.just(PipelineOutcome.gated(signal.signalId(), gate)));
    }

    private Mono<PipelineOutcome> route(DecisionRequest request, GateDecision gate) {
        Signal signal = request.signal();
        EngineVariant variant = router.assign(signal);
        Map<String, Object> routing = new TreeMap<>();
        routing.put("variant", variant);
        routing.put("assignmentHash", router.assignmentHash(signal));
        routing.put("experimentKey", signal.experimentKey());
        auditSink.record(AuditStage.ROUTING, signal.signalId(), routing);

        DecisionEngine engine = engines.get(variant);
        DecisionInput input = new DecisionInput(signal, request.context(), gate.bias());
        return Mono.defer(() -> engine.evaluate(input))
            .map(result -> complete(request, gate, variant, result))
            .onErrorResume(e -> Mono.just(engineFault(signal, gate, variant, e)));
    }

    private PipelineOutcome complete(DecisionRequest request, GateDecision gate, EngineVariant variant,
                                     EngineResult result) {
        String signalId = request.signal().signalId();
        if (!result.approved()) {
            return new PipelineOutcome(signalId, variant, TerminalStage.ENGINE_REJECTED, gate, result,
                null, null, result.reasons());
        }

        ExecutionPolicy.Verdict verdict = executionPolicy.evaluate(variant);
        auditSink.record(AuditStage.EXECUTION_POLICY, signalId, verdict);

        SizingDecision sizing = sizer.size(request.context().gamma().orElse(null), gate.sizingFactors());
        auditSink.record(AuditStage.SIZING, signalId, sizing);

        TradeRecommendation recommendation = sizer.apply(result.recommendation(), sizing);
        if (verdict.shadow()) {
            recommendation = recommendation.asShadow();
        }
        TradeRecommendation sized = recommendation;
        SignalMdc.log(signalId, variant, () ->
            log.info("[DecisionPipeline] Recommendation. signalId={} engine={} quantity={} regime={} shadow={}",
                signalId, variant, sized.quantity(), sizing.regime(), sized.shadow()));
        return new PipelineOutcome(signalId, variant, TerminalStage.RECOMMENDED, gate, result, sizing,
            sized, result.reasons());
    }

    private PipelineOutcome engineFault(Signal signal, GateDecision gate, EngineVariant variant, Throwable e) {
        String signalId = signal.signalId();
        String component = e instanceof EngineException ee ? ee.getComponent() : "engine";
        SignalMdc.log(signalId, variant, () ->
            log.error("[DecisionPipeline] Engine fault. signalId={} engine={} component={} error={}",
                signalId, variant, component, e.toString(), e));

        Map<String, Object> fault = new TreeMap<>();
        fault.put("engine", variant);
        fault.put("component", component);
        fault.put("error", String.valueOf(e.getMessage()));
        auditSink.record(AuditStage.ENGINE_FAULT, signalId, fault);

        return new PipelineOutcome(signalId, variant, TerminalStage.ENGINE_FAULT, gate, null, null, null,
            List.of("engine_fault: " + e.getMessage()));
    }
}
