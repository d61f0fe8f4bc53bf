package com.decisionplatform.orchestrator.service;

import com.decisionplatform.common.config.DecisionConfig;
import com.decisionplatform.common.exception.DataUnavailableException;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.UnifiedBiasState;
import com.decisionplatform.common.trace.SignalMdc;
import com.decisionplatform.orchestrator.execution.ShadowAwareExecutionDispatcher;
import com.decisionplatform.orchestrator.logger.DecisionFlowLogger;
import com.decisionplatform.orchestrator.pipeline.DecisionPipeline;
import com.decisionplatform.orchestrator.pipeline.DecisionRequest;
import com.decisionplatform.orchestrator.pipeline.PipelineOutcome;
import com.decisionplatform.orchestrator.provider.BiasStateProvider;
import com.decisionplatform.orchestrator.provider.MarketContextProvider;
import com.decisionplatform.orchestrator.provider.OpenPositionsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for signal processing: resolves inputs, runs the {@link DecisionPipeline}
 * and dispatches the result.
 *
 * <h3>Input resolution</h3>
 * <ol>
 *   <li>Bias state read under the configured deadline; failure or timeout is treated as absence.</li>
 *   <li>Market context read under the deadline; on failure a price-anchored degraded context is
 *       built from a current-price read. No price ends the run with {@code NO_PRICE}.</li>
 *   <li>Open positions stay deferred; the gating layer reads them only if it gets that far.</li>
 * </ol>
 *
 * <p>Each signal id is processed once: a resubmitted id resolves to a {@code DUPLICATE}
 * outcome without reading inputs, auditing or dispatching.
 *
 * <p>{@link #process(Signal)} never errors: unexpected failures resolve to a
 * {@code pipeline_fault} outcome.
 */
@Service
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    private final MarketContextProvider contextProvider;
    private final BiasStateProvider biasProvider;
    private final OpenPositionsProvider positionsProvider;
    private final DecisionPipeline pipeline;
    private final ShadowAwareExecutionDispatcher dispatcher;
    private final DecisionFlowLogger flowLogger;
    private final SignalClaimRegistry claims;
    private final Duration readTimeout;

    public OrchestratorService(MarketContextProvider contextProvider,
                               BiasStateProvider biasProvider,
                               OpenPositionsProvider positionsProvider,
                               DecisionPipeline pipeline,
                               ShadowAwareExecutionDispatcher dispatcher,
                               DecisionFlowLogger flowLogger,
                               SignalClaimRegistry claims,
                               DecisionConfig config) {
        this.contextProvider = contextProvider;
        this.biasProvider = biasProvider;
        this.positionsProvider = positionsProvider;
        this.pipeline = pipeline;
        this.dispatcher = dispatcher;
        this.flowLogger = flowLogger;
        this.claims = claims;
        this.readTimeout = config.readTimeout();
    }

    public Mono<PipelineOutcome> process(Signal signal) {
        return Mono.defer(() -> {
            String signalId = signal.signalId();
            if (!claims.claim(signalId)) {
                SignalMdc.log(signalId, () ->
                    log.warn("[OrchestratorService] Duplicate signal ignored. signalId={} symbol={}",
                        signalId, signal.symbol()));
                return Mono.just(PipelineOutcome.duplicate(signalId));
            }
            return run(signal);
        });
    }

    private Mono<PipelineOutcome> run(Signal signal) {
        String signalId = signal.signalId();
        flowLogger.logWithSignalId(DecisionFlowLogger.SIGNAL_RECEIVED, signalId);

        Mono<PipelineOutcome> chain = Mono.zip(readBias(signal), readContext(signal))
            .doOnEach(flowLogger.stage(DecisionFlowLogger.INPUTS_RESOLVED))
            .flatMap(inputs -> {
                Optional<MarketContext> context = inputs.getT2();
                if (context.isEmpty()) {
                    return Mono.just(PipelineOutcome.noPrice(signalId));
                }
                DecisionRequest request = new DecisionRequest(signal, context.get(),
                    inputs.getT1().orElse(null), positionsProvider.openPositions());
                return pipeline.run(request);
            })
            .doOnNext(outcome -> {
                flowLogger.logOutcome(outcome);
                ShadowAwareExecutionDispatcher.Route route = dispatcher.dispatch(outcome);
                if (route != ShadowAwareExecutionDispatcher.Route.NONE) {
                    flowLogger.logWithSignalId(DecisionFlowLogger.DISPATCHED, signalId);
                }
            })
            .onErrorResume(e -> {
                SignalMdc.log(signalId, () ->
                    log.error("[OrchestratorService] Pipeline fault. signalId={} error={}",
                        signalId, e.toString(), e));
                return Mono.just(PipelineOutcome.pipelineFault(signalId));
            });

        return chain.contextWrite(SignalMdc.signalId(signalId));
    }

    /** Processes every signal concurrently; outcomes are returned in input order. */
    public Mono<List<PipelineOutcome>> processBatch(List<Signal> signals) {
        return Flux.fromIterable(signals)
            .flatMapSequential(this::process)
            .collectList();
    }

    private Mono<Optional<UnifiedBiasState>> readBias(Signal signal) {
        return biasProvider.biasState(signal.symbol())
            .timeout(readTimeout)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(e -> {
                SignalMdc.log(signal.signalId(), () ->
                    log.warn("[OrchestratorService] Bias read failed, treating as absent. signalId={} symbol={} error={}",
                        signal.signalId(), signal.symbol(), e.toString()));
                return Mono.just(Optional.empty());
            });
    }

    private Mono<Optional<MarketContext>> readContext(Signal signal) {
        return contextProvider.context(signal)
            .switchIfEmpty(Mono.error(new DataUnavailableException("market-context",
                "empty context for symbol=" + signal.symbol())))
            .timeout(readTimeout)
            .map(Optional::of)
            .onErrorResume(e -> fallbackContext(signal, e));
    }

    private Mono<Optional<MarketContext>> fallbackContext(Signal signal, Throwable cause) {
        String signalId = signal.signalId();
        SignalMdc.log(signalId, () ->
            log.warn("[OrchestratorService] Market context unavailable, using price-anchored fallback. signalId={} symbol={} error={}",
                signalId, signal.symbol(), cause.toString()));
        return contextProvider.currentPrice(signal)
            .timeout(readTimeout)
            .filter(p -> p.price() > 0 && Double.isFinite(p.price()))
            .map(p -> Optional.of(MarketContext.priceAnchored(signal.symbol(), signal.timestamp(),
                p.price(), p.session())))
            .doOnNext(ctx -> flowLogger.logWithSignalId(DecisionFlowLogger.CONTEXT_FALLBACK, signalId))
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(e -> {
                SignalMdc.log(signalId, () ->
                    log.warn("[OrchestratorService] Price read failed. signalId={} symbol={} error={}",
                        signalId, signal.symbol(), e.toString()));
                return Mono.just(Optional.empty());
            });
    }
}
