package com.decisionplatform.orchestrator.logger;

import com.decisionplatform.common.trace.SignalMdc;
import com.decisionplatform.orchestrator.pipeline.PipelineOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for a signal's journey through the orchestrator. Pure side
 * effects; no business logic.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #SIGNAL_RECEIVED}   — signal accepted by the service</li>
 *   <li>{@link #CONTEXT_FALLBACK}  — enrichment failed, price-anchored context in use</li>
 *   <li>{@link #INPUTS_RESOLVED}   — bias and market context reads finished</li>
 *   <li>{@link #OUTCOME_READY}     — pipeline finished, terminal stage known</li>
 *   <li>{@link #DISPATCHED}        — recommendation handed to shadow sink or gateway</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the signal id from Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.INPUTS_RESOLVED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String SIGNAL_RECEIVED  = "SIGNAL_RECEIVED";
    public static final String CONTEXT_FALLBACK = "CONTEXT_FALLBACK";
    public static final String INPUTS_RESOLVED  = "INPUTS_RESOLVED";
    public static final String OUTCOME_READY    = "OUTCOME_READY";
    public static final String DISPATCHED       = "DISPATCHED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The signal id comes from the Reactor Context, bridged to MDC for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String signalId = SignalMdc.signalIdOf(signal.getContextView());
            SignalMdc.log(signalId, () ->
                log.info("[DecisionFlow] stage={} signalId={}", stageName, signalId)
            );
        };
    }

    public void logWithSignalId(String stageName, String signalId) {
        SignalMdc.log(signalId, () ->
            log.info("[DecisionFlow] stage={} signalId={}", stageName, signalId)
        );
    }

    /** Compact one-line summary of a finished run. */
    public void logOutcome(PipelineOutcome outcome) {
        SignalMdc.log(outcome.signalId(), outcome.variant(), () ->
            log.info("[DecisionFlow] stage={} signalId={} terminal={} variant={} shadow={} reasons={}",
                OUTCOME_READY, outcome.signalId(), outcome.terminalStage(),
                outcome.variant() != null ? outcome.variant() : "N/A",
                outcome.recommendation() != null ? outcome.recommendation().shadow() : "N/A",
                outcome.reasons())
        );
    }
}
