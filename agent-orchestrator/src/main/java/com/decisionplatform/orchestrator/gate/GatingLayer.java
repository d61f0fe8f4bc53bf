package com.decisionplatform.orchestrator.gate;

import com.decisionplatform.common.audit.AuditSink;
import com.decisionplatform.common.config.DecisionConfig;
import com.decisionplatform.common.config.StalenessPolicy;
import com.decisionplatform.common.exception.DataUnavailableException;
import com.decisionplatform.common.guard.PortfolioExposureGuard;
import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.model.ExposureResult;
import com.decisionplatform.common.model.OpenPosition;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.StrategyType;
import com.decisionplatform.common.model.UnifiedBiasState;
import com.decisionplatform.common.trace.SignalMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Pre-engine veto layer. Cheap bias-state checks run first; the open-positions read (the
 * only I/O) happens last and only when every earlier check passed.
 *
 * <h3>Gate order</h3>
 * <ol>
 *   <li>Bias presence: absent and required → HOLD; absent and optional → neutral bias.</li>
 *   <li>Suppression: {@code tradeSuppressed} → HOLD.</li>
 *   <li>Staleness: {@code BLOCK} → HOLD; {@code ALLOW_WITH_DISCOUNT} → admit with discount.</li>
 *   <li>Portfolio exposure: one positions snapshot; read failure → HOLD (fail-closed);
 *       guard {@code BLOCK} → HOLD with the guard's reasons.</li>
 * </ol>
 *
 * <p>Every evaluation writes exactly one {@link AuditStage#GATING} record.
 */
public class GatingLayer {

    private static final Logger log = LoggerFactory.getLogger(GatingLayer.class);

    public static final String NO_BIAS_STATE       = "no bias state";
    public static final String SUPPRESSED          = "suppressed by gating";
    public static final String STALE_BIAS_STATE    = "stale bias state";
    public static final String GUARD_UNAVAILABLE   = "portfolio guard unavailable";

    private final DecisionConfig config;
    private final PortfolioExposureGuard exposureGuard;
    private final AuditSink auditSink;

    public GatingLayer(DecisionConfig config, PortfolioExposureGuard exposureGuard, AuditSink auditSink) {
        this.config = config;
        this.exposureGuard = exposureGuard;
        this.auditSink = auditSink;
    }

    /**
     * @param bias       latest bias state, {@code null} when unavailable
     * @param positions  deferred positions read; subscribed at most once, only if reached
     */
    public Mono<GateDecision> evaluate(Signal signal, UnifiedBiasState bias, Mono<List<OpenPosition>> positions) {
        return Mono.defer(() -> gate(signal, bias, positions))
            .doOnNext(decision -> audit(signal, decision));
    }

    private Mono<GateDecision> gate(Signal signal, UnifiedBiasState bias, Mono<List<OpenPosition>> positions) {
        boolean neutral = false;
        UnifiedBiasState admitted = bias;
        if (admitted == null) {
            if (config.requireMtfBias()) {
                return Mono.just(GateDecision.hold(NO_BIAS_STATE, null));
            }
            admitted = UnifiedBiasState.neutral(signal.symbol());
            neutral = true;
        }

        if (admitted.tradeSuppressed()) {
            if (config.debugMode()) {
                UnifiedBiasState suppressed = admitted;
                SignalMdc.log(signal.signalId(), () ->
                    log.debug("[GatingLayer] Suppression notes. signalId={} notes={}",
                        signal.signalId(), suppressed.suppressionNotes()));
            }
            return Mono.just(GateDecision.hold(SUPPRESSED, admitted));
        }

        double staleDiscount = 1.0;
        if (admitted.stale()) {
            if (config.stalenessPolicy() == StalenessPolicy.BLOCK) {
                return Mono.just(GateDecision.hold(STALE_BIAS_STATE, admitted));
            }
            staleDiscount = config.staleDiscount();
            admitted = admitted.discounted(staleDiscount);
        }

        StrategyType strategy = StrategyType.fromEntryModeHint(admitted.entryModeHint());
        if (!config.portfolioGuardEnabled()) {
            return Mono.just(new GateDecision(GateStatus.PASS, List.of(), admitted, neutral,
                staleDiscount, strategy, null));
        }

        UnifiedBiasState gatedBias = admitted;
        boolean gatedNeutral = neutral;
        double gatedDiscount = staleDiscount;
        return positions
            .switchIfEmpty(Mono.error(new DataUnavailableException("open-positions", "no snapshot returned")))
            .timeout(config.readTimeout())
            .<Optional<List<OpenPosition>>>map(snapshot -> Optional.of(List.copyOf(snapshot)))
            .onErrorResume(e -> {
                SignalMdc.log(signal.signalId(), () ->
                    log.warn("[GatingLayer] Open positions unavailable, failing closed. signalId={} error={}",
                        signal.signalId(), e.toString()));
                return Mono.just(Optional.empty());
            })
            // guard failures propagate; only the read is fail-closed
            .map(snapshot -> snapshot
                .map(open -> guard(signal, open, gatedBias, gatedNeutral, gatedDiscount, strategy))
                .orElseGet(() -> GateDecision.hold(GUARD_UNAVAILABLE, gatedBias)));
    }

    private GateDecision guard(Signal signal, List<OpenPosition> snapshot, UnifiedBiasState bias,
                               boolean neutral, double staleDiscount, StrategyType strategy) {
        ExposureResult exposure = exposureGuard.evaluate(snapshot, signal.symbol(), signal.direction(),
            strategy, bias);
        if (exposure.blocked()) {
            return new GateDecision(GateStatus.HOLD, exposure.reasons(), bias, neutral, staleDiscount,
                strategy, exposure);
        }
        return new GateDecision(GateStatus.PASS, exposure.reasons(), bias, neutral, staleDiscount,
            strategy, exposure);
    }

    private void audit(Signal signal, GateDecision decision) {
        auditSink.record(AuditStage.GATING, signal.signalId(), decision);
        SignalMdc.log(signal.signalId(), () ->
            log.info("[GatingLayer] signalId={} status={} reasons={} neutralBias={} staleDiscount={}",
                signal.signalId(), decision.status(), decision.reasons(), decision.neutralBias(),
                decision.staleDiscount()));
    }
}
