package com.decisionplatform.analysis.service;

import com.decisionplatform.analysis.agent.SignalEvaluator;
import com.decisionplatform.common.exception.EngineException;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Activation and concurrent fan-out of Engine B evaluators.
 *
 * <p>Evaluators are held in the static {@code EvaluatorType} order regardless of how Spring
 * injected them. Activation walks that order; evaluation fans out on
 * {@link Schedulers#boundedElastic()} and the collected outputs are re-sorted into the static
 * order, so scheduling never changes what aggregation sees.
 *
 * <p>Unlike a best-effort dispatch, an evaluator failure fails the whole call with an
 * {@link EngineException}: a consensus over a partial set of outputs is never produced.
 */
@Service
public class EvaluatorDispatchService {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorDispatchService.class);

    private final List<SignalEvaluator> evaluators;

    public EvaluatorDispatchService(List<SignalEvaluator> evaluators) {
        List<SignalEvaluator> ordered = new ArrayList<>(evaluators);
        ordered.sort(Comparator.comparing(SignalEvaluator::type));
        this.evaluators = List.copyOf(ordered);
    }

    public List<SignalEvaluator> registered() {
        return evaluators;
    }

    public List<SignalEvaluator> activate(Signal signal, MarketContext context) {
        List<SignalEvaluator> active = new ArrayList<>();
        for (SignalEvaluator evaluator : evaluators) {
            if (evaluator.shouldActivate(signal, context)) {
                active.add(evaluator);
            }
        }
        return active;
    }

    public Mono<List<EvaluatorOutput>> dispatchAll(List<SignalEvaluator> activated, Signal signal,
                                                   MarketContext context) {
        log.info("Dispatching {} evaluators in parallel for signalId={} symbol={}",
            activated.size(), signal.signalId(), signal.symbol());
        return Flux.fromIterable(activated)
            .flatMap(evaluator -> Mono.fromCallable(() -> evaluator.analyze(signal, context))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(out -> log.debug("Evaluator={} complete. recommendation={} confidence={}",
                    evaluator.type(), out.recommendation(), out.confidence()))
                .onErrorMap(e -> !(e instanceof EngineException), e -> {
                    log.error("Evaluator={} failed for signalId={}", evaluator.type(), signal.signalId(), e);
                    return new EngineException(EngineVariant.B, evaluator.type().name(),
                        "evaluator failed: " + e.getMessage(), e);
                }))
            .collectList()
            .map(outputs -> {
                List<EvaluatorOutput> sorted = new ArrayList<>(outputs);
                sorted.sort(Comparator.comparing(EvaluatorOutput::agentType));
                return List.copyOf(sorted);
            });
    }
}
