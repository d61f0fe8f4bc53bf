package com.decisionplatform.analysis.engine;

import com.decisionplatform.common.model.EngineVariant;
import reactor.core.publisher.Mono;

/**
 * Shared contract of the two decision strategies selected by the variant router.
 *
 * <p>Vetoes are values: a non-approving {@link EngineResult}. Failures surface as an error
 * signal on the returned {@link Mono}, which the pipeline handles at the engine boundary.
 */
public interface DecisionEngine {

    EngineVariant variant();

    Mono<EngineResult> evaluate(DecisionInput input);
}
