package com.decisionplatform.common.consensus;

import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.MetaDecision;

import java.util.List;

/**
 * Strategy contract for aggregating Engine B evaluator outputs into one {@link MetaDecision}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b> — no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>      — no logging, no reactive types, no side effects</li>
 *   <li><b>Non-null</b>  — must always return a valid {@link MetaDecision}</li>
 *   <li><b>Order-insensitive</b> — the result must not depend on the order outputs arrive in</li>
 * </ul>
 *
 * <p>Current implementation: {@link WeightedMetaDecisionStrategy}. Register a different
 * implementation as a Spring {@code @Bean} in {@code OrchestratorConfig} to swap policies.
 */
public interface ConsensusEngine {

    /**
     * @param outputs outputs of the activated evaluators, in any order
     * @return the meta-decision, never {@code null}
     */
    MetaDecision compute(List<EvaluatorOutput> outputs);
}
