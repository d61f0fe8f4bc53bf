package com.decisionplatform.common.config;

import com.decisionplatform.common.model.EvaluatorRole;

/**
 * Role weights used by the Engine B meta-decision. Kept as configuration rather than
 * constants so experiments can tune specialist vs core influence.
 */
public record ConsensusWeights(double core, double specialist, double subAgent) {

    public static final ConsensusWeights DEFAULT = new ConsensusWeights(0.35, 0.40, 0.25);

    public ConsensusWeights {
        if (core < 0 || specialist < 0 || subAgent < 0) {
            throw new IllegalArgumentException("consensus weights must be non-negative");
        }
    }

    public double weightOf(EvaluatorRole role) {
        return switch (role) {
            case CORE       -> core;
            case SPECIALIST -> specialist;
            case SUB_AGENT  -> subAgent;
        };
    }
}
