package com.decisionplatform.common.model;

/**
 * Closed set of Engine B evaluators. Declaration order is the static evaluation order:
 * activation is checked in this order and outputs are re-sorted into it before aggregation.
 */
public enum EvaluatorType {

    CONTEXT(EvaluatorRole.CORE),
    TECHNICAL(EvaluatorRole.CORE),
    RISK(EvaluatorRole.CORE),
    GAMMA_FLOW(EvaluatorRole.SPECIALIST),
    OPENING_RANGE_BREAKOUT(EvaluatorRole.SPECIALIST),
    MULTI_TIMEFRAME_STRUCTURE(EvaluatorRole.SPECIALIST),
    MOMENTUM_SQUEEZE(EvaluatorRole.SPECIALIST),
    COMPOSITE_SUB_AGENT(EvaluatorRole.SUB_AGENT);

    private final EvaluatorRole role;

    EvaluatorType(EvaluatorRole role) {
        this.role = role;
    }

    public EvaluatorRole role() {
        return role;
    }

    /** Only the risk evaluator may veto the meta-decision. */
    public boolean hasVeto() {
        return this == RISK;
    }
}
