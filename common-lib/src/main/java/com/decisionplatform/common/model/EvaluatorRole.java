package com.decisionplatform.common.model;

/**
 * Weighting class of an evaluator in the meta-decision. Sub-agents never carry a veto.
 */
public enum EvaluatorRole {
    CORE,
    SPECIALIST,
    SUB_AGENT
}
