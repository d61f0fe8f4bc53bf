package com.decisionplatform.common.model;

public enum AuditStage {
    GATING,
    ROUTING,
    ENGINE_A,
    ENGINE_B_ACTIVATION,
    ENGINE_B_EVALUATION,
    ENGINE_B_META,
    ENGINE_FAULT,
    EXECUTION_POLICY,
    SIZING
}
