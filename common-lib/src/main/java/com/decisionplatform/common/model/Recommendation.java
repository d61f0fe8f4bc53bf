package com.decisionplatform.common.model;

public enum Recommendation {
    APPROVE,
    REJECT,
    HOLD
}
