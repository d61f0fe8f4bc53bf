package com.decisionplatform.common.model;

public enum Verdict {
    APPROVE,
    REJECT
}
