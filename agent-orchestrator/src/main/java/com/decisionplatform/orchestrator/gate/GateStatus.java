package com.decisionplatform.orchestrator.gate;

public enum GateStatus {
    PASS,
    HOLD
}
