package com.decisionplatform.orchestrator.pipeline;

/** Where a signal's run ended. Only {@link #RECOMMENDED} carries a recommendation. */
public enum TerminalStage {
    /** Signal id already processed; nothing was evaluated or dispatched. */
    DUPLICATE,
    NO_PRICE,
    GATED,
    ENGINE_REJECTED,
    ENGINE_FAULT,
    RECOMMENDED,
    PIPELINE_FAULT
}
