package com.decisionplatform.common.model;

/** Decision path: A is the tiered rule engine, B the multi-evaluator consensus engine. */
public enum EngineVariant {
    A,
    B
}
