package com.decisionplatform.analysis.rules;

/** Engine A outcome. Every signal resolves to exactly one. */
public enum EntryAction {
    BLOCK,
    WAIT,
    APPROVE
}
