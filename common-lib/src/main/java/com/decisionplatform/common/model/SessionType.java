package com.decisionplatform.common.model;

/** Regular trading hours vs. extended hours. */
public enum SessionType {
    RTH,
    ETH
}
