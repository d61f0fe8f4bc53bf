package com.decisionplatform.common.model;

/** Exit-behaviour hint attached to a sized recommendation. */
public enum ExitProfile {
    MEAN_REVERT,
    TREND
}
