package com.decisionplatform.common.model;

/**
 * Candidate trade classification used by the portfolio exposure guard, inferred from the
 * bias state's entry-mode hint.
 */
public enum StrategyType {
    BREAKOUT,
    PULLBACK,
    MEAN_REVERT,
    SWING;

    public static StrategyType fromEntryModeHint(String hint) {
        if (hint == null) {
            return SWING;
        }
        return switch (hint.trim().toUpperCase()) {
            case "BREAKOUT"                      -> BREAKOUT;
            case "PULLBACK"                      -> PULLBACK;
            case "MEAN_REVERT", "MEAN_REVERSION" -> MEAN_REVERT;
            default                              -> SWING;
        };
    }
}
