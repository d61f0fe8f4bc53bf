package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Multi-timeframe bias and risk posture for a symbol, produced by the external bias
 * provider and consumed once per decision.
 *
 * <p>The regime fields ({@code regimeType}, {@code chopScore}, {@code macroClass},
 * {@code macroDriftScore}, {@code macroFlip}, {@code atrState}) feed the portfolio
 * exposure guard. Staleness policy is configuration, not state.
 */
public record UnifiedBiasState(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("bias") BiasDirection bias,
    @JsonProperty("effectiveConfidence") double effectiveConfidence,
    @JsonProperty("riskMultiplier") double riskMultiplier,
    @JsonProperty("stale") boolean stale,
    @JsonProperty("stalenessMinutes") int stalenessMinutes,
    @JsonProperty("tradeSuppressed") boolean tradeSuppressed,
    @JsonProperty("entryModeHint") String entryModeHint,
    @JsonProperty("riskContext") BiasRiskContext riskContext,
    @JsonProperty("suppressionNotes") List<String> suppressionNotes,
    @JsonProperty("regimeType") String regimeType,
    @JsonProperty("chopScore") double chopScore,
    @JsonProperty("macroClass") String macroClass,
    @JsonProperty("macroDriftScore") double macroDriftScore,
    @JsonProperty("macroFlip") boolean macroFlip,
    @JsonProperty("atrState") String atrState
) {
    public static final String DEFAULT_REGIME = "TREND";
    public static final String DEFAULT_MACRO_CLASS = "MACRO_NEUTRAL";
    public static final String DEFAULT_ATR_STATE = "STABLE";

    /** Missing regime fields take the neutral defaults. */
    public UnifiedBiasState {
        bias = bias == null ? BiasDirection.NEUTRAL : bias;
        effectiveConfidence = Math.max(0.0, Math.min(1.0, effectiveConfidence));
        riskContext = riskContext == null ? BiasRiskContext.NONE : riskContext;
        suppressionNotes = suppressionNotes == null ? List.of() : List.copyOf(suppressionNotes);
        regimeType = regimeType == null ? DEFAULT_REGIME : regimeType;
        macroClass = macroClass == null ? DEFAULT_MACRO_CLASS : macroClass;
        atrState = atrState == null ? DEFAULT_ATR_STATE : atrState;
    }

    /** Fresh, unsuppressed state with neutral regime fields. */
    public static UnifiedBiasState of(String symbol, BiasDirection bias, double effectiveConfidence,
                                      double riskMultiplier, String entryModeHint) {
        return new UnifiedBiasState(symbol, bias, effectiveConfidence, riskMultiplier,
            false, 0, false, entryModeHint, BiasRiskContext.NONE, List.of(),
            DEFAULT_REGIME, 0.0, DEFAULT_MACRO_CLASS, 0.0, false, DEFAULT_ATR_STATE);
    }

    /** Placeholder used when bias gating is not required and no state exists. */
    public static UnifiedBiasState neutral(String symbol) {
        return of(symbol, BiasDirection.NEUTRAL, 0.5, 1.0, null);
    }

    public UnifiedBiasState withStaleness(boolean stale, int stalenessMinutes) {
        return new UnifiedBiasState(symbol, bias, effectiveConfidence, riskMultiplier, stale,
            stalenessMinutes, tradeSuppressed, entryModeHint, riskContext, suppressionNotes,
            regimeType, chopScore, macroClass, macroDriftScore, macroFlip, atrState);
    }

    public UnifiedBiasState withSuppression(List<String> notes) {
        return new UnifiedBiasState(symbol, bias, effectiveConfidence, riskMultiplier, stale,
            stalenessMinutes, true, entryModeHint, riskContext, notes,
            regimeType, chopScore, macroClass, macroDriftScore, macroFlip, atrState);
    }

    public UnifiedBiasState withRegime(String regimeType, double chopScore, String macroClass,
                                       double macroDriftScore, boolean macroFlip, String atrState) {
        return new UnifiedBiasState(symbol, bias, effectiveConfidence, riskMultiplier, stale,
            stalenessMinutes, tradeSuppressed, entryModeHint, riskContext, suppressionNotes,
            regimeType, chopScore, macroClass, macroDriftScore, macroFlip, atrState);
    }

    /** Same state with effective confidence scaled by {@code factor}. */
    public UnifiedBiasState discounted(double factor) {
        return new UnifiedBiasState(symbol, bias, effectiveConfidence * factor, riskMultiplier, stale,
            stalenessMinutes, tradeSuppressed, entryModeHint, riskContext, suppressionNotes,
            regimeType, chopScore, macroClass, macroDriftScore, macroFlip, atrState);
    }
}
