package com.decisionplatform.orchestrator.gate;

import com.decisionplatform.common.model.ExposureResult;
import com.decisionplatform.common.model.StrategyType;
import com.decisionplatform.common.model.UnifiedBiasState;
import com.decisionplatform.common.sizing.SizingFactors;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of the gating layer. A {@code HOLD} carries the vetoing reasons; a {@code PASS}
 * carries the bias state admitted to the engines and the factors the sizer will apply.
 *
 * @param bias            admitted bias state, possibly neutral or stale-discounted; {@code null} on early HOLD
 * @param neutralBias     true when no bias state was available and a neutral one was substituted
 * @param staleDiscount   1.0 unless a stale state was admitted under {@code ALLOW_WITH_DISCOUNT}
 * @param exposure        guard verdict; {@code null} when the guard is disabled or never reached
 */
public record GateDecision(
    @JsonProperty("status") GateStatus status,
    @JsonProperty("reasons") List<String> reasons,
    @JsonProperty("bias") UnifiedBiasState bias,
    @JsonProperty("neutralBias") boolean neutralBias,
    @JsonProperty("staleDiscount") double staleDiscount,
    @JsonProperty("strategyType") StrategyType strategyType,
    @JsonProperty("exposure") ExposureResult exposure
) {
    public GateDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static GateDecision hold(String reason, UnifiedBiasState bias) {
        return new GateDecision(GateStatus.HOLD, List.of(reason), bias, false, 1.0, null, null);
    }

    @JsonIgnore
    public boolean passed() {
        return status == GateStatus.PASS;
    }

    /** Bias risk multiplier, exposure allowance and stale discount for the sizer. */
    @JsonIgnore
    public SizingFactors sizingFactors() {
        double biasRisk = bias == null ? 1.0 : bias.riskMultiplier();
        double exposurePct = exposure == null ? 1.0 : exposure.allowedNewExposurePct();
        return new SizingFactors(biasRisk, exposurePct, staleDiscount);
    }
}
