package com.decisionplatform.common.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable decision configuration, read once at startup and passed into every component
 * constructor. Nothing in the decision path reads configuration from ambient state.
 */
public record DecisionConfig(
    double approvalThreshold,
    double gammaNeutralThreshold,
    StalenessPolicy stalenessPolicy,
    double staleDiscount,
    boolean portfolioGuardEnabled,
    boolean requireMtfBias,
    int maxPositionSize,
    int maxHoldDays,
    int baseQuantity,
    double splitA,
    ConsensusWeights consensusWeights,
    double engineAMinConfidence,
    int maxOpenTrades,
    Duration readTimeout,
    ExecutionMode executionMode,
    boolean debugMode
) {
    public DecisionConfig {
        Objects.requireNonNull(stalenessPolicy, "stalenessPolicy");
        Objects.requireNonNull(consensusWeights, "consensusWeights");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(executionMode, "executionMode");
        if (maxPositionSize < 1) {
            throw new IllegalArgumentException("maxPositionSize must be >= 1");
        }
        if (baseQuantity < 1) {
            throw new IllegalArgumentException("baseQuantity must be >= 1");
        }
        splitA = Math.max(0.0, Math.min(1.0, splitA));
    }

    public static DecisionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .approvalThreshold(approvalThreshold)
            .gammaNeutralThreshold(gammaNeutralThreshold)
            .stalenessPolicy(stalenessPolicy)
            .staleDiscount(staleDiscount)
            .portfolioGuardEnabled(portfolioGuardEnabled)
            .requireMtfBias(requireMtfBias)
            .maxPositionSize(maxPositionSize)
            .maxHoldDays(maxHoldDays)
            .baseQuantity(baseQuantity)
            .splitA(splitA)
            .consensusWeights(consensusWeights)
            .engineAMinConfidence(engineAMinConfidence)
            .maxOpenTrades(maxOpenTrades)
            .readTimeout(readTimeout)
            .executionMode(executionMode)
            .debugMode(debugMode);
    }

    public static final class Builder {
        private double approvalThreshold = 0.6;
        private double gammaNeutralThreshold = 1e8;
        private StalenessPolicy stalenessPolicy = StalenessPolicy.BLOCK;
        private double staleDiscount = 0.7;
        private boolean portfolioGuardEnabled = true;
        private boolean requireMtfBias = true;
        private int maxPositionSize = 10;
        private int maxHoldDays = 5;
        private int baseQuantity = 2;
        private double splitA = 0.5;
        private ConsensusWeights consensusWeights = ConsensusWeights.DEFAULT;
        private double engineAMinConfidence = 0.5;
        private int maxOpenTrades = 5;
        private Duration readTimeout = Duration.ofSeconds(2);
        private ExecutionMode executionMode = ExecutionMode.ENGINE_A_PRIMARY;
        private boolean debugMode;

        private Builder() {}

        public Builder approvalThreshold(double v)         { this.approvalThreshold = v; return this; }
        public Builder gammaNeutralThreshold(double v)     { this.gammaNeutralThreshold = v; return this; }
        public Builder stalenessPolicy(StalenessPolicy v)  { this.stalenessPolicy = v; return this; }
        public Builder staleDiscount(double v)             { this.staleDiscount = v; return this; }
        public Builder portfolioGuardEnabled(boolean v)    { this.portfolioGuardEnabled = v; return this; }
        public Builder requireMtfBias(boolean v)           { this.requireMtfBias = v; return this; }
        public Builder maxPositionSize(int v)              { this.maxPositionSize = v; return this; }
        public Builder maxHoldDays(int v)                  { this.maxHoldDays = v; return this; }
        public Builder baseQuantity(int v)                 { this.baseQuantity = v; return this; }
        public Builder splitA(double v)                    { this.splitA = v; return this; }
        public Builder consensusWeights(ConsensusWeights v){ this.consensusWeights = v; return this; }
        public Builder engineAMinConfidence(double v)      { this.engineAMinConfidence = v; return this; }
        public Builder maxOpenTrades(int v)                { this.maxOpenTrades = v; return this; }
        public Builder readTimeout(Duration v)             { this.readTimeout = v; return this; }
        public Builder executionMode(ExecutionMode v)      { this.executionMode = v; return this; }
        public Builder debugMode(boolean v)                { this.debugMode = v; return this; }

        public DecisionConfig build() {
            return new DecisionConfig(approvalThreshold, gammaNeutralThreshold, stalenessPolicy,
                staleDiscount, portfolioGuardEnabled, requireMtfBias, maxPositionSize, maxHoldDays,
                baseQuantity, splitA, consensusWeights, engineAMinConfidence, maxOpenTrades,
                readTimeout, executionMode, debugMode);
        }
    }
}
