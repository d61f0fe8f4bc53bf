package com.decisionplatform.common.config;

import com.decisionplatform.common.model.EngineVariant;

/**
 * Which engine's recommendations are executed. Recommendations from any other engine
 * are marked shadow.
 */
public enum ExecutionMode {
    SHADOW_ONLY,
    ENGINE_A_PRIMARY,
    ENGINE_B_PRIMARY,
    SPLIT_CAPITAL;

    public boolean executes(EngineVariant engine) {
        return switch (this) {
            case ENGINE_A_PRIMARY -> engine == EngineVariant.A;
            case ENGINE_B_PRIMARY -> engine == EngineVariant.B;
            case SPLIT_CAPITAL    -> true;
            case SHADOW_ONLY      -> false;
        };
    }

    public static ExecutionMode fromProperty(String raw) {
        if (raw == null || raw.isBlank()) {
            return ENGINE_A_PRIMARY;
        }
        return valueOf(raw.trim().toUpperCase().replace('-', '_'));
    }
}
