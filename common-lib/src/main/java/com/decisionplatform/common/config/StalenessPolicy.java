package com.decisionplatform.common.config;

/** What the gating layer does with a stale bias state. */
public enum StalenessPolicy {
    BLOCK,
    ALLOW_WITH_DISCOUNT;

    /** Accepts the configuration spellings {@code block} and {@code allow} (or the enum names). */
    public static StalenessPolicy fromProperty(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLOCK;
        }
        String normalized = raw.trim().toUpperCase().replace('-', '_');
        if (normalized.equals("ALLOW") || normalized.equals("ALLOW_WITH_DISCOUNT")) {
            return ALLOW_WITH_DISCOUNT;
        }
        if (normalized.equals("BLOCK")) {
            return BLOCK;
        }
        throw new IllegalArgumentException("Unknown staleness policy: " + raw);
    }
}
