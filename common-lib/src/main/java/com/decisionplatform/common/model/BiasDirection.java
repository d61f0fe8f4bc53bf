package com.decisionplatform.common.model;

public enum BiasDirection {
    BULLISH,
    BEARISH,
    NEUTRAL;

    /** True when this bias points against the given trade direction. */
    public boolean conflictsWith(Direction direction) {
        return (this == BEARISH && direction == Direction.LONG)
            || (this == BULLISH && direction == Direction.SHORT);
    }

    public boolean alignsWith(Direction direction) {
        return (this == BULLISH && direction == Direction.LONG)
            || (this == BEARISH && direction == Direction.SHORT);
    }
}
