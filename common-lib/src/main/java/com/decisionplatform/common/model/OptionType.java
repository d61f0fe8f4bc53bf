package com.decisionplatform.common.model;

public enum OptionType {
    CALL,
    PUT;

    public static OptionType forDirection(Direction direction) {
        return direction == Direction.LONG ? CALL : PUT;
    }
}
