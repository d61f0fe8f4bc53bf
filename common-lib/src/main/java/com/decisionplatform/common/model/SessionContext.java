package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionContext(
    @JsonProperty("sessionType") SessionType sessionType,
    @JsonProperty("marketOpen") boolean marketOpen,
    @JsonProperty("minutesFromOpen") int minutesFromOpen,
    @JsonProperty("minutesUntilClose") int minutesUntilClose
) {
    public static SessionContext regular(int minutesFromOpen, int minutesUntilClose) {
        return new SessionContext(SessionType.RTH, true, minutesFromOpen, minutesUntilClose);
    }

    public boolean isRegularHours() {
        return sessionType == SessionType.RTH && marketOpen;
    }
}
