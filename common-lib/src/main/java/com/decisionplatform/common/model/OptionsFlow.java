package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record OptionsFlow(
    @JsonProperty("entries") List<Entry> entries
) {
    public OptionsFlow {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public long volume(OptionType side) {
        return entries.stream()
            .filter(e -> e.side() == side)
            .mapToLong(Entry::volume)
            .sum();
    }

    public record Entry(
        @JsonProperty("side") OptionType side,
        @JsonProperty("strike") double strike,
        @JsonProperty("volume") long volume,
        @JsonProperty("premium") double premium
    ) {}
}
