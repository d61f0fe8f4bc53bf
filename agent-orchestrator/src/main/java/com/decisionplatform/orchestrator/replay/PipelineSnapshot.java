package com.decisionplatform.orchestrator.replay;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One run's per-signal snapshots, ordered by signal id. */
public record PipelineSnapshot(int runIndex, long seed, List<SignalSnapshot> signals) {

    public PipelineSnapshot {
        signals = List.copyOf(signals);
    }

    public Map<String, SignalSnapshot> bySignalId() {
        Map<String, SignalSnapshot> map = new LinkedHashMap<>();
        signals.forEach(s -> map.put(s.signalId(), s));
        return map;
    }
}
