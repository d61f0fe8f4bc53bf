package com.decisionplatform.orchestrator.replay;

import java.util.List;

public record SyntheticBatch(long seed, List<SyntheticInput> inputs) {

    public SyntheticBatch {
        inputs = List.copyOf(inputs);
    }

    public int size() {
        return inputs.size();
    }
}
