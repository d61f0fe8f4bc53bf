package com.decisionplatform.analysis.rules;

import com.decisionplatform.analysis.engine.DecisionInput;

import java.util.Optional;
import java.util.function.Function;

/** {@link EntryRule} built from an id and a check that returns the trigger message. */
record NamedRule(String id, int tier, Function<DecisionInput, Optional<String>> check) implements EntryRule {

    @Override
    public Optional<RuleResult> evaluate(DecisionInput input) {
        return check.apply(input).map(message -> new RuleResult(tier, id, message));
    }
}
