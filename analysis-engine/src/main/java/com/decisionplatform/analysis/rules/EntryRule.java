package com.decisionplatform.analysis.rules;

import com.decisionplatform.analysis.engine.DecisionInput;

import java.util.Optional;

/**
 * One Engine A rule. Returns a triggered {@link RuleResult} or empty; never throws for
 * missing optional data.
 */
public interface EntryRule {

    String id();

    Optional<RuleResult> evaluate(DecisionInput input);
}
