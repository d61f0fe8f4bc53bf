package com.decisionplatform.analysis.rules;

import com.decisionplatform.analysis.engine.DecisionInput;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.MarketIntel;
import com.decisionplatform.common.model.SessionContext;

import java.util.List;
import java.util.Optional;

/**
 * Tier 2: inopportune but not disqualifying. Any trigger yields WAIT.
 */
public final class Tier2DelayRules {

    public static final String UNFAVORABLE_TIMING  = "UNFAVORABLE_TIMING";
    public static final String MARGINAL_CONFLUENCE = "MARGINAL_CONFLUENCE";
    public static final String GEX_RESISTANCE      = "GEX_RESISTANCE";

    static final int OPENING_WINDOW_MINUTES = 15;
    static final int MIN_CONFLUENCE = 2;

    private Tier2DelayRules() {}

    public static List<EntryRule> rules() {
        return List.of(
            new NamedRule(UNFAVORABLE_TIMING, 2, Tier2DelayRules::timing),
            new NamedRule(MARGINAL_CONFLUENCE, 2, Tier2DelayRules::confluence),
            new NamedRule(GEX_RESISTANCE, 2, Tier2DelayRules::gex)
        );
    }

    private static Optional<String> timing(DecisionInput in) {
        SessionContext s = in.context().sessionContext();
        if (s != null && s.minutesFromOpen() < OPENING_WINDOW_MINUTES) {
            return Optional.of("within first " + OPENING_WINDOW_MINUTES + " minutes of the open ("
                + s.minutesFromOpen() + ")");
        }
        return Optional.empty();
    }

    private static Optional<String> confluence(DecisionInput in) {
        int count = Confluence.count(in);
        if (count < MIN_CONFLUENCE) {
            return Optional.of("confluence " + count + "/" + Confluence.FACTORS + " below " + MIN_CONFLUENCE);
        }
        return Optional.empty();
    }

    private static Optional<String> gex(DecisionInput in) {
        String state = in.context().intel().map(MarketIntel::gexState).orElse(null);
        if (state == null) {
            return Optional.empty();
        }
        Direction direction = in.signal().direction();
        if (direction == Direction.LONG && "POSITIVE_HIGH".equalsIgnoreCase(state)) {
            return Optional.of("GEX state " + state + " resists calls");
        }
        if (direction == Direction.SHORT && "NEGATIVE_HIGH".equalsIgnoreCase(state)) {
            return Optional.of("GEX state " + state + " resists puts");
        }
        return Optional.empty();
    }
}
