package com.decisionplatform.analysis.agent;

import com.decisionplatform.common.model.Candle;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.SessionContext;
import com.decisionplatform.common.model.Signal;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Data-availability predicates shared by the specialists and the composite sub-agent.
 */
public final class ActivationRules {

    static final Set<String> ORB_SYMBOLS = Set.of("SPY", "QQQ", "SPX");
    static final int ORB_WINDOW_MINUTES = 30;
    static final int ORB_RANGE_CANDLES = 5;
    static final int STRUCTURE_MIN_CANDLES = 3;
    static final int SQUEEZE_PERIOD = 20;

    private ActivationRules() {}

    public static boolean hasGammaOrFlow(MarketContext ctx) {
        return ctx.gamma().isPresent() || ctx.flow().map(f -> !f.entries().isEmpty()).orElse(false);
    }

    public static boolean inOpeningRangeWindow(Signal signal, MarketContext ctx) {
        SessionContext session = ctx.sessionContext();
        if (!ORB_SYMBOLS.contains(signal.symbol()) || session == null || !session.isRegularHours()) {
            return false;
        }
        if (session.minutesFromOpen() < 0 || session.minutesFromOpen() > ORB_WINDOW_MINUTES) {
            return false;
        }
        return !openingRange(signal, ctx).isEmpty();
    }

    public static boolean hasStructure(MarketContext ctx) {
        return ctx.candles().size() >= STRUCTURE_MIN_CANDLES;
    }

    public static boolean hasSqueezeInputs(MarketContext ctx) {
        return ctx.candles().size() >= SQUEEZE_PERIOD;
    }

    /** Number of specialist data sets present; drives composite sub-agent activation. */
    public static int specialistInputs(Signal signal, MarketContext ctx) {
        int count = 0;
        if (hasGammaOrFlow(ctx)) count++;
        if (inOpeningRangeWindow(signal, ctx)) count++;
        if (hasStructure(ctx)) count++;
        if (hasSqueezeInputs(ctx)) count++;
        return count;
    }

    /**
     * First {@value #ORB_RANGE_CANDLES} candles at or after the session open, where the open is
     * derived from the signal timestamp and the session's minutes-from-open.
     */
    static List<Candle> openingRange(Signal signal, MarketContext ctx) {
        SessionContext session = ctx.sessionContext();
        if (session == null) {
            return List.of();
        }
        Instant open = signal.timestamp().minus(Duration.ofMinutes(session.minutesFromOpen()));
        return ctx.candles().stream()
            .filter(c -> !c.timestamp().isBefore(open))
            .limit(ORB_RANGE_CANDLES)
            .toList();
    }
}
