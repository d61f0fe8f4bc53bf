package com.decisionplatform.orchestrator.replay;

import com.decisionplatform.analysis.indicator.TechnicalIndicators;
import com.decisionplatform.common.model.BiasDirection;
import com.decisionplatform.common.model.Candle;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.GammaContext;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.MarketIntel;
import com.decisionplatform.common.model.OpenPosition;
import com.decisionplatform.common.model.OptionType;
import com.decisionplatform.common.model.OptionsFlow;
import com.decisionplatform.common.model.PortfolioRiskFlags;
import com.decisionplatform.common.model.SessionContext;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.UnifiedBiasState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Builds reproducible input batches: the same seed and size always produce equal batches.
 * Inputs cover both variants, every evaluator's activation path, stale/suppressed/missing bias
 * states and crowded portfolios. All timestamps derive from a fixed session open.
 */
public class SyntheticInputGenerator {

    /** 2024-03-12 09:30 America/New_York. */
    static final Instant SESSION_OPEN = Instant.parse("2024-03-12T13:30:00Z");
    static final int SESSION_MINUTES = 390;
    static final int CANDLES = 40;

    private static final String[] SYMBOLS    = {"SPY", "QQQ", "AAPL", "NVDA", "TSLA"};
    private static final double[] BASE_PRICE = {510.0, 440.0, 172.0, 880.0, 178.0};
    private static final String[] REGIMES    = {"BULL", "STRONG_BULL", "BEAR", "STRONG_BEAR", "RANGE", "NEUTRAL"};
    private static final String[] GEX_STATES = {"POSITIVE_HIGH", "NEGATIVE_HIGH", "NEUTRAL"};
    private static final String[] HINTS      = {"BREAKOUT", "PULLBACK", "MEAN_REVERT", null};
    private static final String[] MACROS     = {"MACRO_TREND_UP", "MACRO_TREND_DOWN", "MACRO_NEUTRAL",
                                                "MACRO_RANGE", "MACRO_REVERSAL_RISK"};

    private final long seed;

    public SyntheticInputGenerator(long seed) {
        this.seed = seed;
    }

    public SyntheticBatch generate(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("batch size must be >= 1, was " + size);
        }
        Random rnd = new Random(seed);
        List<SyntheticInput> inputs = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            inputs.add(next(rnd, i));
        }
        return new SyntheticBatch(seed, inputs);
    }

    private SyntheticInput next(Random rnd, int index) {
        int s = rnd.nextInt(SYMBOLS.length);
        String symbol = SYMBOLS[s];
        Direction direction = rnd.nextBoolean() ? Direction.LONG : Direction.SHORT;

        // a third of signals land inside the opening-range window
        int minutesFromOpen = rnd.nextInt(3) == 0 ? rnd.nextInt(31) : rnd.nextInt(SESSION_MINUTES - 1);
        Instant ts = SESSION_OPEN.plus(Duration.ofMinutes(minutesFromOpen));
        SessionContext session = SessionContext.regular(minutesFromOpen, SESSION_MINUTES - minutesFromOpen);

        String signalId = String.format(Locale.ROOT, "syn-%d-%04d", seed, index);
        Signal signal = Signal.of(signalId, symbol, direction, "5m", ts, "exp-" + seed);

        List<Candle> candles = candles(rnd, BASE_PRICE[s], ts);
        double price = candles.get(candles.size() - 1).close();
        MarketContext context = new MarketContext(symbol, ts, candles, indicators(candles), price, session,
            rnd.nextInt(10) < 7 ? gamma(rnd, price) : null,
            rnd.nextBoolean() ? flow(rnd, price) : null,
            rnd.nextInt(10) < 7 ? intel(rnd) : null,
            rnd.nextInt(10) == 0 ? new PortfolioRiskFlags(true, false) : PortfolioRiskFlags.CLEAR,
            false);

        UnifiedBiasState bias = rnd.nextInt(100) < 85 ? bias(rnd, symbol) : null;
        return new SyntheticInput(signal, context, bias, positions(rnd, index));
    }

    private static List<Candle> candles(Random rnd, double base, Instant end) {
        List<Candle> candles = new ArrayList<>(CANDLES);
        double drift = (rnd.nextDouble() - 0.5) * 0.004;
        double close = base;
        for (int k = 0; k < CANDLES; k++) {
            double open = close;
            close = round2(open * (1 + drift + rnd.nextGaussian() * 0.003));
            double high = round2(Math.max(open, close) * (1 + rnd.nextDouble() * 0.002));
            double low = round2(Math.min(open, close) * (1 - rnd.nextDouble() * 0.002));
            Instant ts = end.minus(Duration.ofMinutes((long) (CANDLES - 1 - k) * 5));
            candles.add(new Candle(ts, open, high, low, close, 10_000L + rnd.nextInt(90_000)));
        }
        return candles;
    }

    private static Map<String, List<Double>> indicators(List<Candle> candles) {
        List<Double> closes = candles.stream().map(Candle::close).toList();
        Map<String, List<Double>> indicators = new TreeMap<>();
        indicators.put(MarketContext.EMA_8, List.of(TechnicalIndicators.ema(closes, 8)));
        indicators.put(MarketContext.EMA_13, List.of(TechnicalIndicators.ema(closes, 13)));
        indicators.put(MarketContext.EMA_21, List.of(TechnicalIndicators.ema(closes, 21)));
        indicators.put(MarketContext.ATR, List.of(TechnicalIndicators.atr(candles, 14)));
        return indicators;
    }

    private static GammaContext gamma(Random rnd, double price) {
        double net = (rnd.nextDouble() * 2 - 1) * 5e8;
        Double upstream = rnd.nextInt(5) == 0 ? 0.9 : null;
        String dealer = net > 0 ? "long" : "short";
        return new GammaContext(net, round2(price * (1 + (rnd.nextDouble() - 0.5) * 0.02)), dealer,
            List.of(Math.round(price) * 1.0, Math.round(price) + 5.0), upstream);
    }

    private static OptionsFlow flow(Random rnd, double price) {
        double strike = Math.round(price);
        return new OptionsFlow(List.of(
            new OptionsFlow.Entry(OptionType.CALL, strike, 500L + rnd.nextInt(5_000), 1.5 + rnd.nextDouble() * 3),
            new OptionsFlow.Entry(OptionType.PUT, strike, 500L + rnd.nextInt(5_000), 1.5 + rnd.nextDouble() * 3)));
    }

    private static MarketIntel intel(Random rnd) {
        return new MarketIntel(REGIMES[rnd.nextInt(REGIMES.length)], 5 + rnd.nextInt(95),
            GEX_STATES[rnd.nextInt(GEX_STATES.length)], rnd.nextInt(8) == 0 ? "THIN" : "NORMAL");
    }

    private static UnifiedBiasState bias(Random rnd, String symbol) {
        BiasDirection[] dirs = BiasDirection.values();
        UnifiedBiasState state = UnifiedBiasState.of(symbol, dirs[rnd.nextInt(dirs.length)],
                0.4 + rnd.nextDouble() * 0.55, 0.5 + rnd.nextDouble() * 0.7, HINTS[rnd.nextInt(HINTS.length)])
            .withRegime(rnd.nextInt(4) == 0 ? "RANGE" : "TREND", rnd.nextDouble() * 100,
                MACROS[rnd.nextInt(MACROS.length)], rnd.nextDouble() * 0.3, rnd.nextInt(20) == 0,
                rnd.nextInt(4) == 0 ? "EXPANDING" : "STABLE");
        int roll = rnd.nextInt(20);
        if (roll < 2) {
            state = state.withStaleness(true, 45);
        } else if (roll == 2) {
            state = state.withSuppression(List.of("chop filter active"));
        }
        return state;
    }

    private static List<OpenPosition> positions(Random rnd, int index) {
        int count = rnd.nextInt(4);
        List<OpenPosition> positions = new ArrayList<>(count);
        for (int p = 0; p < count; p++) {
            positions.add(new OpenPosition("pos-" + index + "-" + p, SYMBOLS[rnd.nextInt(SYMBOLS.length)],
                rnd.nextBoolean() ? OptionType.CALL : OptionType.PUT, 1 + rnd.nextInt(3),
                round2(1 + rnd.nextDouble() * 5)));
        }
        return positions;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
