package com.decisionplatform.analysis.contract;

import com.decisionplatform.analysis.indicator.TechnicalIndicators;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.OptionType;
import com.decisionplatform.common.model.Signal;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;

/**
 * Nearest-strike selector.
 *
 * <ul>
 *   <li>Strike: current price rounded to the listing increment (5 above 1000, 1 above 100, else 0.5).</li>
 *   <li>Expiration: first Friday on or after trade date + max hold days (exchange calendar date).</li>
 *   <li>Levels on the underlying: stop 1.5 ATR against, target 3 ATR with the trade.</li>
 * </ul>
 * Uses only the signal timestamp, never the wall clock.
 */
public class AtTheMoneyContractSelector implements ContractSelector {

    static final ZoneId EXCHANGE_ZONE = ZoneId.of("America/New_York");
    static final double STOP_ATR   = 1.5;
    static final double TARGET_ATR = 3.0;
    static final double FALLBACK_ATR_FRACTION = 0.005;

    private final int maxHoldDays;

    public AtTheMoneyContractSelector(int maxHoldDays) {
        this.maxHoldDays = Math.max(0, maxHoldDays);
    }

    @Override
    public ContractSpec select(Signal signal, MarketContext context) {
        double price = context.currentPrice();
        double increment = price >= 1000 ? 5.0 : price >= 100 ? 1.0 : 0.5;
        double strike = Math.round(price / increment) * increment;

        LocalDate tradeDate = signal.timestamp().atZone(EXCHANGE_ZONE).toLocalDate();
        LocalDate expiration = tradeDate.plusDays(maxHoldDays)
            .with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));

        double atr = context.latest(MarketContext.ATR);
        if (Double.isNaN(atr) || atr <= 0) {
            atr = TechnicalIndicators.atr(context.candles(), 14);
        }
        if (Double.isNaN(atr) || atr <= 0) {
            atr = price * FALLBACK_ATR_FRACTION;
        }
        int sign = signal.direction().sign();
        return new ContractSpec(
            OptionType.forDirection(signal.direction()),
            strike,
            expiration,
            cents(price),
            cents(price - sign * STOP_ATR * atr),
            cents(price + sign * TARGET_ATR * atr));
    }

    private static double cents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
