package com.decisionplatform.analysis.agent;

import com.decisionplatform.analysis.indicator.TechnicalIndicators;
import com.decisionplatform.common.model.Candle;
import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.EvaluatorOutput;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.MarketIntel;
import com.decisionplatform.common.model.Recommendation;
import com.decisionplatform.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Core risk evaluator with veto authority in the meta-decision.
 *
 * <p>Risk points, read against the trade direction:
 * <pre>
 *   RSI stretched in the trade direction (long &gt; 70, short &lt; 30)   +2
 *   adverse excursion from the 20-candle extreme &gt; 5%                 +2
 *   ATR / price &gt; 3%  (+1),  &gt; 5%  (+2)
 *   thin liquidity                                                  +1
 *   IV percentile &gt; 95                                               +1
 * </pre>
 * HIGH (≥4) rejects, MEDIUM (2–3) holds, LOW approves. Exceeded portfolio risk flags
 * reject outright.
 */
@Component
public class RiskEvaluator implements SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RiskEvaluator.class);

    private static final double OVERBOUGHT = 70;
    private static final double OVERSOLD   = 30;
    private static final double MAX_ADVERSE_EXCURSION = 0.05;
    private static final double ATR_ELEVATED = 0.03;
    private static final double ATR_EXTREME  = 0.05;
    private static final int LOOKBACK = 20;

    @Override
    public EvaluatorType type() { return EvaluatorType.RISK; }

    @Override
    public boolean shouldActivate(Signal signal, MarketContext context) {
        return true;
    }

    @Override
    public EvaluatorOutput analyze(Signal signal, MarketContext context) {
        log.debug("[RiskEvaluator] Analyzing signalId={} symbol={}", signal.signalId(), signal.symbol());

        Map<String, Object> metadata = new HashMap<>();
        if (context.riskFlags().anyExceeded()) {
            metadata.put("riskLevel", "LIMIT");
            return EvaluatorOutput.of(type(), Recommendation.REJECT, 0.9,
                "portfolio risk limit exceeded", metadata);
        }

        double price = context.currentPrice();
        List<Double> closes = context.closes();
        double rsi = TechnicalIndicators.rsi(closes, 14);
        double excursion = adverseExcursion(context.candles(), signal.direction(), price);
        double atr = context.latest(MarketContext.ATR);
        if (Double.isNaN(atr)) {
            atr = TechnicalIndicators.atr(context.candles(), 14);
        }
        double atrRatio = Double.isNaN(atr) || price <= 0 ? Double.NaN : atr / price;

        int points = 0;
        if (!Double.isNaN(rsi)) {
            if (signal.direction() == Direction.LONG && rsi > OVERBOUGHT) points += 2;
            if (signal.direction() == Direction.SHORT && rsi < OVERSOLD) points += 2;
        }
        if (excursion > MAX_ADVERSE_EXCURSION) points += 2;
        if (!Double.isNaN(atrRatio)) {
            if (atrRatio > ATR_EXTREME) points += 2;
            else if (atrRatio > ATR_ELEVATED) points += 1;
        }
        MarketIntel intel = context.intel().orElse(null);
        if (intel != null) {
            if ("THIN".equalsIgnoreCase(intel.liquidityState())) points += 1;
            if (intel.ivPercentile() > 95) points += 1;
        }

        String riskLevel = points >= 4 ? "HIGH" : points >= 2 ? "MEDIUM" : "LOW";
        metadata.put("riskLevel", riskLevel);
        metadata.put("riskPoints", points);
        metadata.put("rsi", EvaluatorSupport.orNa(rsi));
        metadata.put("adverseExcursion", excursion);
        metadata.put("atrRatio", EvaluatorSupport.orNa(atrRatio));

        String summary = String.format(Locale.ROOT, "Risk Level: %s | RSI=%s | Excursion=%.2f%% | ATR/price=%s",
            riskLevel, EvaluatorSupport.fmt(rsi), excursion * 100,
            Double.isNaN(atrRatio) ? "N/A" : String.format(Locale.ROOT, "%.4f", atrRatio));

        return switch (riskLevel) {
            case "HIGH"   -> EvaluatorOutput.of(type(), Recommendation.REJECT,
                                 Math.min(1.0, 0.6 + 0.1 * (points - 4)), summary, metadata);
            case "MEDIUM" -> EvaluatorOutput.of(type(), Recommendation.HOLD, 0.55, summary, metadata);
            default       -> EvaluatorOutput.of(type(), Recommendation.APPROVE, points == 0 ? 0.75 : 0.7,
                                 summary, metadata);
        };
    }

    /** Move against the trade from the recent extreme: drawdown for longs, rally for shorts. */
    private static double adverseExcursion(List<Candle> candles, Direction direction, double price) {
        if (candles.isEmpty() || price <= 0) return 0.0;
        List<Candle> recent = candles.subList(Math.max(0, candles.size() - LOOKBACK), candles.size());
        if (direction == Direction.LONG) {
            double high = recent.stream().mapToDouble(Candle::high).max().orElse(price);
            return high > 0 ? Math.max(0.0, (high - price) / high) : 0.0;
        }
        double low = recent.stream().mapToDouble(Candle::low).min().orElse(price);
        return low > 0 ? Math.max(0.0, (price - low) / low) : 0.0;
    }
}
