package com.decisionplatform.analysis.indicator;

import com.decisionplatform.common.model.Candle;

import java.util.List;

/**
 * Pure calculation utilities for technical indicators.
 * Input series are expected most-recent-last (last index = latest close).
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Computes RSI using Wilder's Smoothed Moving Average.
     * @param prices  closing prices, most-recent-last
     * @param period  lookback period (typically 14)
     * @return RSI value 0–100, or NaN if insufficient data
     */
    public static double rsi(List<Double> prices, int period) {
        if (prices == null || prices.size() < period + 1) return Double.NaN;
        int n = prices.size();

        double avgGain = 0;
        double avgLoss = 0;

        for (int i = 1; i <= period; i++) {
            double change = prices.get(i) - prices.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = prices.get(i) - prices.get(i - 1);
            double gain = Math.max(change, 0);
            double loss = Math.max(-change, 0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Simple Moving Average ────────────────────────────────────────────────

    /**
     * SMA over the latest {@code period} values.
     * @return SMA value, or NaN if insufficient data
     */
    public static double sma(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) sum += prices.get(i);
        return sum / period;
    }

    // ── Exponential Moving Average ───────────────────────────────────────────

    /**
     * @return latest EMA value seeded with the oldest price, or NaN if insufficient data
     */
    public static double ema(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double k = 2.0 / (period + 1);
        double ema = prices.get(0);
        for (int i = 1; i < prices.size(); i++) {
            ema = prices.get(i) * k + ema * (1 - k);
        }
        return ema;
    }

    // ── Volatility ──────────────────────────────────────────────────────────

    /** Population standard deviation of the latest {@code period} values. */
    public static double stdDev(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double mean = sma(prices, period);
        double variance = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            double diff = prices.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    /**
     * Simple average of true ranges over the latest {@code period} candles. The oldest
     * candle of the series has no previous close, so its true range is high − low.
     */
    public static double atr(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            Candle c = candles.get(i);
            double tr = c.high() - c.low();
            if (i > 0) {
                double prevClose = candles.get(i - 1).close();
                tr = Math.max(tr, Math.max(Math.abs(c.high() - prevClose), Math.abs(c.low() - prevClose)));
            }
            sum += tr;
        }
        return sum / period;
    }

    // ── Squeeze ─────────────────────────────────────────────────────────────

    /**
     * True when the Bollinger band (20, 2σ) sits inside the Keltner channel (20, 1.5×ATR)
     * for the candle window ending at {@code endExclusive}.
     */
    public static boolean squeezeOn(List<Candle> candles, int endExclusive, int period) {
        if (candles == null || endExclusive > candles.size() || endExclusive < period) return false;
        List<Candle> window = candles.subList(0, endExclusive);
        List<Double> closes = window.stream().map(Candle::close).toList();
        double sd  = stdDev(closes, period);
        double atr = atr(window, period);
        if (Double.isNaN(sd) || Double.isNaN(atr)) return false;
        return 2.0 * sd < 1.5 * atr;
    }

    // ── Signal helpers ───────────────────────────────────────────────────────

    public static String rsiSignal(double rsi) {
        if (Double.isNaN(rsi)) return "INSUFFICIENT_DATA";
        if (rsi < 30) return "OVERSOLD";
        if (rsi > 70) return "OVERBOUGHT";
        return "NEUTRAL";
    }

    /** Bullish stack: ema8 &gt; ema13 &gt; ema21; bearish stack the reverse. */
    public static String emaStack(double ema8, double ema13, double ema21) {
        if (Double.isNaN(ema8) || Double.isNaN(ema13) || Double.isNaN(ema21)) return "INSUFFICIENT_DATA";
        if (ema8 > ema13 && ema13 > ema21) return "BULLISH";
        if (ema8 < ema13 && ema13 < ema21) return "BEARISH";
        return "MIXED";
    }
}
