package com.insightfinance.analysis.indicator;

import com.insightfinance.common.model.BollingerBands;
import com.insightfinance.common.model.MacdResult;
import com.insightfinance.common.model.StochasticResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Pure calculation utilities for technical indicators.
 * Input prices are expected oldest-first (last element = most recent close).
 *
 * <p>Every function returns an empty optional when the series is shorter than the
 * indicator needs, so "insufficient data" is never confused with a legitimate zero.
 */
public final class TechnicalIndicators {

    public static final int RSI_PERIOD = 14;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int BOLLINGER_PERIOD = 20;
    public static final double BOLLINGER_K = 2.0;
    public static final int STOCHASTIC_PERIOD = 14;
    public static final int STOCHASTIC_SMOOTHING = 3;
    public static final int WILLIAMS_PERIOD = 14;
    public static final int ATR_PERIOD = 14;

    private TechnicalIndicators() {}

    // ── Simple Moving Average ────────────────────────────────────────────────

    /**
     * @param prices  closing prices, oldest-first
     * @param period  number of trailing values averaged
     * @return SMA of the last {@code period} values, or empty if insufficient data
     */
    public static OptionalDouble sma(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return OptionalDouble.empty();
        double sum = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) sum += prices.get(i);
        return OptionalDouble.of(sum / period);
    }

    // ── Exponential Moving Average ───────────────────────────────────────────

    /**
     * Seeded with the first value of the series (not an SMA seed), then smoothed over
     * every remaining value with multiplier {@code 2 / (period + 1)}.
     *
     * @param prices  closing prices, oldest-first
     * @param period  EMA period
     * @return most-recent EMA value, or empty if insufficient data
     */
    public static OptionalDouble ema(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return OptionalDouble.empty();
        double k = 2.0 / (period + 1);
        double ema = prices.get(0);
        for (int i = 1; i < prices.size(); i++) {
            ema = prices.get(i) * k + ema * (1 - k);
        }
        return OptionalDouble.of(ema);
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Simple-average RSI over the last {@code period} price changes.
     * @param prices  closing prices, oldest-first
     * @param period  lookback period (typically 14)
     * @return RSI value 0–100 (100 when there is no loss), or empty if insufficient data
     */
    public static OptionalDouble rsi(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period + 1) return OptionalDouble.empty();

        double gains = 0;
        double losses = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            double change = prices.get(i) - prices.get(i - 1);
            if (change > 0) gains += change;
            else losses += -change;
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;

        if (avgLoss == 0) return OptionalDouble.of(100.0);
        double rs = avgGain / avgLoss;
        return OptionalDouble.of(100.0 - (100.0 / (1.0 + rs)));
    }

    // ── MACD ────────────────────────────────────────────────────────────────

    /**
     * MACD line = EMA(fast) − EMA(slow) over the full series. The signal line is the
     * EMA(signal) of the MACD line recomputed for every prefix ending at index
     * {@code slow} onward; histogram = MACD − signal.
     */
    public static Optional<MacdResult> macd(List<Double> prices, int fast, int slow, int signal) {
        if (prices == null || fast <= 0 || slow <= 0 || signal <= 0
            || prices.size() < slow + signal) return Optional.empty();

        OptionalDouble emaFast = ema(prices, fast);
        OptionalDouble emaSlow = ema(prices, slow);
        if (emaFast.isEmpty() || emaSlow.isEmpty()) return Optional.empty();
        double macdLine = emaFast.getAsDouble() - emaSlow.getAsDouble();

        List<Double> macdSeries = new ArrayList<>();
        for (int end = slow; end < prices.size(); end++) {
            List<Double> prefix = prices.subList(0, end + 1);
            OptionalDouble f = ema(prefix, fast);
            OptionalDouble s = ema(prefix, slow);
            if (f.isPresent() && s.isPresent()) {
                macdSeries.add(f.getAsDouble() - s.getAsDouble());
            }
        }

        OptionalDouble signalLine = ema(macdSeries, signal);
        if (signalLine.isEmpty()) return Optional.empty();
        double sig = signalLine.getAsDouble();
        return Optional.of(new MacdResult(macdLine, sig, macdLine - sig));
    }

    public static Optional<MacdResult> macd(List<Double> prices) {
        return macd(prices, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
    }

    // ── Volatility (Standard Deviation) ─────────────────────────────────────

    /** Population standard deviation of the last {@code period} values. */
    public static OptionalDouble stdDev(List<Double> prices, int period) {
        OptionalDouble mean = sma(prices, period);
        if (mean.isEmpty()) return OptionalDouble.empty();
        double m = mean.getAsDouble();
        double variance = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            double diff = prices.get(i) - m;
            variance += diff * diff;
        }
        return OptionalDouble.of(Math.sqrt(variance / period));
    }

    // ── Bollinger Bands ─────────────────────────────────────────────────────

    public static Optional<BollingerBands> bollingerBands(List<Double> prices, int period, double k) {
        OptionalDouble middle = sma(prices, period);
        OptionalDouble sd = stdDev(prices, period);
        if (middle.isEmpty() || sd.isEmpty()) return Optional.empty();

        double mid   = middle.getAsDouble();
        double upper = mid + k * sd.getAsDouble();
        double lower = mid - k * sd.getAsDouble();
        double last  = prices.get(prices.size() - 1);
        double percentB = upper != lower ? (last - lower) / (upper - lower) * 100 : 50.0;
        return Optional.of(new BollingerBands(upper, mid, lower, upper - lower, percentB));
    }

    public static Optional<BollingerBands> bollingerBands(List<Double> prices) {
        return bollingerBands(prices, BOLLINGER_PERIOD, BOLLINGER_K);
    }

    // ── Stochastic Oscillator ───────────────────────────────────────────────

    /**
     * %K for every window ending at index {@code period − 1} onward (50 for a flat window);
     * %D = SMA(%K, smoothing). Needs enough points for {@code smoothing} %K values.
     */
    public static Optional<StochasticResult> stochastic(List<Double> prices, int period, int smoothing) {
        if (prices == null || period <= 0 || smoothing <= 0 || prices.size() < period) return Optional.empty();

        List<Double> kValues = new ArrayList<>();
        for (int i = period - 1; i < prices.size(); i++) {
            double highest = Double.NEGATIVE_INFINITY;
            double lowest  = Double.POSITIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                highest = Math.max(highest, prices.get(j));
                lowest  = Math.min(lowest, prices.get(j));
            }
            kValues.add(highest == lowest ? 50.0 : (prices.get(i) - lowest) / (highest - lowest) * 100);
        }

        OptionalDouble d = sma(kValues, smoothing);
        if (d.isEmpty()) return Optional.empty();
        return Optional.of(new StochasticResult(kValues.get(kValues.size() - 1), d.getAsDouble()));
    }

    public static Optional<StochasticResult> stochastic(List<Double> prices) {
        return stochastic(prices, STOCHASTIC_PERIOD, STOCHASTIC_SMOOTHING);
    }

    // ── Williams %R ─────────────────────────────────────────────────────────

    /** Range −100..0; −50 for a flat window. */
    public static OptionalDouble williamsR(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return OptionalDouble.empty();
        double highest = Double.NEGATIVE_INFINITY;
        double lowest  = Double.POSITIVE_INFINITY;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            highest = Math.max(highest, prices.get(i));
            lowest  = Math.min(lowest, prices.get(i));
        }
        if (highest == lowest) return OptionalDouble.of(-50.0);
        double last = prices.get(prices.size() - 1);
        return OptionalDouble.of((highest - last) / (highest - lowest) * -100);
    }

    // ── Average True Range ──────────────────────────────────────────────────

    /**
     * Close-only approximation: with no separate high/low inputs every true range
     * degenerates to {@code |close_i − close_{i−1}|}; ATR is their mean over the last
     * {@code period} changes.
     */
    public static OptionalDouble atr(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period + 1) return OptionalDouble.empty();
        List<Double> trueRanges = new ArrayList<>(prices.size() - 1);
        for (int i = 1; i < prices.size(); i++) {
            double high = prices.get(i);
            double low = prices.get(i);
            double prevClose = prices.get(i - 1);
            trueRanges.add(Math.max(high - low, Math.max(Math.abs(high - prevClose), Math.abs(low - prevClose))));
        }
        return sma(trueRanges, period);
    }
}
