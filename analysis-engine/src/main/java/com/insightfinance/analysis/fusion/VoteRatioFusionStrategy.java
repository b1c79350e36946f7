package com.insightfinance.analysis.fusion;

import com.insightfinance.common.model.BollingerBands;
import com.insightfinance.common.model.IndicatorSet;
import com.insightfinance.common.model.IndicatorVote;
import com.insightfinance.common.model.MacdResult;
import com.insightfinance.common.model.RiskLevel;
import com.insightfinance.common.model.SignalStrength;
import com.insightfinance.common.model.TradingSignal;
import com.insightfinance.common.model.TrendDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Default {@link SignalFusionEngine}: every present indicator casts a vote.
 *
 * <h3>Vote weights</h3>
 * <pre>
 *   strong reading (RSI &lt;30 / &gt;70, price beyond a band,
 *                   MACD crossover, EMA alignment)         → 1.0
 *   weak reading   (RSI 30–40 / 60–70, price vs middle band,
 *                   Stochastic, Williams %R)                → 0.5
 *   neutral                                                  → 0.0 (still evaluated)
 * </pre>
 *
 * <h3>Decision</h3>
 * <pre>
 *   buyRatio  = buyVotes  / evaluated
 *   sellRatio = sellVotes / evaluated
 *   buyRatio  &gt; 0.6 → BUY     (STRONG if &gt; 0.8, else MODERATE)
 *   sellRatio &gt; 0.6 → SELL    (STRONG if &gt; 0.8, else MODERATE)
 *   otherwise       → HOLD    (WEAK)
 *   confidence = max(buyRatio, sellRatio) × 100
 * </pre>
 *
 * <p>Trend comes from the EMA20 / EMA50 / price alignment only.
 * This class is stateless and thread-safe.
 */
public class VoteRatioFusionStrategy implements SignalFusionEngine {

    public static final String RSI = "rsi";
    public static final String MACD = "macd";
    public static final String BOLLINGER = "bollinger";
    public static final String STOCHASTIC = "stochastic";
    public static final String WILLIAMS_R = "williams_r";
    public static final String EMA_TREND = "ema_trend";

    private static final double FULL_VOTE = 1.0;
    private static final double HALF_VOTE = 0.5;

    private static final double DECISION_THRESHOLD = 0.6;
    private static final double STRONG_THRESHOLD   = 0.8;

    @Override
    public FusionResult generateSignals(double currentPrice, IndicatorSet indicators) {
        Tally tally = new Tally();

        indicators.rsi().ifPresent(rsi -> voteRsi(tally, rsi));
        indicators.macd().ifPresent(macd -> voteMacd(tally, macd));
        indicators.bollingerBands().ifPresent(bb -> voteBollinger(tally, currentPrice, bb));
        indicators.stochastic().ifPresent(stoch -> voteStochastic(tally, stoch.k()));
        indicators.williamsR().ifPresent(wr -> voteWilliams(tally, wr));
        if (indicators.ema20().isPresent() && indicators.ema50().isPresent()) {
            voteEmaTrend(tally, currentPrice, indicators.ema20().getAsDouble(), indicators.ema50().getAsDouble());
        }

        return decide(tally);
    }

    // ── votes ────────────────────────────────────────────────────────────────

    private void voteRsi(Tally t, double rsi) {
        if (rsi < 30) {
            t.buy(RSI, IndicatorVote.STRONG_BUY, FULL_VOTE, format("RSI oversold at %.1f", rsi));
        } else if (rsi < 40) {
            t.buy(RSI, IndicatorVote.BUY, HALF_VOTE, format("RSI approaching oversold at %.1f", rsi));
        } else if (rsi > 70) {
            t.sell(RSI, IndicatorVote.STRONG_SELL, FULL_VOTE, format("RSI overbought at %.1f", rsi));
        } else if (rsi > 60) {
            t.sell(RSI, IndicatorVote.SELL, HALF_VOTE, format("RSI approaching overbought at %.1f", rsi));
        } else {
            t.neutral(RSI);
        }
    }

    private void voteMacd(Tally t, MacdResult macd) {
        if (macd.macd() > macd.signal() && macd.histogram() > 0) {
            t.buy(MACD, IndicatorVote.BUY, FULL_VOTE, "MACD bullish crossover");
        } else if (macd.macd() < macd.signal() && macd.histogram() < 0) {
            t.sell(MACD, IndicatorVote.SELL, FULL_VOTE, "MACD bearish crossover");
        } else {
            t.neutral(MACD);
        }
    }

    private void voteBollinger(Tally t, double price, BollingerBands bb) {
        if (price <= bb.lower()) {
            t.buy(BOLLINGER, IndicatorVote.STRONG_BUY, FULL_VOTE,
                format("Price at lower Bollinger Band (%.1f%%)", bb.percentB()));
        } else if (price >= bb.upper()) {
            t.sell(BOLLINGER, IndicatorVote.STRONG_SELL, FULL_VOTE,
                format("Price at upper Bollinger Band (%.1f%%)", bb.percentB()));
        } else if (price < bb.middle()) {
            t.buy(BOLLINGER, IndicatorVote.BUY, HALF_VOTE, null);
        } else if (price > bb.middle()) {
            t.sell(BOLLINGER, IndicatorVote.SELL, HALF_VOTE, null);
        } else {
            t.neutral(BOLLINGER);
        }
    }

    private void voteStochastic(Tally t, double k) {
        if (k < 20) {
            t.buy(STOCHASTIC, IndicatorVote.BUY, HALF_VOTE, format("Stochastic oversold at %.1f%%", k));
        } else if (k > 80) {
            t.sell(STOCHASTIC, IndicatorVote.SELL, HALF_VOTE, format("Stochastic overbought at %.1f%%", k));
        } else {
            t.neutral(STOCHASTIC);
        }
    }

    private void voteWilliams(Tally t, double wr) {
        if (wr < -80) {
            t.buy(WILLIAMS_R, IndicatorVote.BUY, HALF_VOTE, format("Williams %%R oversold at %.1f", wr));
        } else if (wr > -20) {
            t.sell(WILLIAMS_R, IndicatorVote.SELL, HALF_VOTE, format("Williams %%R overbought at %.1f", wr));
        } else {
            t.neutral(WILLIAMS_R);
        }
    }

    private void voteEmaTrend(Tally t, double price, double ema20, double ema50) {
        if (ema20 > ema50 && price > ema20) {
            t.buy(EMA_TREND, IndicatorVote.BUY, FULL_VOTE, "Price above rising EMAs (bullish trend)");
            t.trend = TrendDirection.BULLISH;
        } else if (ema20 < ema50 && price < ema20) {
            t.sell(EMA_TREND, IndicatorVote.SELL, FULL_VOTE, "Price below falling EMAs (bearish trend)");
            t.trend = TrendDirection.BEARISH;
        } else {
            t.neutral(EMA_TREND);
        }
    }

    // ── decision ─────────────────────────────────────────────────────────────

    private FusionResult decide(Tally t) {
        if (t.evaluated == 0) {
            return new FusionResult(TradingSignal.HOLD, SignalStrength.WEAK, 0.0, t.trend,
                RiskLevel.MEDIUM, List.of(), Map.of(), 0.0, 0.0, 0);
        }

        double buyRatio  = t.buyVotes / t.evaluated;
        double sellRatio = t.sellVotes / t.evaluated;

        TradingSignal signal;
        SignalStrength strength;
        if (buyRatio > DECISION_THRESHOLD) {
            signal   = TradingSignal.BUY;
            strength = buyRatio > STRONG_THRESHOLD ? SignalStrength.STRONG : SignalStrength.MODERATE;
        } else if (sellRatio > DECISION_THRESHOLD) {
            signal   = TradingSignal.SELL;
            strength = sellRatio > STRONG_THRESHOLD ? SignalStrength.STRONG : SignalStrength.MODERATE;
        } else {
            signal   = TradingSignal.HOLD;
            strength = SignalStrength.WEAK;
        }

        double confidence = Math.max(buyRatio, sellRatio) * 100;
        return new FusionResult(signal, strength, confidence, t.trend, RiskLevel.fromConfidence(confidence),
            Collections.unmodifiableList(t.reasoning), Collections.unmodifiableMap(t.votes),
            t.buyVotes, t.sellVotes, t.evaluated);
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }

    /** Mutable accumulator local to one {@link #generateSignals} call. */
    private static final class Tally {
        double buyVotes;
        double sellVotes;
        int evaluated;
        TrendDirection trend = TrendDirection.SIDEWAYS;
        final List<String> reasoning = new ArrayList<>();
        final Map<String, IndicatorVote> votes = new LinkedHashMap<>();

        void buy(String indicator, IndicatorVote vote, double weight, String reason) {
            cast(indicator, vote, reason);
            buyVotes += weight;
        }

        void sell(String indicator, IndicatorVote vote, double weight, String reason) {
            cast(indicator, vote, reason);
            sellVotes += weight;
        }

        void neutral(String indicator) {
            cast(indicator, IndicatorVote.NEUTRAL, null);
        }

        private void cast(String indicator, IndicatorVote vote, String reason) {
            evaluated++;
            votes.put(indicator, vote);
            if (reason != null) reasoning.add(reason);
        }
    }
}
