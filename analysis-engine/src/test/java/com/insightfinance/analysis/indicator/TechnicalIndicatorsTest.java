package com.insightfinance.analysis.indicator;

import com.insightfinance.common.model.BollingerBands;
import com.insightfinance.common.model.MacdResult;
import com.insightfinance.common.model.StochasticResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link TechnicalIndicators}.
 * Series are oldest-first throughout.
 */
class TechnicalIndicatorsTest {

    private static List<Double> rising(int n) {
        List<Double> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(100.0 + i);
        return out;
    }

    private static List<Double> falling(int n) {
        List<Double> out = rising(n);
        Collections.reverse(out);
        return out;
    }

    private static List<Double> flat(int n, double value) {
        return new ArrayList<>(Collections.nCopies(n, value));
    }

    private static List<Double> randomWalk(long seed, int n) {
        Random random = new Random(seed);
        List<Double> out = new ArrayList<>(n);
        double price = 100;
        for (int i = 0; i < n; i++) {
            price = Math.max(1, price + random.nextGaussian() * 2);
            out.add(price);
        }
        return out;
    }

    // ── insufficient data ──────────────────────────────────────────────────

    @Nested
    @DisplayName("insufficient data → empty, never a numeric guess")
    class InsufficientData {

        @Test
        void movingAverages() {
            assertTrue(TechnicalIndicators.sma(rising(19), 20).isEmpty());
            assertTrue(TechnicalIndicators.ema(rising(49), 50).isEmpty());
            assertTrue(TechnicalIndicators.sma(null, 5).isEmpty());
        }

        @Test
        @DisplayName("RSI and ATR need period + 1 points")
        void rsiAndAtr() {
            assertTrue(TechnicalIndicators.rsi(rising(14), 14).isEmpty());
            assertTrue(TechnicalIndicators.atr(rising(14), 14).isEmpty());
            assertTrue(TechnicalIndicators.rsi(rising(15), 14).isPresent());
            assertTrue(TechnicalIndicators.atr(rising(15), 14).isPresent());
        }

        @Test
        @DisplayName("MACD needs slow + signal points")
        void macd() {
            assertTrue(TechnicalIndicators.macd(rising(34)).isEmpty());
            assertTrue(TechnicalIndicators.macd(rising(35)).isPresent());
        }

        @Test
        void oscillatorsAndBands() {
            assertTrue(TechnicalIndicators.bollingerBands(rising(19)).isEmpty());
            assertTrue(TechnicalIndicators.stochastic(rising(15)).isEmpty());
            assertTrue(TechnicalIndicators.williamsR(rising(13), 14).isEmpty());
        }

        @Test
        @DisplayName("non-positive periods → empty")
        void nonPositivePeriods() {
            assertTrue(TechnicalIndicators.sma(rising(10), 0).isEmpty());
            assertTrue(TechnicalIndicators.ema(rising(10), -1).isEmpty());
            assertTrue(TechnicalIndicators.rsi(rising(10), 0).isEmpty());
            assertTrue(TechnicalIndicators.williamsR(rising(10), 0).isEmpty());
        }
    }

    // ── moving averages ────────────────────────────────────────────────────

    @Nested
    @DisplayName("SMA / EMA")
    class MovingAverages {

        @Test
        @DisplayName("SMA averages the trailing window only")
        void smaTrailingWindow() {
            assertEquals(4.0, TechnicalIndicators.sma(List.of(1.0, 2.0, 3.0, 4.0, 5.0), 3).getAsDouble(), 1e-12);
        }

        @Test
        @DisplayName("EMA is seeded with the first value")
        void emaSeededWithFirstValue() {
            // k = 2/3 → 2·(2/3) + 1·(1/3)
            assertEquals(5.0 / 3.0, TechnicalIndicators.ema(List.of(1.0, 2.0), 2).getAsDouble(), 1e-12);
            assertEquals(10.0, TechnicalIndicators.ema(flat(30, 10.0), 20).getAsDouble(), 1e-12);
        }
    }

    // ── RSI ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("RSI")
    class Rsi {

        @Test
        @DisplayName("strictly increasing → 100")
        void increasing() {
            assertEquals(100.0, TechnicalIndicators.rsi(rising(30), 14).getAsDouble(), 1e-12);
        }

        @Test
        @DisplayName("strictly decreasing → 0")
        void decreasing() {
            assertEquals(0.0, TechnicalIndicators.rsi(falling(30), 14).getAsDouble(), 1e-12);
        }

        @Test
        @DisplayName("equal gains and losses → 50")
        void balanced() {
            List<Double> zigzag = new ArrayList<>();
            for (int i = 0; i < 15; i++) zigzag.add(i % 2 == 0 ? 10.0 : 11.0);
            assertEquals(50.0, TechnicalIndicators.rsi(zigzag, 14).getAsDouble(), 1e-12);
        }
    }

    // ── MACD ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("MACD")
    class Macd {

        @Test
        @DisplayName("flat series → all components zero")
        void flatSeries() {
            MacdResult macd = TechnicalIndicators.macd(flat(50, 20.0)).orElseThrow();
            assertEquals(0.0, macd.macd(), 1e-12);
            assertEquals(0.0, macd.signal(), 1e-12);
            assertEquals(0.0, macd.histogram(), 1e-12);
        }

        @Test
        @DisplayName("uptrend → positive MACD line; histogram = macd − signal")
        void uptrend() {
            MacdResult macd = TechnicalIndicators.macd(rising(50)).orElseThrow();
            assertTrue(macd.macd() > 0);
            assertEquals(macd.macd() - macd.signal(), macd.histogram(), 1e-12);
        }
    }

    // ── Bollinger Bands ────────────────────────────────────────────────────

    @Nested
    @DisplayName("Bollinger Bands")
    class Bollinger {

        @Test
        @DisplayName("upper ≥ middle ≥ lower across random walks")
        void ordering() {
            for (long seed = 1; seed <= 25; seed++) {
                BollingerBands bb = TechnicalIndicators.bollingerBands(randomWalk(seed, 40)).orElseThrow();
                assertTrue(bb.upper() >= bb.middle(), "seed " + seed);
                assertTrue(bb.middle() >= bb.lower(), "seed " + seed);
                assertEquals(bb.upper() - bb.lower(), bb.width(), 1e-9);
            }
        }

        @Test
        @DisplayName("flat series → zero width, %B = 50")
        void flatSeries() {
            BollingerBands bb = TechnicalIndicators.bollingerBands(flat(25, 10.0)).orElseThrow();
            assertEquals(10.0, bb.middle(), 1e-12);
            assertEquals(0.0, bb.width(), 1e-12);
            assertEquals(50.0, bb.percentB(), 1e-12);
        }
    }

    // ── Oscillators ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Stochastic / Williams %R")
    class Oscillators {

        @Test
        @DisplayName("%K within [0,100] and %R within [−100,0] for random walks")
        void ranges() {
            for (long seed = 1; seed <= 25; seed++) {
                List<Double> prices = randomWalk(seed, 40);
                StochasticResult stoch = TechnicalIndicators.stochastic(prices).orElseThrow();
                double wr = TechnicalIndicators.williamsR(prices, 14).getAsDouble();
                assertTrue(stoch.k() >= 0 && stoch.k() <= 100, "seed " + seed);
                assertTrue(stoch.d() >= 0 && stoch.d() <= 100, "seed " + seed);
                assertTrue(wr >= -100 && wr <= 0, "seed " + seed);
            }
        }

        @Test
        @DisplayName("close at the window high → %K 100, %R 0")
        void atHigh() {
            assertEquals(100.0, TechnicalIndicators.stochastic(rising(20)).orElseThrow().k(), 1e-12);
            assertEquals(0.0, TechnicalIndicators.williamsR(rising(20), 14).getAsDouble(), 1e-12);
        }

        @Test
        @DisplayName("close at the window low → %K 0, %R −100")
        void atLow() {
            assertEquals(0.0, TechnicalIndicators.stochastic(falling(20)).orElseThrow().k(), 1e-12);
            assertEquals(-100.0, TechnicalIndicators.williamsR(falling(20), 14).getAsDouble(), 1e-12);
        }

        @Test
        @DisplayName("flat window → %K 50, %R −50")
        void flatWindow() {
            assertEquals(50.0, TechnicalIndicators.stochastic(flat(20, 5.0)).orElseThrow().k(), 1e-12);
            assertEquals(-50.0, TechnicalIndicators.williamsR(flat(20, 5.0), 14).getAsDouble(), 1e-12);
        }
    }

    // ── ATR ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("ATR degenerates to the mean absolute close-to-close change")
    void atrCloseOnly() {
        List<Double> zigzag = new ArrayList<>();
        for (int i = 0; i < 20; i++) zigzag.add(i % 2 == 0 ? 10.0 : 12.0);
        assertEquals(2.0, TechnicalIndicators.atr(zigzag, 14).getAsDouble(), 1e-12);
    }
}
