package com.insightfinance.common.classifier;

import com.insightfinance.common.model.AssetType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AssetTypeClassifierTest {

    @Nested
    @DisplayName("classify()")
    class ClassifyTests {

        @Test
        @DisplayName("known crypto tickers → CRYPTO")
        void cryptoTickers() {
            assertEquals(AssetType.CRYPTO, AssetTypeClassifier.classify("BTC"));
            assertEquals(AssetType.CRYPTO, AssetTypeClassifier.classify("ETH"));
            assertEquals(AssetType.CRYPTO, AssetTypeClassifier.classify("SOL"));
        }

        @Test
        @DisplayName("crypto pattern wins over forex shape")
        void cryptoPairBeatsForex() {
            // six characters containing USD, but BTC is checked first
            assertEquals(AssetType.CRYPTO, AssetTypeClassifier.classify("BTCUSD"));
        }

        @Test
        @DisplayName("lower-case input is classified like upper-case")
        void caseInsensitive() {
            assertEquals(AssetType.CRYPTO, AssetTypeClassifier.classify("eth"));
        }

        @Test
        @DisplayName("six-character currency pair → FOREX")
        void forexPair() {
            assertEquals(AssetType.FOREX, AssetTypeClassifier.classify("EURUSD"));
            assertEquals(AssetType.FOREX, AssetTypeClassifier.classify("GBPJPY"));
        }

        @Test
        @DisplayName("currency code without six characters → STOCK")
        void currencyCodeWrongLength() {
            assertEquals(AssetType.STOCK, AssetTypeClassifier.classify("USDX"));
        }

        @Test
        @DisplayName("plain equity tickers → STOCK")
        void stocks() {
            assertEquals(AssetType.STOCK, AssetTypeClassifier.classify("AAPL"));
            assertEquals(AssetType.STOCK, AssetTypeClassifier.classify("MSFT"));
            assertEquals(AssetType.STOCK, AssetTypeClassifier.classify("SPY"));
        }

        @Test
        @DisplayName("null or blank → STOCK")
        void nullOrBlank() {
            assertEquals(AssetType.STOCK, AssetTypeClassifier.classify(null));
            assertEquals(AssetType.STOCK, AssetTypeClassifier.classify("  "));
        }
    }

    @Nested
    @DisplayName("Symbols")
    class SymbolsTests {

        @Test
        void normalizeTrimsAndUpperCases() {
            assertEquals("AAPL", Symbols.normalize("  aapl "));
            assertNull(Symbols.normalize(null));
        }

        @Test
        void acceptsTickersWithDotsAndDashes() {
            assertTrue(Symbols.isValid("BRK.B"));
            assertTrue(Symbols.isValid("BTC-USD"));
            assertTrue(Symbols.isValid("msft"));
        }

        @Test
        void rejectsEmptyOverlongOrPunctuated() {
            assertFalse(Symbols.isValid(null));
            assertFalse(Symbols.isValid(""));
            assertFalse(Symbols.isValid("ABCDEFGHIJK"));
            assertFalse(Symbols.isValid("AA PL"));
            assertFalse(Symbols.isValid("AAPL;"));
        }
    }
}
