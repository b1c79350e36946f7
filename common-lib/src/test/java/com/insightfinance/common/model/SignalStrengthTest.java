package com.insightfinance.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignalStrengthTest {

    @Test
    @DisplayName("levels run 1..5 and round-trip through fromLevel")
    void levels() {
        assertEquals(1, SignalStrength.VERY_WEAK.level());
        assertEquals(5, SignalStrength.VERY_STRONG.level());
        assertEquals(SignalStrength.STRONG, SignalStrength.fromLevel(4));
        assertThrows(IllegalArgumentException.class, () -> SignalStrength.fromLevel(6));
    }

    @Test
    void isAtLeast() {
        assertTrue(SignalStrength.VERY_STRONG.isAtLeast(SignalStrength.STRONG));
        assertTrue(SignalStrength.STRONG.isAtLeast(SignalStrength.STRONG));
        assertFalse(SignalStrength.MODERATE.isAtLeast(SignalStrength.STRONG));
    }

    @Test
    @DisplayName("risk follows confidence bands: >80 low, >60 medium, else high")
    void riskFromConfidence() {
        assertEquals(RiskLevel.LOW, RiskLevel.fromConfidence(85));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromConfidence(80));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromConfidence(61));
        assertEquals(RiskLevel.HIGH, RiskLevel.fromConfidence(60));
        assertEquals(RiskLevel.HIGH, RiskLevel.fromConfidence(0));
    }
}
