package com.insightfinance.analysis.fusion;

import com.insightfinance.common.model.IndicatorVote;
import com.insightfinance.common.model.RiskLevel;
import com.insightfinance.common.model.SignalStrength;
import com.insightfinance.common.model.TradingSignal;
import com.insightfinance.common.model.TrendDirection;

import java.util.List;
import java.util.Map;

/**
 * Output of a {@link SignalFusionEngine}. {@code votes} preserves evaluation order.
 */
public record FusionResult(
    TradingSignal signal,
    SignalStrength strength,
    double confidence,
    TrendDirection trend,
    RiskLevel risk,
    List<String> reasoning,
    Map<String, IndicatorVote> votes,
    double buyVotes,
    double sellVotes,
    int evaluated
) {}
