package com.insightfinance.analysis.fusion;

import com.insightfinance.common.model.IndicatorSet;

/**
 * Strategy contract for fusing a set of indicator readings into one trading decision.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>:      no logging and no side effects</li>
 *   <li><b>Non-null</b>:  must always return a valid {@link FusionResult}</li>
 * </ul>
 *
 * <p>Current implementation: {@link VoteRatioFusionStrategy}.
 */
public interface SignalFusionEngine {

    /**
     * @param currentPrice latest traded price
     * @param indicators   indicator readings; absent values are skipped, not treated as zero
     * @return a {@link FusionResult}, never {@code null}
     */
    FusionResult generateSignals(double currentPrice, IndicatorSet indicators);
}
