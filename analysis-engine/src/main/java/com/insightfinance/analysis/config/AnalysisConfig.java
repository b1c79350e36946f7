package com.insightfinance.analysis.config;

import com.insightfinance.analysis.fusion.SignalFusionEngine;
import com.insightfinance.analysis.fusion.VoteRatioFusionStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

    @Bean
    public SignalFusionEngine signalFusionEngine() {
        return new VoteRatioFusionStrategy();
    }
}
