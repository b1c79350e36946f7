package com.insightfinance.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.insightfinance")
public class AnalysisEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalysisEngineApplication.class, args);
    }
}
