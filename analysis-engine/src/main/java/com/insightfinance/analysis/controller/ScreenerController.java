package com.insightfinance.analysis.controller;

import com.insightfinance.analysis.model.ScreeningRequest;
import com.insightfinance.analysis.model.ScreeningStrategy;
import com.insightfinance.analysis.service.ScreenerService;
import com.insightfinance.common.model.MarketBreadth;
import com.insightfinance.common.model.ScreeningResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/screener")
public class ScreenerController {

    private final ScreenerService screenerService;

    public ScreenerController(ScreenerService screenerService) {
        this.screenerService = screenerService;
    }

    @PostMapping
    public Mono<ResponseEntity<ScreeningResult>> screen(@RequestBody ScreeningRequest request) {
        if (!request.isValid()) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return screenerService.screen(request)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/breadth")
    public Mono<MarketBreadth> breadth() {
        return screenerService.getMarketBreadth();
    }

    @GetMapping("/strategies")
    public Map<String, Map<String, String>> strategies() {
        Map<String, Map<String, String>> strategies = new LinkedHashMap<>();
        Arrays.stream(ScreeningStrategy.values()).forEach(s -> strategies.put(s.wireName(),
            Map.of("name", s.displayName(), "description", s.description())));
        return strategies;
    }
}
