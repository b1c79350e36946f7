package com.insightfinance.analysis.controller;

import com.insightfinance.analysis.model.SignalBatchRequest;
import com.insightfinance.analysis.service.SignalService;
import com.insightfinance.common.classifier.Symbols;
import com.insightfinance.common.model.IndicatorSnapshot;
import com.insightfinance.common.model.MarketOverview;
import com.insightfinance.common.model.SignalBatch;
import com.insightfinance.common.model.SignalBundle;
import com.insightfinance.marketdata.model.SymbolsRequest;
import com.insightfinance.marketdata.service.MarketDataService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/signals")
public class SignalController {

    private final SignalService signalService;

    public SignalController(SignalService signalService) {
        this.signalService = signalService;
    }

    @GetMapping("/{symbol}")
    public Mono<ResponseEntity<SignalBundle>> signal(
            @PathVariable String symbol,
            @RequestParam(defaultValue = MarketDataService.DEFAULT_PERIOD) String period) {
        if (!Symbols.isValid(symbol)) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return signalService.computeSignalBundle(symbol, period)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/indicators/{symbol}")
    public Mono<ResponseEntity<IndicatorSnapshot>> indicators(
            @PathVariable String symbol,
            @RequestParam(defaultValue = MarketDataService.DEFAULT_PERIOD) String period) {
        if (!Symbols.isValid(symbol)) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return signalService.getIndicators(symbol, period)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<SignalBatch>> batch(@RequestBody SignalBatchRequest request) {
        if (!acceptable(request.symbols())) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return signalService.getMultipleSignals(request.symbols(), request.period())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/overview")
    public Mono<ResponseEntity<MarketOverview>> overview(@RequestBody SymbolsRequest request) {
        if (!acceptable(request.symbols())) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return signalService.getMarketOverview(request.symbols())
            .map(ResponseEntity::ok);
    }

    private static boolean acceptable(List<String> symbols) {
        return symbols != null && !symbols.isEmpty()
            && symbols.size() <= SymbolsRequest.MAX_SYMBOLS
            && symbols.stream().allMatch(Symbols::isValid);
    }
}
