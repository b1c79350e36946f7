package com.insightfinance.marketdata.controller;

import com.insightfinance.common.classifier.Symbols;
import com.insightfinance.common.model.MarketSummary;
import com.insightfinance.common.model.PriceRecord;
import com.insightfinance.marketdata.model.BatchPriceResponse;
import com.insightfinance.marketdata.model.SymbolSearchRequest;
import com.insightfinance.marketdata.model.SymbolSearchResponse;
import com.insightfinance.marketdata.model.SymbolValidation;
import com.insightfinance.marketdata.model.SymbolsRequest;
import com.insightfinance.marketdata.service.MarketDataService;
import com.insightfinance.marketdata.service.MarketSummaryService;
import com.insightfinance.marketdata.service.SymbolService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/prices")
public class MarketDataController {

    private final MarketDataService marketDataService;
    private final MarketSummaryService marketSummaryService;
    private final SymbolService symbolService;

    public MarketDataController(MarketDataService marketDataService,
                                MarketSummaryService marketSummaryService,
                                SymbolService symbolService) {
        this.marketDataService    = marketDataService;
        this.marketSummaryService = marketSummaryService;
        this.symbolService        = symbolService;
    }

    @GetMapping("/summary")
    public Mono<MarketSummary> summary() {
        return marketSummaryService.getMarketSummary();
    }

    @GetMapping("/{symbol}")
    public Mono<ResponseEntity<PriceRecord>> price(
            @PathVariable String symbol,
            @RequestParam(defaultValue = MarketDataService.DEFAULT_PERIOD) String period) {
        if (!Symbols.isValid(symbol)) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return marketDataService.getPriceWithHistory(symbol, period)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchPriceResponse>> batch(@RequestBody SymbolsRequest request) {
        if (request.symbols() == null || request.symbols().isEmpty()
                || request.symbols().size() > SymbolsRequest.MAX_SYMBOLS
                || !request.symbols().stream().allMatch(Symbols::isValid)) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return marketDataService.getMultiplePrices(request.symbols())
            .map(BatchPriceResponse::from)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/search")
    public ResponseEntity<SymbolSearchResponse> search(@RequestBody SymbolSearchRequest request) {
        if (!request.isValid()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(SymbolSearchResponse.of(request.query(),
            symbolService.search(request.query(), request.effectiveLimit())));
    }

    @GetMapping("/symbols/validate/{symbol}")
    public Mono<SymbolValidation> validate(@PathVariable String symbol) {
        return symbolService.validate(symbol);
    }
}
