package com.stockinsights.marketdata.controller;

import com.stockinsights.marketdata.dto.AnalyticalInsightsResponse;
import com.stockinsights.marketdata.dto.HistoricalDataRequest;
import com.stockinsights.marketdata.dto.HistoricalDataResponse;
import com.stockinsights.marketdata.model.CompanyProfile;
import com.stockinsights.marketdata.model.MarketSnapshot;
import com.stockinsights.marketdata.service.MarketInsightsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    private final MarketInsightsService service;

    public MarketDataController(MarketInsightsService service) {
        this.service = service;
    }

    @PostMapping("/historical-data")
    public Mono<ResponseEntity<HistoricalDataResponse>> historicalData(@RequestBody HistoricalDataRequest request) {
        log.info("Historical data request received. symbol={} start={} end={} interval={}",
                 request.symbol(), request.startDate(), request.endDate(), request.interval());
        return service.historicalData(request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/analytical-insights")
    public Mono<ResponseEntity<AnalyticalInsightsResponse>> analyticalInsights(@RequestBody HistoricalDataRequest request) {
        log.info("Analytical insights request received. symbol={} start={} end={} interval={}",
                 request.symbol(), request.startDate(), request.endDate(), request.interval());
        return service.analyticalInsights(request)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/company-info/{symbol}")
    public Mono<ResponseEntity<CompanyProfile>> companyInfo(@PathVariable String symbol) {
        log.info("Company info request received. symbol={}", symbol);
        return service.companyProfile(symbol)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/stock-data/{symbol}")
    public Mono<ResponseEntity<MarketSnapshot>> stockData(@PathVariable String symbol) {
        log.info("Stock data request received. symbol={}", symbol);
        return service.marketSnapshot(symbol)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
