package com.stockinsights.marketdata.service;

import com.stockinsights.common.analytics.AnalyticsEngine;
import com.stockinsights.common.exception.UpstreamUnavailableException;
import com.stockinsights.common.model.DateRange;
import com.stockinsights.common.model.PriceSeries;
import com.stockinsights.common.validation.RangeValidator;
import com.stockinsights.common.validation.SymbolValidator;
import com.stockinsights.marketdata.assembler.ResponseAssembler;
import com.stockinsights.marketdata.dto.AnalyticalInsightsResponse;
import com.stockinsights.marketdata.dto.HistoricalDataRequest;
import com.stockinsights.marketdata.dto.HistoricalDataResponse;
import com.stockinsights.marketdata.model.CompanyProfile;
import com.stockinsights.marketdata.model.MarketSnapshot;
import com.stockinsights.marketdata.provider.CompanyDataProvider;
import com.stockinsights.marketdata.provider.SeriesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Request pipeline for series and insights.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Validate symbol and range ({@link SymbolValidator}, {@link RangeValidator}).
 *       Failures short-circuit before any provider call.</li>
 *   <li>Fetch the series through the injected {@link SeriesProvider}. Provider errors
 *       short-circuit before analytics.</li>
 *   <li>For insights, aggregate with {@link AnalyticsEngine}; an empty series fails here.</li>
 *   <li>Shape the result with {@link ResponseAssembler}.</li>
 * </ol>
 *
 * <p>Stateless: every call builds its own pipeline. Validation runs lazily inside
 * {@code Mono.fromCallable} so that errors travel down the reactive chain.
 */
@Service
public class MarketInsightsService {

    private static final Logger log = LoggerFactory.getLogger(MarketInsightsService.class);

    private final SeriesProvider seriesProvider;
    private final CompanyDataProvider companyDataProvider;
    private final ResponseAssembler assembler;

    public MarketInsightsService(SeriesProvider seriesProvider,
                                 CompanyDataProvider companyDataProvider,
                                 ResponseAssembler assembler) {
        this.seriesProvider      = seriesProvider;
        this.companyDataProvider = companyDataProvider;
        this.assembler           = assembler;
    }

    public Mono<HistoricalDataResponse> historicalData(HistoricalDataRequest request) {
        return fetchValidated(request)
            .map(assembler::historical);
    }

    public Mono<AnalyticalInsightsResponse> analyticalInsights(HistoricalDataRequest request) {
        return fetchValidated(request)
            .map(series -> assembler.insights(series, AnalyticsEngine.compute(series), request.includeBarsOrDefault()))
            .doOnSuccess(r -> log.info("Insights computed. symbol={} bars={} totalReturn={} volatility={}",
                r.symbol(), r.barCount(), r.totalReturn(), r.volatility()));
    }

    public Mono<CompanyProfile> companyProfile(String rawSymbol) {
        return Mono.fromCallable(() -> SymbolValidator.normalize(rawSymbol))
            .flatMap(companyDataProvider::fetchProfile);
    }

    public Mono<MarketSnapshot> marketSnapshot(String rawSymbol) {
        return Mono.fromCallable(() -> SymbolValidator.normalize(rawSymbol))
            .flatMap(companyDataProvider::fetchSnapshot);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Mono<PriceSeries> fetchValidated(HistoricalDataRequest request) {
        return Mono.fromCallable(() -> SeriesQuery.from(request))
            .doOnNext(q -> log.info("Series requested. symbol={} interval={} from={} to={}",
                q.symbol(), q.range().interval(), q.range().start(), q.range().end()))
            .flatMap(q -> seriesProvider.fetchSeries(q.symbol(), q.range())
                .switchIfEmpty(Mono.error(() -> new UpstreamUnavailableException(
                    "Provider returned no series for symbol '" + q.symbol() + "'"))));
    }

    private record SeriesQuery(String symbol, DateRange range) {

        static SeriesQuery from(HistoricalDataRequest request) {
            String symbol = SymbolValidator.normalize(request.symbol());
            DateRange range = RangeValidator.validate(request.startDate(), request.endDate(), request.interval());
            return new SeriesQuery(symbol, range);
        }
    }
}
