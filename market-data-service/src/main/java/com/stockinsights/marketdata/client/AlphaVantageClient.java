package com.stockinsights.marketdata.client;

import com.stockinsights.common.exception.InsightsException;
import com.stockinsights.common.exception.SymbolNotFoundException;
import com.stockinsights.common.exception.UpstreamUnavailableException;
import com.stockinsights.common.model.Bar;
import com.stockinsights.common.model.DateRange;
import com.stockinsights.common.model.Interval;
import com.stockinsights.common.model.PriceSeries;
import com.stockinsights.marketdata.model.AlphaVantageOverviewResponse;
import com.stockinsights.marketdata.model.AlphaVantageQuoteResponse;
import com.stockinsights.marketdata.model.AlphaVantageTimeSeriesResponse;
import com.stockinsights.marketdata.model.CompanyProfile;
import com.stockinsights.marketdata.model.MarketSnapshot;
import com.stockinsights.marketdata.provider.CompanyDataProvider;
import com.stockinsights.marketdata.provider.SeriesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Alpha Vantage implementation of {@link SeriesProvider} and {@link CompanyDataProvider}.
 *
 * <p>Every call is bounded by {@code timeout}. Transport failures, non-2xx answers,
 * throttling notices and timeouts all surface as {@link UpstreamUnavailableException};
 * an {@code "Error Message"} payload or an empty quote/overview object surfaces as
 * {@link SymbolNotFoundException}. Nothing is retried here.
 */
public class AlphaVantageClient implements SeriesProvider, CompanyDataProvider {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageClient.class);

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;

    public AlphaVantageClient(WebClient alphaVantageWebClient, String apiKey, Duration timeout) {
        this.webClient = alphaVantageWebClient;
        this.apiKey    = apiKey;
        this.timeout   = timeout;
    }

    // ── SeriesProvider ───────────────────────────────────────────────────────

    @Override
    public Mono<PriceSeries> fetchSeries(String symbol, DateRange range) {
        log.info("Fetching series. provider=AlphaVantage symbol={} interval={} from={} to={}",
                 symbol, range.interval(), range.start(), range.end());

        return webClient.get()
            .uri(b -> seriesUri(b, symbol, range.interval()))
            .retrieve()
            .bodyToMono(AlphaVantageTimeSeriesResponse.class)
            .timeout(timeout)
            .switchIfEmpty(Mono.error(() -> new UpstreamUnavailableException(
                "Empty response from upstream provider for symbol '" + symbol + "'")))
            .map(response -> toSeries(symbol, range, response))
            .onErrorMap(e -> !(e instanceof InsightsException), e -> upstreamFailure(symbol, e))
            .doOnSuccess(s -> log.info("Series fetched. provider=AlphaVantage symbol={} bars={}", symbol, s.size()))
            .doOnError(e -> log.warn("Series fetch failed. symbol={} reason={}", symbol, e.getMessage()));
    }

    private URI seriesUri(UriBuilder b, String symbol, Interval interval) {
        b.path("/query")
            .queryParam("function", functionFor(interval))
            .queryParam("symbol", symbol);
        if (interval == Interval.DAILY) {
            // compact only covers the last 100 sessions
            b.queryParam("outputsize", "full");
        }
        return b.queryParam("apikey", apiKey).build();
    }

    static String functionFor(Interval interval) {
        return switch (interval) {
            case DAILY   -> "TIME_SERIES_DAILY";
            case WEEKLY  -> "TIME_SERIES_WEEKLY";
            case MONTHLY -> "TIME_SERIES_MONTHLY";
        };
    }

    PriceSeries toSeries(String symbol, DateRange range, AlphaVantageTimeSeriesResponse response) {
        if (response.errorMessage() != null) {
            throw new SymbolNotFoundException(symbol);
        }
        Map<String, AlphaVantageTimeSeriesResponse.OhlcvData> raw = response.seriesFor(range.interval());
        if (raw == null) {
            throw new UpstreamUnavailableException(response.notice() != null
                ? "Upstream provider refused the request: " + response.notice()
                : "Upstream response for symbol '" + symbol + "' contained no " + range.interval().code() + " series");
        }

        List<Bar> bars = new ArrayList<>();
        raw.forEach((date, ohlcv) -> {
            try {
                LocalDate day = LocalDate.parse(date);
                if (range.contains(day)) {
                    bars.add(ohlcv.toBar(day));
                }
            } catch (RuntimeException ex) {
                log.debug("Skipping malformed bar. symbol={} date={} reason={}", symbol, date, ex.getMessage());
            }
        });
        bars.sort(Comparator.comparing(Bar::timestamp));
        return new PriceSeries(symbol, range, bars);
    }

    // ── CompanyDataProvider ──────────────────────────────────────────────────

    @Override
    public Mono<CompanyProfile> fetchProfile(String symbol) {
        log.info("Fetching company profile. provider=AlphaVantage symbol={}", symbol);
        return webClient.get()
            .uri(b -> b.path("/query")
                .queryParam("function", "OVERVIEW")
                .queryParam("symbol", symbol)
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(AlphaVantageOverviewResponse.class)
            .timeout(timeout)
            .switchIfEmpty(Mono.error(() -> new SymbolNotFoundException(symbol)))
            .map(response -> toProfile(symbol, response))
            .onErrorMap(e -> !(e instanceof InsightsException), e -> upstreamFailure(symbol, e));
    }

    CompanyProfile toProfile(String symbol, AlphaVantageOverviewResponse r) {
        if (r.errorMessage() != null) {
            throw new SymbolNotFoundException(symbol);
        }
        if (r.notice() != null) {
            throw new UpstreamUnavailableException("Upstream provider refused the request: " + r.notice());
        }
        if (r.symbol() == null && r.name() == null) {
            throw new SymbolNotFoundException(symbol);
        }
        Double marketCap = decimalOrNull(r.marketCapitalization());
        return new CompanyProfile(
            symbol,
            r.name(),
            r.description(),
            r.exchange(),
            r.currency(),
            r.sector(),
            r.industry(),
            r.officialSite(),
            marketCap == null ? null : marketCap.longValue(),
            decimalOrNull(r.fiftyTwoWeekHigh()),
            decimalOrNull(r.fiftyTwoWeekLow())
        );
    }

    @Override
    public Mono<MarketSnapshot> fetchSnapshot(String symbol) {
        log.info("Fetching quote snapshot. provider=AlphaVantage symbol={}", symbol);
        return webClient.get()
            .uri(b -> b.path("/query")
                .queryParam("function", "GLOBAL_QUOTE")
                .queryParam("symbol", symbol)
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(AlphaVantageQuoteResponse.class)
            .timeout(timeout)
            .switchIfEmpty(Mono.error(() -> new SymbolNotFoundException(symbol)))
            .map(response -> toSnapshot(symbol, response))
            .onErrorMap(e -> !(e instanceof InsightsException), e -> upstreamFailure(symbol, e));
    }

    MarketSnapshot toSnapshot(String symbol, AlphaVantageQuoteResponse r) {
        if (r.errorMessage() != null) {
            throw new SymbolNotFoundException(symbol);
        }
        if (r.notice() != null) {
            throw new UpstreamUnavailableException("Upstream provider refused the request: " + r.notice());
        }
        AlphaVantageQuoteResponse.GlobalQuote q = r.globalQuote();
        if (q == null || q.symbol() == null) {
            throw new SymbolNotFoundException(symbol);
        }
        Double volume = decimalOrNull(q.volume());
        return new MarketSnapshot(
            symbol,
            decimalOrNull(q.price()),
            decimalOrNull(q.previousClose()),
            decimalOrNull(q.open()),
            decimalOrNull(q.high()),
            decimalOrNull(q.low()),
            volume == null ? null : volume.longValue(),
            decimalOrNull(q.change()),
            q.changePercent(),
            q.latestTradingDay() == null ? null : LocalDate.parse(q.latestTradingDay())
        );
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    /** Alpha Vantage reports absent numeric fields as {@code "None"} or {@code "-"}. */
    static Double decimalOrNull(String raw) {
        if (raw == null || raw.isBlank() || "None".equalsIgnoreCase(raw) || "-".equals(raw)) {
            return null;
        }
        return Double.valueOf(raw.trim());
    }

    private UpstreamUnavailableException upstreamFailure(String symbol, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return new UpstreamUnavailableException(
                "Upstream provider timed out after " + timeout.toMillis() + " ms for symbol '" + symbol + "'", cause);
        }
        return new UpstreamUnavailableException(
            "Failed to retrieve data from upstream provider for symbol '" + symbol + "'", cause);
    }
}
