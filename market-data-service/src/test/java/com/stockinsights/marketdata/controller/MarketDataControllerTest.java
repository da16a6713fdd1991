package com.stockinsights.marketdata.controller;

import com.stockinsights.common.exception.SymbolNotFoundException;
import com.stockinsights.common.exception.UpstreamUnavailableException;
import com.stockinsights.common.model.DateRange;
import com.stockinsights.common.model.PriceSeries;
import com.stockinsights.marketdata.assembler.ResponseAssembler;
import com.stockinsights.marketdata.exception.GlobalExceptionHandler;
import com.stockinsights.marketdata.model.CompanyProfile;
import com.stockinsights.marketdata.provider.CompanyDataProvider;
import com.stockinsights.marketdata.provider.SeriesProvider;
import com.stockinsights.marketdata.service.MarketInsightsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static com.stockinsights.marketdata.support.Fixtures.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(MarketDataController.class)
@Import({MarketInsightsService.class, ResponseAssembler.class, GlobalExceptionHandler.class})
class MarketDataControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private SeriesProvider seriesProvider;

    @MockBean
    private CompanyDataProvider companyDataProvider;

    private static String body(String symbol, String start, String end, String interval) {
        String intervalField = interval == null ? "" : ", \"interval\": \"" + interval + "\"";
        return "{\"symbol\": \"" + symbol + "\", \"start_date\": \"" + start + "\", \"end_date\": \"" + end + "\""
            + intervalField + "}";
    }

    private void givenCloses(double... closes) {
        when(seriesProvider.fetchSeries(eq("AAPL"), any(DateRange.class)))
            .thenAnswer(inv -> Mono.just(series("AAPL", inv.getArgument(1), closes)));
    }

    private WebTestClient.ResponseSpec post(String path, String json) {
        return webTestClient.post().uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(json)
            .exchange();
    }

    @Test
    @DisplayName("historical-data returns snake_case bars")
    void historicalData() {
        givenCloses(10, 12);

        post("/api/historical-data", body("aapl", "2024-01-01", "2024-01-31", null))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.symbol").isEqualTo("AAPL")
            .jsonPath("$.interval").isEqualTo("1d")
            .jsonPath("$.start_date").isEqualTo("2024-01-01")
            .jsonPath("$.end_date").isEqualTo("2024-01-31")
            .jsonPath("$.bars.length()").isEqualTo(2)
            .jsonPath("$.bars[0].timestamp").isEqualTo("2024-01-02")
            .jsonPath("$.bars[0].close").isEqualTo(10.0)
            .jsonPath("$.bars[1].volume").isEqualTo(20000);
    }

    @Test
    @DisplayName("analytical-insights returns the statistics")
    void analyticalInsights() {
        givenCloses(10, 12, 9, 15);

        post("/api/analytical-insights", body("AAPL", "2024-01-01", "2024-01-31", "daily"))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.average_close").isEqualTo(11.5)
            .jsonPath("$.max_close").isEqualTo(15.0)
            .jsonPath("$.max_close_date").isEqualTo("2024-01-05")
            .jsonPath("$.min_close").isEqualTo(9.0)
            .jsonPath("$.min_close_date").isEqualTo("2024-01-04")
            .jsonPath("$.total_return").isEqualTo(0.5)
            .jsonPath("$.volatility").value((Double v) -> assertEquals(2.2913, v, 1e-4))
            .jsonPath("$.bar_count").isEqualTo(4)
            .jsonPath("$.bars.length()").isEqualTo(4);
    }

    @Test
    @DisplayName("include_bars=false omits the bars field")
    void insightsWithoutBars() {
        givenCloses(10, 12);

        post("/api/analytical-insights",
            "{\"symbol\": \"AAPL\", \"start_date\": \"2024-01-01\", \"end_date\": \"2024-01-31\", \"include_bars\": false}")
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.bars").doesNotExist()
            .jsonPath("$.bar_count").isEqualTo(2);
    }

    @Test
    @DisplayName("inverted range → 400 INVALID_DATE_RANGE, provider never called")
    void invertedRange() {
        post("/api/historical-data", body("AAPL", "2023-02-01", "2023-01-01", null))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.kind").isEqualTo("INVALID_DATE_RANGE")
            .jsonPath("$.status").isEqualTo(400)
            .jsonPath("$.path").isEqualTo("/api/historical-data")
            .jsonPath("$.error").exists();

        verifyNoInteractions(seriesProvider);
    }

    @Test
    @DisplayName("bad date → 400 INVALID_DATE_FORMAT")
    void badDate() {
        post("/api/analytical-insights", body("AAPL", "01/02/2023", "2023-03-01", null))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.kind").isEqualTo("INVALID_DATE_FORMAT");

        verifyNoInteractions(seriesProvider);
    }

    @Test
    @DisplayName("bad interval → 400 INVALID_INTERVAL")
    void badInterval() {
        post("/api/historical-data", body("AAPL", "2023-01-01", "2023-03-01", "5m"))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.kind").isEqualTo("INVALID_INTERVAL");
    }

    @Test
    @DisplayName("missing symbol → 400 INVALID_SYMBOL")
    void missingSymbol() {
        post("/api/historical-data", "{\"start_date\": \"2023-01-01\", \"end_date\": \"2023-03-01\"}")
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.kind").isEqualTo("INVALID_SYMBOL")
            .jsonPath("$.error").isEqualTo("'symbol' field is required");
    }

    @Test
    @DisplayName("non-JSON body → 400 MALFORMED_REQUEST")
    void malformedBody() {
        post("/api/historical-data", "symbol=AAPL")
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.kind").isEqualTo("MALFORMED_REQUEST");
    }

    @Test
    @DisplayName("zero bars: historical-data succeeds empty, analytical-insights → 422 EMPTY_SERIES")
    void emptySeries() {
        when(seriesProvider.fetchSeries(eq("AAPL"), any(DateRange.class)))
            .thenAnswer(inv -> Mono.just(PriceSeries.empty("AAPL", inv.getArgument(1))));

        post("/api/historical-data", body("AAPL", "2024-01-06", "2024-01-07", null))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.bars.length()").isEqualTo(0);

        post("/api/analytical-insights", body("AAPL", "2024-01-06", "2024-01-07", null))
            .expectStatus().isEqualTo(422)
            .expectBody()
            .jsonPath("$.kind").isEqualTo("EMPTY_SERIES");
    }

    @Test
    @DisplayName("unknown symbol → 404 SYMBOL_NOT_FOUND")
    void symbolNotFound() {
        when(seriesProvider.fetchSeries(eq("ZZZZ"), any(DateRange.class)))
            .thenReturn(Mono.error(new SymbolNotFoundException("ZZZZ")));

        post("/api/historical-data", body("ZZZZ", "2024-01-01", "2024-01-31", null))
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.kind").isEqualTo("SYMBOL_NOT_FOUND");
    }

    @Test
    @DisplayName("provider down → 502 UPSTREAM_UNAVAILABLE")
    void upstreamDown() {
        when(seriesProvider.fetchSeries(eq("AAPL"), any(DateRange.class)))
            .thenReturn(Mono.error(new UpstreamUnavailableException("Upstream provider timed out")));

        post("/api/analytical-insights", body("AAPL", "2024-01-01", "2024-01-31", null))
            .expectStatus().isEqualTo(502)
            .expectBody()
            .jsonPath("$.kind").isEqualTo("UPSTREAM_UNAVAILABLE")
            .jsonPath("$.error").isEqualTo("Upstream provider timed out");
    }

    @Test
    @DisplayName("company-info upper-cases the path symbol")
    void companyInfo() {
        when(companyDataProvider.fetchProfile("IBM")).thenReturn(Mono.just(new CompanyProfile(
            "IBM", "International Business Machines", null, "NYSE", "USD", "TECHNOLOGY", null, null,
            147_800_000_000L, null, null)));

        webTestClient.get().uri("/api/company-info/ibm")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.symbol").isEqualTo("IBM")
            .jsonPath("$.name").isEqualTo("International Business Machines")
            .jsonPath("$.market_cap").isEqualTo(147_800_000_000L);
    }

    @Test
    @DisplayName("stock-data for an unknown symbol → 404")
    void stockDataUnknown() {
        when(companyDataProvider.fetchSnapshot("NOPE")).thenReturn(Mono.error(new SymbolNotFoundException("NOPE")));

        webTestClient.get().uri("/api/stock-data/nope")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.kind").isEqualTo("SYMBOL_NOT_FOUND");
    }

    @Test
    void health() {
        webTestClient.get().uri("/api/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
