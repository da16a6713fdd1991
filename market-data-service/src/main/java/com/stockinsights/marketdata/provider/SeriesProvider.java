package com.stockinsights.marketdata.provider;

import com.stockinsights.common.model.DateRange;
import com.stockinsights.common.model.PriceSeries;
import reactor.core.publisher.Mono;

/**
 * Source of historical bars. The live implementation is
 * {@link com.stockinsights.marketdata.client.AlphaVantageClient}; tests substitute doubles.
 *
 * <p>Contract:
 * <ul>
 *   <li>emits a {@link PriceSeries} for {@code symbol} restricted to {@code range},
 *       oldest bar first; an empty series means no trading activity in the window</li>
 *   <li>errors with {@code SymbolNotFoundException} when the provider rejects the symbol</li>
 *   <li>errors with {@code UpstreamUnavailableException} on network failure or timeout;
 *       never hangs past its configured timeout</li>
 *   <li>does not retry</li>
 * </ul>
 */
public interface SeriesProvider {
    Mono<PriceSeries> fetchSeries(String symbol, DateRange range);
}
