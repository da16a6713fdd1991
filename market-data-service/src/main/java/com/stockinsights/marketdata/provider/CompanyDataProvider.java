package com.stockinsights.marketdata.provider;

import com.stockinsights.marketdata.model.CompanyProfile;
import com.stockinsights.marketdata.model.MarketSnapshot;
import reactor.core.publisher.Mono;

/**
 * Company-level lookups. Same error contract as {@link SeriesProvider}.
 */
public interface CompanyDataProvider {

    Mono<CompanyProfile> fetchProfile(String symbol);

    Mono<MarketSnapshot> fetchSnapshot(String symbol);
}
