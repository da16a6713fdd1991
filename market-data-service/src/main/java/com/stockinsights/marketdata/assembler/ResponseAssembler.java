package com.stockinsights.marketdata.assembler;

import com.stockinsights.common.model.Analytics;
import com.stockinsights.common.model.PriceSeries;
import com.stockinsights.marketdata.dto.AnalyticalInsightsResponse;
import com.stockinsights.marketdata.dto.HistoricalDataResponse;
import org.springframework.stereotype.Component;

/**
 * Pure mapping from domain results to response bodies. Makes no decisions beyond
 * whether the bars are attached.
 */
@Component
public class ResponseAssembler {

    public HistoricalDataResponse historical(PriceSeries series) {
        return new HistoricalDataResponse(
            series.symbol(),
            series.range().interval(),
            series.range().start(),
            series.range().end(),
            series.bars()
        );
    }

    public AnalyticalInsightsResponse insights(PriceSeries series, Analytics analytics, boolean includeBars) {
        return new AnalyticalInsightsResponse(
            series.symbol(),
            series.range().interval(),
            series.range().start(),
            series.range().end(),
            includeBars ? series.bars() : null,
            analytics.averageClose(),
            analytics.maxClose(),
            analytics.maxCloseDate(),
            analytics.minClose(),
            analytics.minCloseDate(),
            analytics.volatility(),
            analytics.totalReturn(),
            analytics.barCount()
        );
    }
}
