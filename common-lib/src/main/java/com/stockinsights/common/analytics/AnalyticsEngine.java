package com.stockinsights.common.analytics;

import com.stockinsights.common.exception.EmptySeriesException;
import com.stockinsights.common.model.Analytics;
import com.stockinsights.common.model.Bar;
import com.stockinsights.common.model.PriceSeries;

import java.util.List;
import java.util.Objects;

/**
 * Pure stateless aggregation of closing prices over a {@link PriceSeries}.
 *
 * <h3>Metrics</h3>
 * <ul>
 *   <li><strong>average close</strong>: arithmetic mean.</li>
 *   <li><strong>max / min close</strong>: extremes; the reported date is the first bar
 *       reaching the extreme (later ties do not replace it).</li>
 *   <li><strong>volatility</strong>: <em>population</em> standard deviation, i.e. the sum of
 *       squared deviations divided by N (not N-1). Computed in two passes, mean first,
 *       which is accurate enough for series of a few thousand bars.</li>
 *   <li><strong>total return</strong>: {@code (lastClose - firstClose) / firstClose} as a
 *       ratio, so {@code 0.5} means +50%. A single bar yields {@code 0.0}.</li>
 * </ul>
 *
 * <p>An empty series has no statistics: {@link EmptySeriesException} is thrown instead of
 * returning zeros. No reactive types. No logging. No side-effects.
 */
public final class AnalyticsEngine {

    private AnalyticsEngine() {}

    public static Analytics compute(PriceSeries series) {
        Objects.requireNonNull(series, "series");
        if (series.isEmpty()) {
            throw new EmptySeriesException(series.symbol());
        }

        List<Bar> bars = series.bars();

        double sum = 0.0;
        Bar maxBar = bars.get(0);
        Bar minBar = bars.get(0);
        for (Bar bar : bars) {
            sum += bar.close();
            // strict comparisons keep the first occurrence
            if (bar.close() > maxBar.close()) maxBar = bar;
            if (bar.close() < minBar.close()) minBar = bar;
        }
        // a flat series has an exact mean and no spread; the division would leave residue
        boolean flat = maxBar.close() == minBar.close();
        double mean = flat ? maxBar.close() : sum / bars.size();

        return new Analytics(
            mean,
            maxBar.close(),
            maxBar.timestamp(),
            minBar.close(),
            minBar.timestamp(),
            flat ? 0.0 : populationStdDev(bars, mean),
            totalReturn(series),
            bars.size()
        );
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static double populationStdDev(List<Bar> bars, double mean) {
        double squared = 0.0;
        for (Bar bar : bars) {
            double d = bar.close() - mean;
            squared += d * d;
        }
        return Math.sqrt(squared / bars.size());
    }

    /** Bar guarantees a positive close, so the division is always defined. */
    static double totalReturn(PriceSeries series) {
        if (series.size() < 2) {
            return 0.0;
        }
        double first = series.first().close();
        return (series.last().close() - first) / first;
    }
}
