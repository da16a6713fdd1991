package com.stockinsights.marketdata.support;

import com.stockinsights.common.model.Bar;
import com.stockinsights.common.model.DateRange;
import com.stockinsights.common.model.Interval;
import com.stockinsights.common.model.PriceSeries;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Shared test data: canned Alpha Vantage payloads and synthetic series. */
public final class Fixtures {

    public static final LocalDate DAY_ONE = LocalDate.of(2024, 1, 2);

    private Fixtures() {}

    public static String json(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/alphavantage/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static DateRange dailyRange(String start, String end) {
        return DateRange.of(LocalDate.parse(start), LocalDate.parse(end), Interval.DAILY);
    }

    /** One bar per day from {@link #DAY_ONE}; high/low bracket the close. */
    public static PriceSeries series(String symbol, DateRange range, double... closes) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            double c = closes[i];
            bars.add(new Bar(DAY_ONE.plusDays(i), c, c + 1.0, c - 1.0, c, 10_000L * (i + 1)));
        }
        return new PriceSeries(symbol, range, bars);
    }
}
