package com.stockinsights.common.validation;

import com.stockinsights.common.exception.ErrorKind;
import com.stockinsights.common.exception.ValidationException;
import com.stockinsights.common.model.DateRange;
import com.stockinsights.common.model.Interval;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Turns raw request strings into a {@link DateRange}.
 *
 * <p>Rules, checked in order:
 * <ol>
 *   <li>both dates must be present and parse as strict ISO {@code YYYY-MM-DD}
 *       → otherwise {@link ErrorKind#INVALID_DATE_FORMAT}</li>
 *   <li>start must not be after end (equal is a single-day window)
 *       → otherwise {@link ErrorKind#INVALID_DATE_RANGE}</li>
 *   <li>interval, when non-blank, must name an {@link Interval}; absent means daily
 *       → otherwise {@link ErrorKind#INVALID_INTERVAL}</li>
 * </ol>
 *
 * <p>No side effects. No logging.
 */
public final class RangeValidator {

    private static final String START_FIELD = "start_date";
    private static final String END_FIELD   = "end_date";

    /** {@code uuuu} rather than {@code yyyy}: STRICT resolution needs a proleptic year. */
    private static final DateTimeFormatter ISO_DATE =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private RangeValidator() {}

    public static DateRange validate(String rawStart, String rawEnd, String rawInterval) {
        LocalDate start = parseDate(START_FIELD, rawStart);
        LocalDate end   = parseDate(END_FIELD, rawEnd);

        if (start.isAfter(end)) {
            throw new ValidationException(ErrorKind.INVALID_DATE_RANGE,
                "'" + START_FIELD + "' (" + start + ") must not be after '" + END_FIELD + "' (" + end + ")");
        }

        return DateRange.of(start, end, parseInterval(rawInterval));
    }

    static LocalDate parseDate(String field, String raw) {
        if (raw == null) {
            throw new ValidationException(ErrorKind.INVALID_DATE_FORMAT,
                "'" + field + "' field is required");
        }
        try {
            return LocalDate.parse(raw.trim(), ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new ValidationException(ErrorKind.INVALID_DATE_FORMAT,
                "'" + field + "' must follow the YYYY-MM-DD format, got '" + raw + "'");
        }
    }

    static Interval parseInterval(String raw) {
        if (raw == null || raw.isBlank()) {
            return Interval.DAILY;
        }
        return Interval.parse(raw).orElseThrow(() -> new ValidationException(ErrorKind.INVALID_INTERVAL,
            "Unsupported interval '" + raw + "'; expected one of: " + Interval.acceptedValues()));
    }
}
