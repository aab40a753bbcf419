package com.ai.salesbot.dto;

import com.ai.salesbot.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Optional reporting window. Missing bounds are open; parsed values accept an ISO instant
 * or an ISO date (start of day / end of day, UTC).
 */
public final class DateRange {

    private static final Instant OPEN_START = Instant.parse("1970-01-01T00:00:00Z");
    private static final Instant OPEN_END = Instant.parse("9999-12-31T23:59:59Z");

    private final Instant from;
    private final Instant to;

    private DateRange(Instant from, Instant to) {
        this.from = from;
        this.to = to;
    }

    public static DateRange all() {
        return new DateRange(null, null);
    }

    public static DateRange of(Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("startDate must not be after endDate");
        }
        return new DateRange(from, to);
    }

    public static DateRange parse(String startDate, String endDate) {
        return of(parseBound(startDate, false), parseBound(endDate, true));
    }

    public Instant getFrom() {
        return from != null ? from : OPEN_START;
    }

    public Instant getTo() {
        return to != null ? to : OPEN_END;
    }

    public boolean isOpen() {
        return from == null && to == null;
    }

    private static Instant parseBound(String raw, boolean endOfDay) {
        if (StringUtils.isBlank(raw)) return null;
        String value = raw.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // fall through to plain date
        }
        try {
            LocalDate date = LocalDate.parse(value);
            return endOfDay
                    ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusMillis(1)
                    : date.atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException("Malformed date: " + raw);
        }
    }
}
