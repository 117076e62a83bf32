package com.carbondna.api.anchor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Anchoring periods are UTC calendar days, half-open: {@code [d 00:00Z, d+1 00:00Z)}.
 */
public final class AnchorPeriod {

    private AnchorPeriod() {}

    public static Instant start(LocalDate period) {
        return period.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static Instant end(LocalDate period) {
        return start(period.plusDays(1));
    }

    public static LocalDate of(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    public static boolean isClosed(LocalDate period, Instant now) {
        return !now.isBefore(end(period));
    }
}
