package com.funnelscope.service.core.funnel.query;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Query date range as the team sees it: local date-times interpreted in the team timezone. Only the range is
 * timezone-aware; the conversion window is a fixed duration.
 */
public record QueryDateRange(LocalDateTime from, LocalDateTime to, ZoneId teamTimezone) {

    public QueryDateRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        teamTimezone = teamTimezone == null ? ZoneOffset.UTC : teamTimezone;
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("date range ends before it starts: " + from + " > " + to);
        }
    }

    public static QueryDateRange utc(Instant from, Instant to) {
        return new QueryDateRange(
                LocalDateTime.ofInstant(from, ZoneOffset.UTC),
                LocalDateTime.ofInstant(to, ZoneOffset.UTC),
                ZoneOffset.UTC);
    }

    public Instant start() {
        return from.atZone(teamTimezone).toInstant();
    }

    public Instant end() {
        return to.atZone(teamTimezone).toInstant();
    }
}
