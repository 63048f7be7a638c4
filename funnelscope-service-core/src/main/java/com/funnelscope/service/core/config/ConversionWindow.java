package com.funnelscope.service.core.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Maximum time allowed between a run's first step and the last step it reaches. The window is a fixed duration, so a
 * day is always 24 hours regardless of DST transitions.
 */
public record ConversionWindow(long value, Unit unit) {

    public static final ConversionWindow DEFAULT = new ConversionWindow(14, Unit.DAY);

    public ConversionWindow {
        if (unit == null) {
            throw new IllegalArgumentException("conversion window unit is required");
        }
    }

    public static ConversionWindow of(long value, String unit) {
        return new ConversionWindow(value, Unit.fromConfigValue(unit));
    }

    public static ConversionWindow days(long value) {
        return new ConversionWindow(value, Unit.DAY);
    }

    public static ConversionWindow seconds(long value) {
        return new ConversionWindow(value, Unit.SECOND);
    }

    public Duration duration() {
        return unit.duration().multipliedBy(value);
    }

    public long toMillis() {
        return duration().toMillis();
    }

    public enum Unit {
        SECOND(Duration.ofSeconds(1)),
        MINUTE(Duration.ofMinutes(1)),
        HOUR(Duration.ofHours(1)),
        DAY(Duration.ofDays(1)),
        WEEK(Duration.ofDays(7));

        private final Duration duration;

        Unit(Duration duration) {
            this.duration = duration;
        }

        public Duration duration() {
            return duration;
        }

        public static Unit fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return DAY;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "second", "seconds" -> SECOND;
                case "minute", "minutes" -> MINUTE;
                case "hour", "hours" -> HOUR;
                case "day", "days" -> DAY;
                case "week", "weeks" -> WEEK;
                default -> throw new IllegalArgumentException("Unsupported conversion window unit: " + value);
            };
        }
    }
}
