package com.funnelscope.service.core.support;

import java.time.Duration;
import java.util.Locale;

/** Utility to parse simplified duration strings like "5s" or "14d" as well as ISO-8601 "PT5S". */
public final class DurationParser {

    private DurationParser() {}

    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Duration cannot be null or empty");
        }

        String trimmed = input.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
            } catch (RuntimeException ex) {
                throw new IllegalArgumentException("Unsupported duration format: " + input, ex);
            }
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        try {
            if (lower.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(lower.substring(0, lower.length() - 2)));
            }
            if (lower.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(lower.substring(0, lower.length() - 1)));
            }
            if (lower.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(lower.substring(0, lower.length() - 1)));
            }
            if (lower.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(lower.substring(0, lower.length() - 1)));
            }
            if (lower.endsWith("d")) {
                return Duration.ofDays(Long.parseLong(lower.substring(0, lower.length() - 1)));
            }
            if (lower.endsWith("w")) {
                return Duration.ofDays(7L * Long.parseLong(lower.substring(0, lower.length() - 1)));
            }
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unsupported duration format: " + input, ex);
        }

        throw new IllegalArgumentException("Unsupported duration format: " + input);
    }
}
