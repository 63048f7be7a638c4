package com.funnelscope.service.core.config;

import java.util.Locale;

/** Step ordering discipline of a funnel. */
public enum FunnelOrder {
    /** Steps in order, unrelated events in between are ignored. */
    ORDERED,
    /** Steps in order with nothing else in between. */
    STRICT,
    /** Steps in any order; only presence counts. */
    UNORDERED;

    public static FunnelOrder fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return ORDERED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ordered" -> ORDERED;
            case "strict" -> STRICT;
            case "unordered" -> UNORDERED;
            default -> throw new IllegalArgumentException("Unsupported funnel order type: " + value);
        };
    }
}
