package com.funnelscope.service.core.funnel.aggregate;

import java.util.Locale;

/** How median conversion times are computed. */
public enum MedianMode {
    /** Sorted-array median over every sample. */
    EXACT,
    /** DDSketch quantile estimate with bounded relative error. */
    SKETCH,
    /** Exact up to the configured sample limit, sketch above it. */
    AUTO;

    public static MedianMode fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "exact" -> EXACT;
            case "sketch" -> SKETCH;
            case "auto" -> AUTO;
            default -> throw new IllegalArgumentException("Unsupported median mode: " + value);
        };
    }

    public boolean useSketch(int samples, int exactSampleLimit) {
        return switch (this) {
            case EXACT -> false;
            case SKETCH -> true;
            case AUTO -> samples > exactSampleLimit;
        };
    }
}
