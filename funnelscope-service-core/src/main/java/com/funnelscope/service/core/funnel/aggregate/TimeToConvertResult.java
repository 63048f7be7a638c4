package com.funnelscope.service.core.funnel.aggregate;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Average conversion time between two steps and the histogram of per-actor times, in whole seconds. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeToConvertResult(
        int fromStep, int toStep, Double averageConversionTime, long samples, List<Bin> bins) {

    public TimeToConvertResult {
        bins = bins == null ? List.of() : List.copyOf(bins);
    }

    /** Bin covering {@code [lowerBoundSeconds, lowerBoundSeconds + widthSeconds)}; the last bin is closed. */
    public record Bin(long lowerBoundSeconds, long widthSeconds, long count) {}
}
