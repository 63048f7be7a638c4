package com.funnelscope.service.core.funnel.aggregate;

import com.datadoghq.sketch.ddsketch.DDSketch;
import com.datadoghq.sketch.ddsketch.DDSketches;

/**
 * Mean and median of one step transition, in seconds. Both are {@code null} without samples; a single sample gives
 * mean == median == that sample.
 */
public record ConversionTimeStats(Double average, Double median, int samples) {

    public static final ConversionTimeStats EMPTY = new ConversionTimeStats(null, null, 0);

    public static ConversionTimeStats of(
            ConversionTimeSamples samples, MedianMode mode, int exactSampleLimit, double relativeAccuracy) {
        if (samples == null || samples.isEmpty()) {
            return EMPTY;
        }
        double average = samples.sum() / samples.size();
        double median = mode.useSketch(samples.size(), exactSampleLimit)
                ? sketchMedian(samples, relativeAccuracy)
                : exactMedian(samples);
        return new ConversionTimeStats(average, median, samples.size());
    }

    static double exactMedian(ConversionTimeSamples samples) {
        double[] sorted = samples.sortedCopy();
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0d;
    }

    static double sketchMedian(ConversionTimeSamples samples, double relativeAccuracy) {
        DDSketch sketch = DDSketches.unboundedDense(relativeAccuracy);
        for (int i = 0; i < samples.size(); i++) {
            sketch.accept(samples.get(i));
        }
        return sketch.getValueAtQuantile(0.5d);
    }
}
