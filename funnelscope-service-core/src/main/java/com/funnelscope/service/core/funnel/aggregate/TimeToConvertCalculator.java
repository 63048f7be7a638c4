package com.funnelscope.service.core.funnel.aggregate;

import com.funnelscope.funnel.model.FunnelRun;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Histogram of how long actors took between two steps. Only runs that reached {@code toStep} contribute. Without an
 * explicit bin count the cube root of the sample count is used, capped at {@link #MAX_BINS}.
 */
public final class TimeToConvertCalculator {
    public static final int MAX_BINS = 90;

    private TimeToConvertCalculator() {}

    public static TimeToConvertResult calculate(List<FunnelRun> runs, int fromStep, int toStep, Integer binCount) {
        if (fromStep < 0 || toStep <= fromStep) {
            throw new IllegalArgumentException("time to convert needs 0 <= fromStep < toStep, got " + fromStep + ".."
                    + toStep);
        }
        if (binCount != null && binCount < 1) {
            throw new IllegalArgumentException("bin count must be positive");
        }
        List<Long> seconds = new ArrayList<>();
        long sum = 0;
        for (FunnelRun run : runs) {
            if (!run.reached(toStep)) {
                continue;
            }
            long value = Duration.between(run.stepTimestamps().get(fromStep), run.stepTimestamps().get(toStep))
                    .getSeconds();
            seconds.add(value);
            sum += value;
        }
        if (seconds.isEmpty()) {
            return new TimeToConvertResult(fromStep, toStep, null, 0, List.of());
        }
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (long value : seconds) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        int bins = binCount != null
                ? Math.min(binCount, MAX_BINS)
                : (int) Math.min(MAX_BINS, Math.ceil(Math.cbrt(seconds.size())));
        long width = Math.max(1L, (long) Math.ceil((double) (max - min) / bins));
        long[] counts = new long[bins];
        for (long value : seconds) {
            int index = (int) Math.min(bins - 1, (value - min) / width);
            counts[index]++;
        }
        List<TimeToConvertResult.Bin> out = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            out.add(new TimeToConvertResult.Bin(min + i * width, width, counts[i]));
        }
        return new TimeToConvertResult(fromStep, toStep, (double) sum / seconds.size(), seconds.size(), out);
    }
}
