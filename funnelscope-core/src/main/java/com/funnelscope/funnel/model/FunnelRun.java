package com.funnelscope.funnel.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of sequencing one actor: the surviving lineage, its step timestamps and the breakdown it was attributed to.
 *
 * <p>{@code stepsReached} counts completed steps, so a run that reached step index {@code i} has
 * {@code stepsReached > i}. {@code breakdown} is {@code null} when the run is not part of breakdown output.
 */
public record FunnelRun(
        String actorId, int stepsReached, List<Instant> stepTimestamps, BreakdownKey breakdown, boolean truncated) {

    public FunnelRun {
        Objects.requireNonNull(actorId, "actorId");
        stepTimestamps = List.copyOf(stepTimestamps);
        if (stepTimestamps.size() != stepsReached) {
            throw new IllegalArgumentException(
                    "stepTimestamps size " + stepTimestamps.size() + " does not match stepsReached " + stepsReached);
        }
    }

    public boolean reached(int stepIndex) {
        return stepsReached > stepIndex;
    }

    /** Seconds between step {@code stepIndex - 1} and {@code stepIndex}, or {@code null} when not reached. */
    public Double conversionTimeSeconds(int stepIndex) {
        if (stepIndex <= 0 || !reached(stepIndex)) {
            return null;
        }
        return secondsBetween(stepTimestamps.get(stepIndex - 1), stepTimestamps.get(stepIndex));
    }

    public List<Double> conversionTimes() {
        List<Double> out = new ArrayList<>(Math.max(0, stepsReached - 1));
        for (int i = 1; i < stepsReached; i++) {
            out.add(conversionTimeSeconds(i));
        }
        return out;
    }

    public Instant lastStepTimestamp() {
        return stepsReached == 0 ? null : stepTimestamps.get(stepsReached - 1);
    }

    public FunnelRun withBreakdown(BreakdownKey key) {
        return new FunnelRun(actorId, stepsReached, stepTimestamps, key, truncated);
    }

    static double secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0d;
    }
}
