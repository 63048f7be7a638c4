package com.funnelscope.service.core.funnel.sequence;

import java.util.Comparator;
import java.util.List;

/**
 * One candidate attempt of an actor through the funnel: the timeline position and epoch-millisecond time attributed
 * to every reached step. For unordered funnels entries are in completion order rather than step order.
 */
public record Lineage(int[] positions, long[] times, int stepsReached, boolean truncated) {

    /**
     * Preference among an actor's lineages: most steps reached, then earliest completion, then latest start, then
     * earliest start position.
     */
    public static final Comparator<Lineage> PREFERENCE = Comparator.comparingInt(Lineage::stepsReached)
            .reversed()
            .thenComparingLong(Lineage::completionTime)
            .thenComparing(Comparator.comparingLong(Lineage::startTime).reversed())
            .thenComparingInt(l -> l.position(0));

    public Lineage {
        if (stepsReached < 1 || stepsReached > positions.length || positions.length != times.length) {
            throw new IllegalArgumentException("invalid lineage of " + stepsReached + " steps");
        }
    }

    public int position(int step) {
        return positions[step];
    }

    public long time(int step) {
        return times[step];
    }

    public boolean reached(int step) {
        return stepsReached > step;
    }

    public long startTime() {
        return times[0];
    }

    public long completionTime() {
        return times[stepsReached - 1];
    }

    public int lastPosition() {
        return positions[stepsReached - 1];
    }

    /** Best lineage of the candidates, or {@code null} when there are none. */
    public static Lineage best(List<Lineage> candidates) {
        Lineage best = null;
        for (Lineage candidate : candidates) {
            if (best == null || PREFERENCE.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        return best;
    }
}
