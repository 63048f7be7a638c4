package com.funnelscope.service.core.funnel.sequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Steps in order with no other event in between: step i must sit at the position right after step i-1. */
public final class StrictStepSequencer implements StepSequencer {

    @Override
    public List<Lineage> lineages(ActorTimeline timeline, int stepCount, long windowMillis) {
        List<Lineage> out = new ArrayList<>();
        int[] positions = new int[stepCount];
        long[] times = new long[stepCount];
        for (int start = timeline.nextStepPosition(0, 0); start >= 0; start = timeline.nextStepPosition(0, start + 1)) {
            positions[0] = start;
            times[0] = timeline.time(start);
            int reached = 1;
            boolean truncated = false;
            while (reached < stepCount) {
                int next = positions[reached - 1] + 1;
                if (next >= timeline.size() || !timeline.matchesStep(next, reached)) {
                    break;
                }
                if (timeline.time(next) - times[0] > windowMillis) {
                    truncated = true;
                    break;
                }
                positions[reached] = next;
                times[reached] = timeline.time(next);
                reached++;
            }
            out.add(new Lineage(
                    Arrays.copyOf(positions, stepCount), Arrays.copyOf(times, stepCount), reached, truncated));
        }
        return out;
    }
}
