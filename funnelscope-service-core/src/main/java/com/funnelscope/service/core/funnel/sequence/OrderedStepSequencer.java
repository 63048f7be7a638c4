package com.funnelscope.service.core.funnel.sequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Steps in order, anything in between ignored. Each step-0 position starts a lineage which advances to the earliest
 * later position matching the next step while it stays inside the window.
 */
public final class OrderedStepSequencer implements StepSequencer {

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
            int current = start;
            while (reached < stepCount) {
                int next = timeline.nextStepPosition(reached, current + 1);
                if (next < 0) {
                    break;
                }
                if (timeline.time(next) - times[0] > windowMillis) {
                    truncated = true;
                    break;
                }
                positions[reached] = next;
                times[reached] = timeline.time(next);
                current = next;
                reached++;
            }
            out.add(new Lineage(
                    Arrays.copyOf(positions, stepCount), Arrays.copyOf(times, stepCount), reached, truncated));
        }
        return out;
    }
}
