package com.funnelscope.service.core.funnel.sequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Steps in any order. Every position matching some step anchors a lineage; moving forward inside the window, the
 * next position matching any unseen step completes the lowest unseen step it matches. Lineage entries are in
 * completion order, so entry k is the (k+1)-th distinct step observed.
 *
 * <p>Each advance jumps to the nearest position of every unseen step through the timeline's next-step tables, so an
 * anchor costs O(N²) lookups however many events lie in between.
 */
public final class UnorderedStepSequencer implements StepSequencer {

    @Override
    public List<Lineage> lineages(ActorTimeline timeline, int stepCount, long windowMillis) {
        List<Lineage> out = new ArrayList<>();
        long all = stepCount == Long.SIZE ? -1L : (1L << stepCount) - 1;
        int[] positions = new int[stepCount];
        long[] times = new long[stepCount];
        for (int anchor = 0; anchor < timeline.size(); anchor++) {
            if ((timeline.stepMask(anchor) & all) == 0) {
                continue;
            }
            long seen = 0L;
            int reached = 0;
            boolean truncated = false;
            long start = timeline.time(anchor);
            int from = anchor;
            while (reached < stepCount) {
                int next = nearestUnseen(timeline, stepCount, seen, from);
                if (next < 0) {
                    break;
                }
                if (timeline.time(next) - start > windowMillis) {
                    truncated = true;
                    break;
                }
                long fresh = timeline.stepMask(next) & all & ~seen;
                seen |= Long.lowestOneBit(fresh);
                positions[reached] = next;
                times[reached] = timeline.time(next);
                reached++;
                // one step per position; other steps it matches must come from later positions
                from = next + 1;
            }
            out.add(new Lineage(
                    Arrays.copyOf(positions, stepCount), Arrays.copyOf(times, stepCount), reached, truncated));
        }
        return out;
    }

    private static int nearestUnseen(ActorTimeline timeline, int stepCount, long seen, int from) {
        int nearest = -1;
        for (int step = 0; step < stepCount; step++) {
            if ((seen & (1L << step)) != 0) {
                continue;
            }
            int position = timeline.nextStepPosition(step, from);
            if (position >= 0 && (nearest < 0 || position < nearest)) {
                nearest = position;
            }
        }
        return nearest;
    }
}
