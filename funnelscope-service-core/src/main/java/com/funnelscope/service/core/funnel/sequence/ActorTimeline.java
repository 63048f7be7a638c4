package com.funnelscope.service.core.funnel.sequence;

import com.funnelscope.funnel.model.ActorEvent;
import com.funnelscope.funnel.model.BreakdownKey;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One actor's classified events in (timestamp, event id) order, with classified events sharing an event id merged
 * into a single position. Positions carry bit masks of the steps and exclusions they match, so a funnel may have at
 * most 64 of each.
 *
 * <p>Events that arrive with a decreasing timestamp are re-sorted and the timeline is flagged
 * {@link #outOfOrder()}.
 */
public final class ActorTimeline {
    public static final int MAX_MASK_BITS = Long.SIZE;

    private static final Comparator<ActorEvent> ORDER =
            Comparator.comparing(ActorEvent::timestamp).thenComparing(ActorEvent::eventId);

    private final String actorId;
    private final int size;
    private final long[] times;
    private final String[] eventIds;
    private final long[] stepMasks;
    private final long[] exclusionMasks;
    private final BreakdownKey[] breakdowns;
    private final boolean outOfOrder;
    private final boolean unresolvedBreakdown;

    private int[][] nextStep;
    private long[][] exclusionTimes;

    private ActorTimeline(
            String actorId,
            int size,
            long[] times,
            String[] eventIds,
            long[] stepMasks,
            long[] exclusionMasks,
            BreakdownKey[] breakdowns,
            boolean outOfOrder,
            boolean unresolvedBreakdown) {
        this.actorId = actorId;
        this.size = size;
        this.times = times;
        this.eventIds = eventIds;
        this.stepMasks = stepMasks;
        this.exclusionMasks = exclusionMasks;
        this.breakdowns = breakdowns;
        this.outOfOrder = outOfOrder;
        this.unresolvedBreakdown = unresolvedBreakdown;
    }

    /**
     * @param breakdownExpected whether every step event should carry a breakdown key; a missing key then marks a
     *     failed resolution
     */
    public static ActorTimeline of(String actorId, List<ActorEvent> events, boolean breakdownExpected) {
        Objects.requireNonNull(actorId, "actorId");
        boolean outOfOrder = false;
        for (int k = 1; k < events.size(); k++) {
            if (events.get(k).timestamp().isBefore(events.get(k - 1).timestamp())) {
                outOfOrder = true;
                break;
            }
        }
        List<ActorEvent> sorted = new ArrayList<>(events);
        sorted.sort(ORDER);

        int n = sorted.size();
        long[] times = new long[n];
        String[] ids = new String[n];
        long[] steps = new long[n];
        long[] exclusions = new long[n];
        BreakdownKey[] keys = new BreakdownKey[n];
        boolean unresolved = false;
        int size = 0;
        for (ActorEvent event : sorted) {
            if (!actorId.equals(event.actorId())) {
                throw new IllegalArgumentException(
                        "event " + event.eventId() + " belongs to " + event.actorId() + ", not " + actorId);
            }
            long time = event.timestamp().toEpochMilli();
            int p;
            if (size > 0 && ids[size - 1].equals(event.eventId()) && times[size - 1] == time) {
                p = size - 1;
            } else {
                p = size++;
                times[p] = time;
                ids[p] = event.eventId();
            }
            if (event.matchedStep() != null) {
                steps[p] |= bit(event.matchedStep(), "step");
                if (breakdownExpected && event.breakdown() == null) {
                    unresolved = true;
                }
            }
            for (Integer exclusion : event.matchedExclusions()) {
                exclusions[p] |= bit(exclusion, "exclusion");
            }
            if (keys[p] == null) {
                keys[p] = event.breakdown();
            }
        }
        return new ActorTimeline(
                actorId,
                size,
                Arrays.copyOf(times, size),
                Arrays.copyOf(ids, size),
                Arrays.copyOf(steps, size),
                Arrays.copyOf(exclusions, size),
                Arrays.copyOf(keys, size),
                outOfOrder,
                unresolved);
    }

    private static long bit(int index, String what) {
        if (index < 0 || index >= MAX_MASK_BITS) {
            throw new IllegalArgumentException(what + " index out of range: " + index);
        }
        return 1L << index;
    }

    /** Positions whose breakdown key equals {@code key}; the partition keeps this timeline's flags. */
    public ActorTimeline partition(BreakdownKey key) {
        int[] keep = new int[size];
        int count = 0;
        for (int p = 0; p < size; p++) {
            if (key.equals(breakdowns[p])) {
                keep[count++] = p;
            }
        }
        long[] t = new long[count];
        String[] ids = new String[count];
        long[] s = new long[count];
        long[] x = new long[count];
        BreakdownKey[] k = new BreakdownKey[count];
        for (int i = 0; i < count; i++) {
            int p = keep[i];
            t[i] = times[p];
            ids[i] = eventIds[p];
            s[i] = stepMasks[p];
            x[i] = exclusionMasks[p];
            k[i] = breakdowns[p];
        }
        return new ActorTimeline(actorId, count, t, ids, s, x, k, outOfOrder, unresolvedBreakdown);
    }

    /** Breakdown keys seen on step positions, in order of first appearance. */
    public Set<BreakdownKey> stepBreakdowns() {
        Set<BreakdownKey> keys = new LinkedHashSet<>();
        for (int p = 0; p < size; p++) {
            if (stepMasks[p] != 0 && breakdowns[p] != null) {
                keys.add(breakdowns[p]);
            }
        }
        return keys;
    }

    /** First position at or after {@code from} matching {@code step}, or {@code -1}. */
    public int nextStepPosition(int step, int from) {
        if (from >= size) {
            return -1;
        }
        if (nextStep == null) {
            nextStep = new int[MAX_MASK_BITS][];
        }
        int[] next = nextStep[step];
        if (next == null) {
            next = new int[size + 1];
            next[size] = -1;
            long bit = 1L << step;
            for (int p = size - 1; p >= 0; p--) {
                next[p] = (stepMasks[p] & bit) != 0 ? p : next[p + 1];
            }
            nextStep[step] = next;
        }
        return next[Math.max(from, 0)];
    }

    /** Whether an event matching {@code exclusion} lies strictly between the two epoch-millisecond bounds. */
    public boolean hasExclusionBetween(int exclusion, long fromExclusive, long toExclusive) {
        if (fromExclusive >= toExclusive) {
            return false;
        }
        if (exclusionTimes == null) {
            exclusionTimes = new long[MAX_MASK_BITS][];
        }
        long[] hits = exclusionTimes[exclusion];
        if (hits == null) {
            long bit = 1L << exclusion;
            long[] buffer = new long[size];
            int count = 0;
            for (int p = 0; p < size; p++) {
                if ((exclusionMasks[p] & bit) != 0) {
                    buffer[count++] = times[p];
                }
            }
            hits = Arrays.copyOf(buffer, count);
            exclusionTimes[exclusion] = hits;
        }
        int idx = Arrays.binarySearch(hits, fromExclusive);
        // step past every hit equal to the lower bound
        int first = idx >= 0 ? idx : -idx - 1;
        while (first < hits.length && hits[first] <= fromExclusive) {
            first++;
        }
        return first < hits.length && hits[first] < toExclusive;
    }

    public String actorId() {
        return actorId;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public long time(int position) {
        return times[position];
    }

    public String eventId(int position) {
        return eventIds[position];
    }

    public long stepMask(int position) {
        return stepMasks[position];
    }

    public boolean matchesStep(int position, int step) {
        return (stepMasks[position] & (1L << step)) != 0;
    }

    public BreakdownKey breakdown(int position) {
        return breakdowns[position];
    }

    public boolean outOfOrder() {
        return outOfOrder;
    }

    public boolean hasUnresolvedBreakdown() {
        return unresolvedBreakdown;
    }
}
