package com.funnelscope.service.core.funnel.actors;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.FunnelRun;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Projects computed runs onto the actors matching a step filter and, optionally, a breakdown value. Filtering then
 * ordering then paging; no sequencing happens here.
 */
public final class ActorLocator {

    private ActorLocator() {}

    /**
     * @param totalRuns one run per actor, used when no breakdown value is requested
     * @param breakdownRuns attributed runs, used when {@code breakdown} is set
     * @param retained keys that survived the breakdown limit; {@link BreakdownKey#other()} matches every other key
     * @param ordering secondary actor ordering, natural id order when {@code null}
     */
    public static ActorPage locate(
            List<FunnelRun> totalRuns,
            List<FunnelRun> breakdownRuns,
            StepFilter filter,
            BreakdownKey breakdown,
            Set<BreakdownKey> retained,
            Comparator<String> ordering,
            long offset,
            int limit) {
        Set<String> matched = new LinkedHashSet<>();
        List<FunnelRun> source = breakdown == null ? totalRuns : breakdownRuns;
        for (FunnelRun run : source) {
            if (!filter.matches(run)) {
                continue;
            }
            if (breakdown != null && !breakdownMatches(run.breakdown(), breakdown, retained)) {
                continue;
            }
            matched.add(run.actorId());
        }
        List<String> ordered = new ArrayList<>(matched);
        ordered.sort(ordering == null ? Comparator.naturalOrder() : ordering);

        long off = Math.max(0, offset);
        int lim = limit <= 0 ? ActorPage.DEFAULT_LIMIT : Math.min(limit, ActorPage.MAX_LIMIT);
        int from = (int) Math.min(off, ordered.size());
        int to = (int) Math.min((long) from + lim, ordered.size());
        return new ActorPage(ordered.subList(from, to), off, lim, ordered.size());
    }

    private static boolean breakdownMatches(BreakdownKey actual, BreakdownKey wanted, Set<BreakdownKey> retained) {
        if (actual == null) {
            return false;
        }
        if (wanted.isOther()) {
            return retained != null && !retained.contains(actual);
        }
        return wanted.equals(actual);
    }
}
