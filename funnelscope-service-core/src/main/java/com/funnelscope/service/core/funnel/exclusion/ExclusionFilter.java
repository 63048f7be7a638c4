package com.funnelscope.service.core.funnel.exclusion;

import com.funnelscope.service.core.config.ExclusionDefinition;
import com.funnelscope.service.core.funnel.sequence.ActorTimeline;
import com.funnelscope.service.core.funnel.sequence.Lineage;
import java.util.List;

/**
 * Discards lineages that contain an exclusion event inside its step range.
 *
 * <p>For an exclusion over steps {@code from..to}, a lineage that reached {@code from} is discarded when an exclusion
 * event lies strictly after the time of step {@code from} and strictly before the time of step {@code to}. When the
 * lineage never reached {@code to}, the upper bound is the close of the conversion window, measured from step 0, and
 * an exclusion exactly at window close still counts, matching the inclusive window of the sequencers.
 */
public final class ExclusionFilter {
    private static final ExclusionFilter NONE = new ExclusionFilter(List.of(), 0L);

    private final List<ExclusionDefinition> exclusions;
    private final long windowMillis;

    public ExclusionFilter(List<ExclusionDefinition> exclusions, long windowMillis) {
        this.exclusions = List.copyOf(exclusions);
        this.windowMillis = windowMillis;
    }

    public static ExclusionFilter none() {
        return NONE;
    }

    public boolean isEmpty() {
        return exclusions.isEmpty();
    }

    public boolean excludes(Lineage lineage, ActorTimeline timeline) {
        for (int j = 0; j < exclusions.size(); j++) {
            ExclusionDefinition exclusion = exclusions.get(j);
            if (!lineage.reached(exclusion.fromStep())) {
                continue;
            }
            long from = lineage.time(exclusion.fromStep());
            long to = lineage.reached(exclusion.toStep())
                    ? lineage.time(exclusion.toStep())
                    : lineage.startTime() + windowMillis + 1;
            if (timeline.hasExclusionBetween(j, from, to)) {
                return true;
            }
        }
        return false;
    }
}
