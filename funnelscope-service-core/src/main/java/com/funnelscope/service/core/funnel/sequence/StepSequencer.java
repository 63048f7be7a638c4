package com.funnelscope.service.core.funnel.sequence;

import java.util.List;

/** Enumerates candidate lineages of one actor under an ordering discipline. */
public interface StepSequencer {

    /**
     * Every lineage the actor starts, one per starting position, truncated at the conversion window.
     *
     * @param windowMillis conversion window, inclusive
     */
    List<Lineage> lineages(ActorTimeline timeline, int stepCount, long windowMillis);
}
