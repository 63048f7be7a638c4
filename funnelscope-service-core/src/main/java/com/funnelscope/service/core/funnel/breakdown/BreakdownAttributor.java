package com.funnelscope.service.core.funnel.breakdown;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.service.core.config.BreakdownAttribution;
import com.funnelscope.service.core.funnel.sequence.ActorTimeline;
import com.funnelscope.service.core.funnel.sequence.Lineage;

/**
 * Picks the breakdown key that represents a lineage under a single-valued attribution policy. {@code all_events}
 * has no single representative and is handled by partitioning the timeline instead.
 *
 * <p>A {@code null} result keeps the lineage out of breakdown-partitioned output: the value failed to resolve, or the
 * lineage never reached the attributed step.
 */
public final class BreakdownAttributor {
    private final BreakdownAttribution policy;

    public BreakdownAttributor(BreakdownAttribution policy) {
        if (policy instanceof BreakdownAttribution.AllEvents) {
            throw new IllegalArgumentException("all_events attribution partitions the timeline; no single key applies");
        }
        this.policy = policy;
    }

    public BreakdownKey attribute(Lineage lineage, ActorTimeline timeline) {
        int position = position(lineage);
        return position < 0 ? null : timeline.breakdown(position);
    }

    /** Timeline position whose value represents the lineage, or {@code -1} when the attributed step was not reached. */
    public int position(Lineage lineage) {
        if (policy instanceof BreakdownAttribution.FirstTouch) {
            return lineage.position(0);
        }
        if (policy instanceof BreakdownAttribution.LastTouch) {
            return lineage.lastPosition();
        }
        if (policy instanceof BreakdownAttribution.Step step) {
            return lineage.reached(step.stepIndex()) ? lineage.position(step.stepIndex()) : -1;
        }
        throw new IllegalStateException("Unsupported attribution " + policy.configValue());
    }
}
