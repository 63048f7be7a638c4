package com.funnelscope.service.core.config;

import java.util.List;
import lombok.Builder;

/**
 * Complete, immutable configuration of one funnel query. Everything the engine needs to evaluate a run is here; no
 * tunable is read from shared state.
 *
 * <p>{@code breakdown} is {@code null} for funnels that are not broken down. {@code breakdownLimit} is {@code null}
 * when the caller leaves it to {@code funnelscope.breakdown.default-limit}.
 */
@Builder(toBuilder = true)
public record FunnelDefinition(
        List<StepDefinition> steps,
        List<ExclusionDefinition> exclusions,
        ConversionWindow window,
        FunnelOrder order,
        BreakdownSpec breakdown,
        BreakdownAttribution attribution,
        Integer breakdownLimit) {

    public FunnelDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        window = window == null ? ConversionWindow.DEFAULT : window;
        order = order == null ? FunnelOrder.ORDERED : order;
        attribution = attribution == null ? BreakdownAttribution.FIRST_TOUCH : attribution;
    }

    public int stepCount() {
        return steps.size();
    }

    public boolean hasBreakdown() {
        return breakdown != null;
    }

    public StepDefinition step(int index) {
        return steps.get(index);
    }

    public FunnelDefinition withBreakdownLimit(int limit) {
        return toBuilder().breakdownLimit(limit).build();
    }
}
