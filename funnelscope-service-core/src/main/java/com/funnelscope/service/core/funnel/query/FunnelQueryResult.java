package com.funnelscope.service.core.funnel.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.funnelscope.service.core.funnel.aggregate.StepResult;
import com.funnelscope.service.core.funnel.engine.RunDiagnostics;
import java.util.List;

/**
 * {@code steps} are the rows to report: per breakdown value when the funnel is broken down, otherwise identical to
 * {@code totals}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunnelQueryResult(List<StepResult> steps, List<StepResult> totals, RunDiagnostics diagnostics) {

    public FunnelQueryResult {
        steps = List.copyOf(steps);
        totals = List.copyOf(totals);
    }

    public long countAt(int stepIndex) {
        return totals.get(stepIndex).count();
    }
}
