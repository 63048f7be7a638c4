package com.funnelscope.service.core.funnel.engine;

import com.funnelscope.funnel.model.FunnelRun;
import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.funnel.aggregate.FunnelAggregate;
import java.util.List;

/**
 * Everything one engine pass produced. {@code totalRuns} has one run per actor that started the funnel;
 * {@code breakdownRuns} has the attributed runs, possibly several per actor under {@code all_events} or cohort
 * breakdowns.
 */
public record FunnelEngineResult(
        FunnelDefinition definition,
        FunnelAggregate aggregate,
        List<FunnelRun> totalRuns,
        List<FunnelRun> breakdownRuns,
        RunDiagnostics diagnostics) {

    public FunnelEngineResult {
        totalRuns = List.copyOf(totalRuns);
        breakdownRuns = List.copyOf(breakdownRuns);
    }

    public boolean partial() {
        return diagnostics.windowTruncations() > 0;
    }
}
