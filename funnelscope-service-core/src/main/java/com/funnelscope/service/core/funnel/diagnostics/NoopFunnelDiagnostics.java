package com.funnelscope.service.core.funnel.diagnostics;

public class NoopFunnelDiagnostics implements FunnelDiagnostics {
    @Override
    public void recordQuery(String team, int actors, long elapsedMillis) {}

    @Override
    public void recordCancelled(String team, String reason) {}

    @Override
    public void recordOutOfOrderActors(long actors) {}

    @Override
    public void recordBreakdownResolutionFailures(long actors) {}

    @Override
    public void recordExcludedLineages(long lineages) {}

    @Override
    public void recordWindowTruncations(long runs) {}
}
