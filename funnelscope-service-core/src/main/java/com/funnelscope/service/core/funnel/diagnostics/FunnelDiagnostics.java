package com.funnelscope.service.core.funnel.diagnostics;

public interface FunnelDiagnostics {
    void recordQuery(String team, int actors, long elapsedMillis);

    void recordCancelled(String team, String reason);

    void recordOutOfOrderActors(long actors);

    void recordBreakdownResolutionFailures(long actors);

    void recordExcludedLineages(long lineages);

    void recordWindowTruncations(long runs);
}
