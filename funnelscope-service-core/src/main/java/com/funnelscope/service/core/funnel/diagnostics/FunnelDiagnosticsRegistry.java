package com.funnelscope.service.core.funnel.diagnostics;

import java.util.concurrent.atomic.LongAdder;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
public class FunnelDiagnosticsRegistry implements FunnelDiagnostics {
    private final LongAdder queries = new LongAdder();
    private final LongAdder queriesCancelled = new LongAdder();
    private final LongAdder actorsProcessed = new LongAdder();
    private final LongAdder queryMillis = new LongAdder();
    private final LongAdder outOfOrderActors = new LongAdder();
    private final LongAdder breakdownResolutionFailures = new LongAdder();
    private final LongAdder excludedLineages = new LongAdder();
    private final LongAdder windowTruncations = new LongAdder();

    @Override
    public void recordQuery(String team, int actors, long elapsedMillis) {
        queries.increment();
        actorsProcessed.add(actors);
        queryMillis.add(Math.max(0, elapsedMillis));
    }

    @Override
    public void recordCancelled(String team, String reason) {
        queriesCancelled.increment();
    }

    @Override
    public void recordOutOfOrderActors(long actors) {
        if (actors > 0) {
            outOfOrderActors.add(actors);
        }
    }

    @Override
    public void recordBreakdownResolutionFailures(long actors) {
        if (actors > 0) {
            breakdownResolutionFailures.add(actors);
        }
    }

    @Override
    public void recordExcludedLineages(long lineages) {
        if (lineages > 0) {
            excludedLineages.add(lineages);
        }
    }

    @Override
    public void recordWindowTruncations(long runs) {
        if (runs > 0) {
            windowTruncations.add(runs);
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(
                queries.sum(),
                queriesCancelled.sum(),
                actorsProcessed.sum(),
                queryMillis.sum(),
                outOfOrderActors.sum(),
                breakdownResolutionFailures.sum(),
                excludedLineages.sum(),
                windowTruncations.sum());
    }

    public record Snapshot(
            long queries,
            long queriesCancelled,
            long actorsProcessed,
            long queryMillis,
            long outOfOrderActors,
            long breakdownResolutionFailures,
            long excludedLineages,
            long windowTruncations) {}
}
