package com.funnelscope.service.core.funnel.engine;

/** Per-query counters, summed across worker batches. */
public record RunDiagnostics(
        long actors,
        long lineagesEvaluated,
        long lineagesExcluded,
        long outOfOrderActors,
        long breakdownResolutionFailures,
        long windowTruncations) {

    public static final RunDiagnostics EMPTY = new RunDiagnostics(0, 0, 0, 0, 0, 0);

    public RunDiagnostics merge(RunDiagnostics other) {
        return new RunDiagnostics(
                actors + other.actors,
                lineagesEvaluated + other.lineagesEvaluated,
                lineagesExcluded + other.lineagesExcluded,
                outOfOrderActors + other.outOfOrderActors,
                breakdownResolutionFailures + other.breakdownResolutionFailures,
                windowTruncations + other.windowTruncations);
    }
}
