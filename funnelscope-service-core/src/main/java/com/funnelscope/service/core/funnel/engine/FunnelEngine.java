package com.funnelscope.service.core.funnel.engine;

import com.funnelscope.funnel.model.ActorEvent;
import com.funnelscope.funnel.model.FunnelRun;
import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.config.FunnelProperties;
import com.funnelscope.service.core.funnel.aggregate.FunnelAggregate;
import com.funnelscope.service.core.funnel.diagnostics.FunnelDiagnostics;
import com.funnelscope.service.core.funnel.match.FunnelEventMatcher;
import com.funnelscope.service.core.funnel.match.PropertyFilterEvaluator;
import com.funnelscope.service.core.spi.BreakdownResolver;
import com.funnelscope.service.core.spi.CohortMembership;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parallel map-then-reduce over actors. Candidate events are grouped by actor (actors in id order), cut into batches
 * of {@code funnelscope.engine.batch-size} actors and evaluated on the worker pool. Each batch owns its partial
 * aggregate; partials are merged in batch order, so identical input gives identical output regardless of worker
 * count. Cancellation is polled before each batch starts.
 */
@Component
@Slf4j
public class FunnelEngine {
    private final FunnelWorkerPool pool;
    private final FunnelProperties properties;
    private final FunnelDiagnostics diagnostics;
    private final PropertyFilterEvaluator filters;
    private final BreakdownResolver breakdownResolver;
    private final CohortMembership cohortMembership;

    public FunnelEngine(
            FunnelWorkerPool pool,
            FunnelProperties properties,
            FunnelDiagnostics diagnostics,
            PropertyFilterEvaluator filters,
            BreakdownResolver breakdownResolver,
            Optional<CohortMembership> cohortMembership) {
        this.pool = pool;
        this.properties = properties;
        this.diagnostics = diagnostics;
        this.filters = filters;
        this.breakdownResolver = breakdownResolver;
        this.cohortMembership = cohortMembership.orElse(null);
    }

    /** Runs a definition that has already been validated. */
    public FunnelOutcome<FunnelEngineResult> run(
            String team, FunnelDefinition definition, List<RawEvent> events, FunnelCancellation cancellation) {
        long started = System.nanoTime();
        FunnelCancellation cancel = cancellation == null ? FunnelCancellation.NEVER : cancellation;
        FunnelEventMatcher matcher = new FunnelEventMatcher(definition, filters, breakdownResolver);
        ActorFunnelEvaluator evaluator = new ActorFunnelEvaluator(definition, cohortMembership);

        Map<String, List<RawEvent>> byActor = new TreeMap<>();
        for (RawEvent event : events) {
            byActor.computeIfAbsent(event.actorId(), k -> new ArrayList<>()).add(event);
        }
        List<BatchTask> tasks = batches(byActor, definition, matcher, evaluator, cancel);
        log.debug(
                "Funnel query team={} actors={} events={} batches={} workers={}",
                team,
                byActor.size(),
                events.size(),
                tasks.size(),
                pool.workers());

        List<Future<BatchResult>> futures = pool.submitAll(tasks);
        List<BatchResult> results = new ArrayList<>(futures.size());
        try {
            for (Future<BatchResult> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            long processed = processed(results);
            diagnostics.recordCancelled(team, "interrupted");
            return FunnelOutcome.cancelled("interrupted", processed);
        } catch (ExecutionException ee) {
            futures.forEach(f -> f.cancel(true));
            log.error("Funnel worker batch failed team={}", team, ee.getCause());
            throw new IllegalStateException("Funnel worker batch failed", ee.getCause());
        }

        FunnelAggregate aggregate = new FunnelAggregate(definition.stepCount());
        List<FunnelRun> totalRuns = new ArrayList<>();
        List<FunnelRun> breakdownRuns = new ArrayList<>();
        RunDiagnostics run = RunDiagnostics.EMPTY;
        String cancelledReason = null;
        for (BatchResult result : results) {
            if (result.skippedReason() != null) {
                cancelledReason = result.skippedReason();
                continue;
            }
            aggregate.merge(result.aggregate());
            totalRuns.addAll(result.totalRuns());
            breakdownRuns.addAll(result.breakdownRuns());
            run = run.merge(result.diagnostics());
        }
        diagnostics.recordOutOfOrderActors(run.outOfOrderActors());
        diagnostics.recordBreakdownResolutionFailures(run.breakdownResolutionFailures());
        diagnostics.recordExcludedLineages(run.lineagesExcluded());
        diagnostics.recordWindowTruncations(run.windowTruncations());

        long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;
        if (cancelledReason != null) {
            log.info(
                    "Funnel query cancelled team={} actorsProcessed={} of {} reason={}",
                    team,
                    run.actors(),
                    byActor.size(),
                    cancelledReason);
            diagnostics.recordCancelled(team, cancelledReason);
            return FunnelOutcome.cancelled(cancelledReason, run.actors());
        }
        diagnostics.recordQuery(team, byActor.size(), elapsedMillis);
        log.info(
                "Funnel query complete team={} actors={} converting={} lineages={} excluded={} elapsedMs={}",
                team,
                byActor.size(),
                totalRuns.size(),
                run.lineagesEvaluated(),
                run.lineagesExcluded(),
                elapsedMillis);
        FunnelEngineResult value = new FunnelEngineResult(definition, aggregate, totalRuns, breakdownRuns, run);
        return FunnelOutcome.completed(value, value.partial());
    }

    private List<BatchTask> batches(
            Map<String, List<RawEvent>> byActor,
            FunnelDefinition definition,
            FunnelEventMatcher matcher,
            ActorFunnelEvaluator evaluator,
            FunnelCancellation cancel) {
        int batchSize = Math.max(1, properties.getEngine().getBatchSize());
        List<BatchTask> tasks = new ArrayList<>();
        List<Map.Entry<String, List<RawEvent>>> current = new ArrayList<>(batchSize);
        for (Map.Entry<String, List<RawEvent>> entry : byActor.entrySet()) {
            current.add(entry);
            if (current.size() == batchSize) {
                tasks.add(new BatchTask(tasks.size(), current, definition, matcher, evaluator, cancel));
                current = new ArrayList<>(batchSize);
            }
        }
        if (!current.isEmpty()) {
            tasks.add(new BatchTask(tasks.size(), current, definition, matcher, evaluator, cancel));
        }
        return tasks;
    }

    private static long processed(List<BatchResult> results) {
        long total = 0;
        for (BatchResult result : results) {
            total += result.diagnostics().actors();
        }
        return total;
    }

    private record BatchTask(
            int index,
            List<Map.Entry<String, List<RawEvent>>> actors,
            FunnelDefinition definition,
            FunnelEventMatcher matcher,
            ActorFunnelEvaluator evaluator,
            FunnelCancellation cancel)
            implements Callable<BatchResult> {

        @Override
        public BatchResult call() {
            String reason = cancel.cancellationReason();
            if (reason != null) {
                return BatchResult.skipped(definition.stepCount(), reason);
            }
            FunnelAggregate aggregate = new FunnelAggregate(definition.stepCount());
            List<FunnelRun> totals = new ArrayList<>();
            List<FunnelRun> attributed = new ArrayList<>();
            long evaluated = 0;
            long excluded = 0;
            long outOfOrder = 0;
            long unattributed = 0;
            long truncated = 0;
            for (Map.Entry<String, List<RawEvent>> entry : actors) {
                List<ActorEvent> classified = new ArrayList<>(entry.getValue().size());
                for (RawEvent event : entry.getValue()) {
                    classified.addAll(matcher.classify(event));
                }
                ActorFunnelEvaluator.ActorOutcome outcome =
                        evaluator.evaluate(entry.getKey(), classified, matcher.resolvesBreakdownPerEvent());
                evaluated += outcome.lineagesEvaluated();
                excluded += outcome.lineagesExcluded();
                if (outcome.timeline().outOfOrder()) {
                    outOfOrder++;
                    log.warn("Out-of-order events for actor={}; timeline re-sorted", entry.getKey());
                }
                if (outcome.unattributed()) {
                    unattributed++;
                    log.warn("Breakdown value unresolved for actor={}; run left out of breakdown", entry.getKey());
                }
                FunnelRun total = outcome.total();
                if (total == null) {
                    continue;
                }
                if (total.truncated()) {
                    truncated++;
                }
                totals.add(total);
                aggregate.addTotal(total);
                for (FunnelRun run : outcome.attributed()) {
                    attributed.add(run);
                    aggregate.addBreakdown(run);
                }
            }
            log.debug("Funnel batch {} done actors={} runs={}", index, actors.size(), totals.size());
            RunDiagnostics diagnostics =
                    new RunDiagnostics(actors.size(), evaluated, excluded, outOfOrder, unattributed, truncated);
            return new BatchResult(aggregate, totals, attributed, diagnostics, null);
        }
    }

    private record BatchResult(
            FunnelAggregate aggregate,
            List<FunnelRun> totalRuns,
            List<FunnelRun> breakdownRuns,
            RunDiagnostics diagnostics,
            String skippedReason) {

        static BatchResult skipped(int stepCount, String reason) {
            return new BatchResult(new FunnelAggregate(stepCount), List.of(), List.of(), RunDiagnostics.EMPTY, reason);
        }
    }
}
