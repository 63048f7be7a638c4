package com.funnelscope.service.core.funnel.query;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.FunnelConfigurationException;
import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.config.FunnelDefinitionValidator;
import com.funnelscope.service.core.config.FunnelProperties;
import com.funnelscope.service.core.funnel.actors.ActorLocator;
import com.funnelscope.service.core.funnel.actors.ActorPage;
import com.funnelscope.service.core.funnel.actors.StepFilter;
import com.funnelscope.service.core.funnel.aggregate.FunnelAggregator;
import com.funnelscope.service.core.funnel.aggregate.StepResult;
import com.funnelscope.service.core.funnel.aggregate.TimeToConvertCalculator;
import com.funnelscope.service.core.funnel.aggregate.TimeToConvertResult;
import com.funnelscope.service.core.funnel.engine.FunnelCancellation;
import com.funnelscope.service.core.funnel.engine.FunnelEngine;
import com.funnelscope.service.core.funnel.engine.FunnelEngineResult;
import com.funnelscope.service.core.funnel.engine.FunnelOutcome;
import com.funnelscope.service.core.spi.CandidateEventSource;
import com.funnelscope.service.core.support.DurationParser;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Entry point for funnel queries. Every operation validates the definition before any event is fetched, runs the
 * engine once and projects its result.
 */
@Service
@RequiredArgsConstructor
public class FunnelQueryService {
    private final CandidateEventSource eventSource;
    private final FunnelEngine engine;
    private final FunnelAggregator aggregator;
    private final FunnelDefinitionValidator validator;
    private final FunnelProperties properties;
    private final Clock clock;

    public FunnelOutcome<FunnelQueryResult> runFunnel(FunnelQueryRequest request) {
        FunnelDefinition definition = prepare(request);
        return execute(request, definition).map(result -> toQueryResult(result, definition));
    }

    public FunnelOutcome<ActorPage> listActorsAtStep(ActorQueryRequest request) {
        FunnelDefinition definition = prepare(request.query());
        StepFilter filter = StepFilter.of(request.step(), definition.stepCount());
        BreakdownKey breakdownValue = request.breakdownValue();
        if (breakdownValue != null && !definition.hasBreakdown()) {
            throw new FunnelConfigurationException("breakdown value given for a funnel without breakdown");
        }
        return execute(request.query(), definition).map(result -> {
            Set<BreakdownKey> retained = breakdownValue == null
                    ? Set.of()
                    : aggregator.retainedKeys(result.aggregate(), definition.breakdownLimit());
            return ActorLocator.locate(
                    result.totalRuns(),
                    result.breakdownRuns(),
                    filter,
                    breakdownValue,
                    retained,
                    request.ordering(),
                    request.offset(),
                    request.limit());
        });
    }

    /**
     * Conversion time distribution between two steps (0-indexed). {@code binCount} may be {@code null} for the
     * automatic bin count.
     */
    public FunnelOutcome<TimeToConvertResult> timeToConvert(
            FunnelQueryRequest request, int fromStep, int toStep, Integer binCount) {
        FunnelDefinition definition = prepare(request);
        if (fromStep < 0 || toStep <= fromStep || toStep >= definition.stepCount()) {
            throw new FunnelConfigurationException("time to convert needs steps 0 <= from < to < "
                    + definition.stepCount() + ", got " + fromStep + ".." + toStep);
        }
        return execute(request, definition)
                .map(result -> TimeToConvertCalculator.calculate(result.totalRuns(), fromStep, toStep, binCount));
    }

    private FunnelDefinition prepare(FunnelQueryRequest request) {
        validator.validate(request.definition());
        FunnelDefinition definition = request.definition();
        if (definition.breakdownLimit() == null) {
            definition = definition.withBreakdownLimit(properties.getBreakdown().getDefaultLimit());
        }
        return definition;
    }

    private FunnelOutcome<FunnelEngineResult> execute(FunnelQueryRequest request, FunnelDefinition definition) {
        FunnelCancellation timeout = FunnelCancellation.deadline(
                clock, clock.instant().plus(DurationParser.parse(properties.getEngine().getTimeout())));
        FunnelCancellation cancellation =
                request.cancellation() == null ? timeout : request.cancellation().or(timeout);
        Instant from = request.dateRange().start();
        Instant to = request.dateRange().end();
        List<RawEvent> events = eventSource.fetchCandidateEvents(request.team(), from, to, definition);
        return engine.run(request.team(), definition, events, cancellation);
    }

    private FunnelQueryResult toQueryResult(FunnelEngineResult result, FunnelDefinition definition) {
        List<StepResult> totals = aggregator.totals(result.aggregate(), definition);
        List<StepResult> steps = definition.hasBreakdown()
                ? aggregator.breakdown(result.aggregate(), definition, definition.breakdownLimit())
                : totals;
        return new FunnelQueryResult(steps, totals, result.diagnostics());
    }
}
