package com.funnelscope.service.core.funnel.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.FunnelRun;
import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.BreakdownAttribution;
import com.funnelscope.service.core.config.BreakdownSpec;
import com.funnelscope.service.core.config.ConversionWindow;
import com.funnelscope.service.core.config.ExclusionDefinition;
import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.config.FunnelProperties;
import com.funnelscope.service.core.config.StepDefinition;
import com.funnelscope.service.core.funnel.aggregate.FunnelAggregate;
import com.funnelscope.service.core.funnel.diagnostics.FunnelDiagnosticsRegistry;
import com.funnelscope.service.core.funnel.match.PropertyBreakdownResolver;
import com.funnelscope.service.core.funnel.match.PropertyFilterEvaluator;
import com.funnelscope.service.core.spi.CohortMembership;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FunnelEngineTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private FunnelProperties properties;
    private FunnelWorkerPool pool;
    private FunnelDiagnosticsRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new FunnelProperties();
        properties.getEngine().setWorkers(1);
        properties.getEngine().setBatchSize(1);
        pool = new FunnelWorkerPool(properties);
        pool.start();
        registry = new FunnelDiagnosticsRegistry();
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    @Test
    void firstTouchLastTouchAndStepAttribution() {
        List<RawEvent> events = List.of(
                browserEvent("e1", "u1", 0, "signup", "Chrome"),
                browserEvent("e2", "u1", 60, "pageview", "Safari"),
                browserEvent("e3", "u1", 120, "purchase", "Firefox"));

        assertThat(onlyBreakdown(run(browserFunnel(BreakdownAttribution.FIRST_TOUCH), events)))
                .isEqualTo(BreakdownKey.of("Chrome"));
        assertThat(onlyBreakdown(run(browserFunnel(BreakdownAttribution.LAST_TOUCH), events)))
                .isEqualTo(BreakdownKey.of("Firefox"));
        assertThat(onlyBreakdown(run(browserFunnel(BreakdownAttribution.step(1)), events)))
                .isEqualTo(BreakdownKey.of("Safari"));
    }

    @Test
    void stepAttributionLeavesUnreachedRunsOutOfBreakdownOnly() {
        List<RawEvent> events = List.of(
                browserEvent("e1", "u1", 0, "signup", "Chrome"),
                browserEvent("e2", "u1", 60, "pageview", "Safari"));

        FunnelEngineResult result = run(browserFunnel(BreakdownAttribution.step(2)), events);

        assertThat(result.totalRuns()).hasSize(1);
        assertThat(result.totalRuns().get(0).stepsReached()).isEqualTo(2);
        assertThat(result.breakdownRuns()).isEmpty();
        assertThat(result.aggregate().buckets()).isEmpty();
        assertThat(result.diagnostics().breakdownResolutionFailures()).isZero();
    }

    @Test
    void allEventsSequencesEachValueSeparately() {
        List<RawEvent> events = List.of(
                browserEvent("e1", "u1", 0, "signup", "Chrome"),
                browserEvent("e2", "u1", 60, "signup", "Safari"),
                browserEvent("e3", "u1", 120, "pageview", "Safari"),
                browserEvent("e4", "u1", 180, "pageview", "Chrome"));

        FunnelEngineResult result = run(browserFunnel(BreakdownAttribution.ALL_EVENTS), events);

        assertThat(result.totalRuns()).hasSize(1);
        assertThat(result.breakdownRuns())
                .extracting(FunnelRun::breakdown)
                .containsExactly(BreakdownKey.of("Chrome"), BreakdownKey.of("Safari"));
        assertThat(result.breakdownRuns()).allSatisfy(run -> assertThat(run.stepsReached())
                .isEqualTo(2));
        FunnelAggregate.Bucket chrome = result.aggregate().buckets().get(BreakdownKey.of("Chrome"));
        assertThat(chrome.samples(1).get(0)).isEqualTo(180.0);
        FunnelAggregate.Bucket safari = result.aggregate().buckets().get(BreakdownKey.of("Safari"));
        assertThat(safari.samples(1).get(0)).isEqualTo(60.0);
    }

    @Test
    void missingPropertyGroupsUnderEmptyKey() {
        List<RawEvent> events = List.of(
                RawEvent.of("e1", "u1", T0, "signup"), RawEvent.of("e2", "u1", T0.plusSeconds(5), "pageview"));

        FunnelEngineResult result = run(browserFunnel(BreakdownAttribution.FIRST_TOUCH), events);

        assertThat(onlyBreakdown(result)).isEqualTo(BreakdownKey.empty());
        assertThat(onlyBreakdown(result).display()).isEmpty();
    }

    @Test
    void malformedBreakdownValueStillCountsInTotals() {
        List<RawEvent> events = List.of(
                RawEvent.of("e1", "u1", T0, "signup", Map.of("$browser", Map.of("name", "Chrome"))),
                browserEvent("e2", "u2", 0, "signup", "Safari"));

        FunnelEngineResult result = run(browserFunnel(BreakdownAttribution.FIRST_TOUCH), events);

        assertThat(result.totalRuns()).extracting(FunnelRun::actorId).containsExactly("u1", "u2");
        assertThat(result.breakdownRuns()).extracting(FunnelRun::actorId).containsExactly("u2");
        assertThat(result.diagnostics().breakdownResolutionFailures()).isEqualTo(1);
        assertThat(registry.snapshot().breakdownResolutionFailures()).isEqualTo(1);
    }

    @Test
    void cohortBreakdownDuplicatesRunPerMembership() {
        FunnelDefinition definition = steps("signup", "pageview").toBuilder()
                .breakdown(BreakdownSpec.cohorts(List.of(BreakdownSpec.ALL_USERS_COHORT_ID, 7L)))
                .build();
        List<RawEvent> events = List.of(
                RawEvent.of("e1", "u1", T0, "signup"), RawEvent.of("e2", "u2", T0, "signup"));
        FunnelEngine engine = engine(Optional.of(new InMemoryCohorts(Map.of(7L, Set.of("u1")))));

        FunnelEngineResult result = engine.run("team-1", definition, events, FunnelCancellation.NEVER)
                .orElseThrow();

        assertThat(result.breakdownRuns())
                .extracting(run -> run.actorId() + ":" + run.breakdown().display())
                .containsExactly("u1:all users", "u1:Power users", "u2:all users");
    }

    @Test
    void cohortBreakdownWithoutMembershipIsRejected() {
        FunnelDefinition definition = steps("signup", "pageview").toBuilder()
                .breakdown(BreakdownSpec.cohorts(List.of(7L)))
                .build();

        assertThrows(
                IllegalStateException.class,
                () -> engine(Optional.empty()).run("team-1", definition, List.of(), FunnelCancellation.NEVER));
    }

    @Test
    void stepEventAlsoCountsAsExclusionForLaterRange() {
        FunnelDefinition definition = steps("pageview", "signup", "purchase").toBuilder()
                .exclusions(List.of(ExclusionDefinition.event("pageview", 1, 2)))
                .build();
        List<RawEvent> events = List.of(
                RawEvent.of("e1", "u1", T0, "pageview"),
                RawEvent.of("e2", "u1", T0.plusSeconds(60), "signup"),
                RawEvent.of("e3", "u1", T0.plusSeconds(120), "pageview"),
                RawEvent.of("e4", "u1", T0.plusSeconds(180), "purchase"));

        FunnelEngineResult result = run(definition, events);

        // the pageview -> signup -> purchase lineage is discarded; the one anchored at e3 stops at step 0
        assertThat(result.totalRuns()).hasSize(1);
        assertThat(result.totalRuns().get(0).stepsReached()).isEqualTo(1);
        assertThat(result.aggregate().total().count(0)).isEqualTo(1L);
        assertThat(result.aggregate().total().count(1)).isZero();
        assertThat(result.aggregate().total().count(2)).isZero();
        assertThat(result.diagnostics().lineagesExcluded()).isEqualTo(1L);
    }

    @Test
    void outOfOrderEventsAreResortedAndReported() {
        List<RawEvent> events = List.of(
                RawEvent.of("e2", "u1", T0.plusSeconds(30), "pageview"), RawEvent.of("e1", "u1", T0, "signup"));

        FunnelEngineResult result = run(steps("signup", "pageview"), events);

        assertThat(result.totalRuns().get(0).stepsReached()).isEqualTo(2);
        assertThat(result.diagnostics().outOfOrderActors()).isEqualTo(1);
        assertThat(registry.snapshot().outOfOrderActors()).isEqualTo(1);
    }

    @Test
    void windowTruncationMarksOutcomePartial() {
        FunnelDefinition definition = steps("signup", "pageview").toBuilder()
                .window(ConversionWindow.seconds(10))
                .build();
        List<RawEvent> events = List.of(
                RawEvent.of("e1", "u1", T0, "signup"), RawEvent.of("e2", "u1", T0.plusSeconds(11), "pageview"));

        FunnelOutcome<FunnelEngineResult> outcome =
                engine(Optional.empty()).run("team-1", definition, events, FunnelCancellation.NEVER);

        assertThat(outcome).isInstanceOf(FunnelOutcome.Completed.class);
        assertThat(((FunnelOutcome.Completed<FunnelEngineResult>) outcome).partial()).isTrue();
        assertThat(outcome.orElseThrow().totalRuns().get(0).stepsReached()).isEqualTo(1);
    }

    @Test
    void cancellationIsCheckedBetweenBatches() {
        List<RawEvent> events = List.of(
                RawEvent.of("e1", "u1", T0, "signup"),
                RawEvent.of("e2", "u2", T0, "signup"),
                RawEvent.of("e3", "u3", T0, "signup"));
        AtomicInteger polls = new AtomicInteger();
        FunnelCancellation afterFirstBatch = () -> polls.getAndIncrement() == 0 ? null : "deadline";

        FunnelOutcome<FunnelEngineResult> outcome =
                engine(Optional.empty()).run("team-1", steps("signup", "pageview"), events, afterFirstBatch);

        assertThat(outcome.isCompleted()).isFalse();
        FunnelOutcome.Cancelled<FunnelEngineResult> cancelled = (FunnelOutcome.Cancelled<FunnelEngineResult>) outcome;
        assertThat(cancelled.actorsProcessed()).isEqualTo(1);
        assertThat(cancelled.reason()).isEqualTo("deadline");
        assertThrows(FunnelCancelledException.class, outcome::orElseThrow);
        assertThat(registry.snapshot().queriesCancelled()).isEqualTo(1);
    }

    @Test
    void expiredDeadlineCancelsBeforeAnyActor() {
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        FunnelCancellation deadline = FunnelCancellation.deadline(clock, T0.minusSeconds(1));

        FunnelOutcome<FunnelEngineResult> outcome = engine(Optional.empty())
                .run("team-1", steps("signup", "pageview"), List.of(RawEvent.of("e1", "u1", T0, "signup")), deadline);

        assertThat(outcome.isCompleted()).isFalse();
        assertThat(((FunnelOutcome.Cancelled<FunnelEngineResult>) outcome).actorsProcessed()).isZero();
    }

    @Test
    void resultsDoNotDependOnWorkerCount() {
        List<RawEvent> events = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            events.add(browserEvent("s" + i, "u" + i, i, "signup", i % 3 == 0 ? "Chrome" : "Safari"));
            events.add(browserEvent("p" + i, "u" + i, 7 * i + 1, "pageview", "Chrome"));
        }
        FunnelDefinition definition = browserFunnel(BreakdownAttribution.FIRST_TOUCH);
        FunnelEngineResult single = run(definition, events);

        FunnelProperties wide = new FunnelProperties();
        wide.getEngine().setWorkers(4);
        wide.getEngine().setBatchSize(3);
        FunnelWorkerPool widePool = new FunnelWorkerPool(wide);
        widePool.start();
        try {
            FunnelEngine engine = new FunnelEngine(
                    widePool,
                    wide,
                    registry,
                    new PropertyFilterEvaluator(),
                    new PropertyBreakdownResolver(),
                    Optional.empty());
            FunnelEngineResult parallel = engine.run("team-1", definition, events, FunnelCancellation.NEVER)
                    .orElseThrow();
            assertThat(parallel.totalRuns()).isEqualTo(single.totalRuns());
            assertThat(parallel.breakdownRuns()).isEqualTo(single.breakdownRuns());
            assertThat(parallel.diagnostics()).isEqualTo(single.diagnostics());
        } finally {
            widePool.stop();
        }
    }

    private FunnelEngineResult run(FunnelDefinition definition, List<RawEvent> events) {
        return engine(Optional.empty())
                .run("team-1", definition, events, FunnelCancellation.NEVER)
                .orElseThrow();
    }

    private FunnelEngine engine(Optional<CohortMembership> cohorts) {
        return new FunnelEngine(
                pool, properties, registry, new PropertyFilterEvaluator(), new PropertyBreakdownResolver(), cohorts);
    }

    private static BreakdownKey onlyBreakdown(FunnelEngineResult result) {
        assertThat(result.breakdownRuns()).hasSize(1);
        return result.breakdownRuns().get(0).breakdown();
    }

    private static FunnelDefinition browserFunnel(BreakdownAttribution attribution) {
        return steps("signup", "pageview", "purchase").toBuilder()
                .breakdown(BreakdownSpec.event("$browser"))
                .attribution(attribution)
                .build();
    }

    private static FunnelDefinition steps(String... names) {
        List<StepDefinition> defs = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            defs.add(StepDefinition.event(i, names[i]));
        }
        return FunnelDefinition.builder().steps(defs).build();
    }

    private static RawEvent browserEvent(String id, String actor, long offsetSeconds, String name, String browser) {
        return RawEvent.of(id, actor, T0.plusSeconds(offsetSeconds), name, Map.of("$browser", browser));
    }

    private static final class InMemoryCohorts implements CohortMembership {
        private final Map<Long, Set<String>> members;

        private InMemoryCohorts(Map<Long, Set<String>> members) {
            this.members = members;
        }

        @Override
        public boolean isMember(String actorId, long cohortId) {
            return members.getOrDefault(cohortId, Set.of()).contains(actorId);
        }

        @Override
        public String cohortName(long cohortId) {
            return cohortId == 7L ? "Power users" : null;
        }
    }
}
