package com.funnelscope.service.core.funnel.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.funnelscope.funnel.model.FunnelRun;
import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.BreakdownSpec;
import com.funnelscope.service.core.config.ConversionWindow;
import com.funnelscope.service.core.config.ExclusionDefinition;
import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.config.FunnelOrder;
import com.funnelscope.service.core.config.FunnelProperties;
import com.funnelscope.service.core.config.StepDefinition;
import com.funnelscope.service.core.funnel.aggregate.FunnelAggregator;
import com.funnelscope.service.core.funnel.aggregate.StepResult;
import com.funnelscope.service.core.funnel.diagnostics.NoopFunnelDiagnostics;
import com.funnelscope.service.core.funnel.match.PropertyBreakdownResolver;
import com.funnelscope.service.core.funnel.match.PropertyFilterEvaluator;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FunnelEnginePropertyTest {

    private static final Instant BASE = Instant.parse("2025-01-01T00:00:00Z");
    private static final List<String> NAMES = List.of("view", "cart", "checkout", "pay", "noise", "refund");
    private static final List<String> PLANS = List.of("free", "pro", "team", "enterprise", "trial");

    private FunnelProperties properties;
    private FunnelWorkerPool pool;
    private FunnelEngine engine;
    private FunnelAggregator aggregator;

    @BeforeEach
    void setUp() {
        properties = new FunnelProperties();
        properties.getEngine().setWorkers(3);
        properties.getEngine().setBatchSize(7);
        pool = new FunnelWorkerPool(properties);
        pool.start();
        engine = new FunnelEngine(
                pool,
                properties,
                new NoopFunnelDiagnostics(),
                new PropertyFilterEvaluator(),
                new PropertyBreakdownResolver(),
                Optional.empty());
        aggregator = new FunnelAggregator(properties);
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    @Test
    void stepCountsNeverIncrease() {
        for (FunnelOrder order : FunnelOrder.values()) {
            for (long seed = 1; seed <= 5; seed++) {
                List<RawEvent> events = randomEvents(seed, 60);
                FunnelDefinition definition = funnel(order, List.of());
                List<StepResult> totals = totals(definition, events);
                for (int i = 1; i < totals.size(); i++) {
                    assertThat(totals.get(i).count())
                            .as("order %s seed %d step %d", order, seed, i)
                            .isLessThanOrEqualTo(totals.get(i - 1).count());
                }
            }
        }
    }

    @Test
    void repeatedRunsAreIdentical() {
        List<RawEvent> events = randomEvents(11, 80);
        FunnelDefinition definition = funnel(FunnelOrder.ORDERED, List.of()).toBuilder()
                .breakdown(BreakdownSpec.event("plan"))
                .breakdownLimit(3)
                .build();

        FunnelEngineResult first = engine.run("team-1", definition, events, FunnelCancellation.NEVER)
                .orElseThrow();
        FunnelEngineResult second = engine.run("team-1", definition, events, FunnelCancellation.NEVER)
                .orElseThrow();

        assertThat(aggregator.breakdown(second.aggregate(), definition, 3))
                .isEqualTo(aggregator.breakdown(first.aggregate(), definition, 3));
        assertThat(aggregator.totals(second.aggregate(), definition))
                .isEqualTo(aggregator.totals(first.aggregate(), definition));
    }

    @Test
    void breakdownCountsSumToTotals() {
        for (long seed = 20; seed < 25; seed++) {
            List<RawEvent> events = randomEvents(seed, 70);
            for (int limit : new int[] {2, 25}) {
                FunnelDefinition definition = funnel(FunnelOrder.ORDERED, List.of()).toBuilder()
                        .breakdown(BreakdownSpec.event("plan"))
                        .breakdownLimit(limit)
                        .build();
                FunnelEngineResult result = engine.run("team-1", definition, events, FunnelCancellation.NEVER)
                        .orElseThrow();
                List<StepResult> totals = aggregator.totals(result.aggregate(), definition);
                List<StepResult> rows = aggregator.breakdown(result.aggregate(), definition, limit);
                for (StepResult total : totals) {
                    long sum = rows.stream()
                            .filter(r -> r.stepIndex() == total.stepIndex())
                            .mapToLong(StepResult::count)
                            .sum();
                    assertThat(sum).as("seed %d limit %d step %d", seed, limit, total.stepIndex())
                            .isEqualTo(total.count());
                }
            }
        }
    }

    @Test
    void runsStayInsideTheWindow() {
        FunnelDefinition definition = funnel(FunnelOrder.ORDERED, List.of());
        long window = definition.window().toMillis();
        for (long seed = 30; seed < 35; seed++) {
            FunnelEngineResult result = engine.run(
                            "team-1", definition, randomEvents(seed, 60), FunnelCancellation.NEVER)
                    .orElseThrow();
            for (FunnelRun run : result.totalRuns()) {
                long span = Duration.between(run.stepTimestamps().get(0), run.lastStepTimestamp())
                        .toMillis();
                assertThat(span).isLessThanOrEqualTo(window);
            }
        }
    }

    @Test
    void survivingRunsContainNoExclusionInRange() {
        FunnelDefinition definition =
                funnel(FunnelOrder.ORDERED, List.of(ExclusionDefinition.event("refund", 1, 3)));
        long window = definition.window().toMillis();
        for (long seed = 40; seed < 45; seed++) {
            List<RawEvent> events = randomEvents(seed, 60);
            FunnelEngineResult result = engine.run("team-1", definition, events, FunnelCancellation.NEVER)
                    .orElseThrow();
            for (FunnelRun run : result.totalRuns()) {
                if (!run.reached(1)) {
                    continue;
                }
                long from = run.stepTimestamps().get(1).toEpochMilli();
                // window close is inclusive, a reached end step is not
                long to = run.reached(3)
                        ? run.stepTimestamps().get(3).toEpochMilli()
                        : run.stepTimestamps().get(0).toEpochMilli() + window + 1;
                for (RawEvent event : events) {
                    if (event.actorId().equals(run.actorId()) && event.event().equals("refund")) {
                        long t = event.timestamp().toEpochMilli();
                        assertThat(t > from && t < to)
                                .as("refund of %s inside excluded range", run.actorId())
                                .isFalse();
                    }
                }
            }
        }
    }

    private List<StepResult> totals(FunnelDefinition definition, List<RawEvent> events) {
        FunnelEngineResult result = engine.run("team-1", definition, events, FunnelCancellation.NEVER)
                .orElseThrow();
        return aggregator.totals(result.aggregate(), definition);
    }

    private static FunnelDefinition funnel(FunnelOrder order, List<ExclusionDefinition> exclusions) {
        return FunnelDefinition.builder()
                .steps(List.of(
                        StepDefinition.event(0, "view"),
                        StepDefinition.event(1, "cart"),
                        StepDefinition.event(2, "checkout"),
                        StepDefinition.event(3, "pay")))
                .exclusions(exclusions)
                .window(ConversionWindow.days(1))
                .order(order)
                .build();
    }

    private static List<RawEvent> randomEvents(long seed, int actors) {
        Random random = new Random(seed);
        List<RawEvent> events = new ArrayList<>();
        int id = 0;
        for (int a = 0; a < actors; a++) {
            String actor = "actor-" + a;
            int count = 1 + random.nextInt(12);
            long offset = 0;
            for (int e = 0; e < count; e++) {
                offset += random.nextInt(8 * 3600);
                String name = NAMES.get(random.nextInt(NAMES.size()));
                String plan = PLANS.get(random.nextInt(PLANS.size()));
                events.add(RawEvent.of(
                        String.format("ev-%06d", id++),
                        actor,
                        BASE.plusSeconds(offset),
                        name,
                        Map.of("plan", plan)));
            }
        }
        return events;
    }
}
