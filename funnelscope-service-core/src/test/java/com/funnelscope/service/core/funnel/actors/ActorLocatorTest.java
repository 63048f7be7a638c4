package com.funnelscope.service.core.funnel.actors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.FunnelRun;
import com.funnelscope.service.core.config.FunnelConfigurationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ActorLocatorTest {

    private static final Instant T0 = Instant.parse("2025-05-01T00:00:00Z");

    private final List<FunnelRun> totals =
            List.of(run("carol", 3, null), run("alice", 1, null), run("bob", 2, null), run("dave", 2, null));

    @Test
    void positiveFilterSelectsActorsThatReachedStep() {
        ActorPage page = ActorLocator.locate(totals, List.of(), StepFilter.of(2, 3), null, null, null, 0, 10);

        assertThat(page.actorIds()).containsExactly("bob", "carol", "dave");
        assertThat(page.total()).isEqualTo(3L);
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void negativeFilterSelectsDropOffsBetweenSteps() {
        ActorPage page = ActorLocator.locate(totals, List.of(), StepFilter.of(-3, 3), null, null, null, 0, 10);

        assertThat(page.actorIds()).containsExactly("bob", "dave");
    }

    @Test
    void pagesAfterOrdering() {
        ActorPage page = ActorLocator.locate(
                totals, List.of(), StepFilter.reached(1), null, null, Comparator.reverseOrder(), 1, 2);

        assertThat(page.actorIds()).containsExactly("carol", "bob");
        assertThat(page.total()).isEqualTo(4L);
        assertThat(page.hasMore()).isTrue();
    }

    @Test
    void offsetPastEndGivesEmptyPage() {
        ActorPage page = ActorLocator.locate(totals, List.of(), StepFilter.reached(1), null, null, null, 10, 2);

        assertThat(page.actorIds()).isEmpty();
        assertThat(page.total()).isEqualTo(4L);
    }

    @Test
    void breakdownValueSelectsAttributedRunsOnly() {
        List<FunnelRun> attributed = List.of(
                run("alice", 2, BreakdownKey.of("Chrome")),
                run("bob", 2, BreakdownKey.of("Safari")),
                run("carol", 2, BreakdownKey.of("Edge")),
                run("carol", 2, BreakdownKey.of("Safari")));
        Set<BreakdownKey> retained = Set.of(BreakdownKey.of("Safari"));

        ActorPage safari = ActorLocator.locate(
                totals, attributed, StepFilter.reached(2), BreakdownKey.of("Safari"), retained, null, 0, 10);
        ActorPage other = ActorLocator.locate(
                totals, attributed, StepFilter.reached(2), BreakdownKey.other(), retained, null, 0, 10);

        assertThat(safari.actorIds()).containsExactly("bob", "carol");
        assertThat(other.actorIds()).containsExactly("alice", "carol");
    }

    @Test
    void limitDefaultsAndCaps() {
        assertThat(ActorLocator.locate(totals, List.of(), StepFilter.reached(1), null, null, null, 0, 0).limit())
                .isEqualTo(ActorPage.DEFAULT_LIMIT);
        assertThat(ActorLocator.locate(totals, List.of(), StepFilter.reached(1), null, null, null, 0, 1_000_000)
                        .limit())
                .isEqualTo(ActorPage.MAX_LIMIT);
    }

    @Test
    void rejectsStepFiltersThatNameNoStep() {
        assertThrows(FunnelConfigurationException.class, () -> StepFilter.of(0, 3));
        assertThrows(FunnelConfigurationException.class, () -> StepFilter.of(-1, 3));
        assertThrows(FunnelConfigurationException.class, () -> StepFilter.of(4, 3));
        assertThrows(FunnelConfigurationException.class, () -> StepFilter.of(-4, 3));
        assertThat(StepFilter.of(-2, 3).dropOff()).isTrue();
    }

    private static FunnelRun run(String actor, int steps, BreakdownKey key) {
        List<Instant> times = new ArrayList<>();
        for (int i = 0; i < steps; i++) {
            times.add(T0.plusSeconds(i * 60L));
        }
        return new FunnelRun(actor, steps, times, key, false);
    }
}
