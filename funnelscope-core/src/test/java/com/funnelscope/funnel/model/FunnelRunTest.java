package com.funnelscope.funnel.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class FunnelRunTest {

    private static final Instant T0 = Instant.parse("2025-05-01T00:00:00Z");

    @Test
    void conversionTimesAreSecondsBetweenConsecutiveSteps() {
        FunnelRun run = new FunnelRun(
                "u1", 3, List.of(T0, T0.plusSeconds(90), T0.plusMillis(91_500)), null, false);

        assertNull(run.conversionTimeSeconds(0));
        assertEquals(90.0d, run.conversionTimeSeconds(1));
        assertEquals(1.5d, run.conversionTimeSeconds(2));
        assertNull(run.conversionTimeSeconds(3));
        assertEquals(List.of(90.0d, 1.5d), run.conversionTimes());
        assertEquals(T0.plusMillis(91_500), run.lastStepTimestamp());
    }

    @Test
    void reachedCountsCompletedSteps() {
        FunnelRun run = new FunnelRun("u1", 1, List.of(T0), null, true);

        assertTrue(run.reached(0));
        assertFalse(run.reached(1));
        assertTrue(run.conversionTimes().isEmpty());
    }

    @Test
    void withBreakdownKeepsEverythingElse() {
        FunnelRun run = new FunnelRun("u1", 1, List.of(T0), null, true);

        FunnelRun attributed = run.withBreakdown(BreakdownKey.of("Safari"));

        assertEquals(BreakdownKey.of("Safari"), attributed.breakdown());
        assertEquals(run.stepTimestamps(), attributed.stepTimestamps());
        assertTrue(attributed.truncated());
    }

    @Test
    void timestampsMustMatchStepsReached() {
        assertThrows(IllegalArgumentException.class, () -> new FunnelRun("u1", 2, List.of(T0), null, false));
    }
}
