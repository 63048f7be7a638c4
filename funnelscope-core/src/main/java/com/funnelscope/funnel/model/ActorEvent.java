package com.funnelscope.funnel.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One classified event of an actor: the step it matched (or {@code null} for an event that matched no step), the
 * exclusions it satisfies and its resolved breakdown key.
 *
 * <p>{@code breakdown} is {@code null} when no breakdown is configured or when the value could not be resolved; a
 * missing property is {@link BreakdownKey#empty()}.
 */
public record ActorEvent(
        String actorId,
        String eventId,
        Instant timestamp,
        Integer matchedStep,
        Set<Integer> matchedExclusions,
        BreakdownKey breakdown,
        Map<String, Object> extraFields) {

    public ActorEvent {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        matchedExclusions = matchedExclusions == null ? Set.of() : Set.copyOf(matchedExclusions);
        extraFields = extraFields == null ? Map.of() : Map.copyOf(extraFields);
    }

    public static ActorEvent step(String actorId, String eventId, Instant timestamp, int step, BreakdownKey breakdown) {
        return new ActorEvent(actorId, eventId, timestamp, step, Set.of(), breakdown, Map.of());
    }

    public static ActorEvent exclusion(String actorId, String eventId, Instant timestamp, Set<Integer> exclusions) {
        return new ActorEvent(actorId, eventId, timestamp, null, exclusions, null, Map.of());
    }

    public static ActorEvent unmatched(String actorId, String eventId, Instant timestamp, BreakdownKey breakdown) {
        return new ActorEvent(actorId, eventId, timestamp, null, Set.of(), breakdown, Map.of());
    }

    public boolean matchesStep() {
        return matchedStep != null;
    }
}
