package com.funnelscope.funnel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A candidate event as handed over by the event store, before it is classified against funnel steps.
 *
 * <p>{@code actionIds} lists the saved actions the event belongs to; {@code groupProperties} is keyed by group type
 * index.
 */
@JsonInclude(Include.NON_NULL)
public record RawEvent(
        String eventId,
        String actorId,
        Instant timestamp,
        String event,
        Set<Long> actionIds,
        EventProperties properties,
        EventProperties actorProperties,
        Map<Integer, EventProperties> groupProperties) {

    public RawEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(timestamp, "timestamp");
        actionIds = actionIds == null ? Set.of() : Set.copyOf(actionIds);
        properties = properties == null ? EventProperties.empty() : properties;
        actorProperties = actorProperties == null ? EventProperties.empty() : actorProperties;
        groupProperties = groupProperties == null ? Map.of() : Map.copyOf(groupProperties);
    }

    public static RawEvent of(String eventId, String actorId, Instant timestamp, String event) {
        return new RawEvent(eventId, actorId, timestamp, event, Set.of(), null, null, null);
    }

    public static RawEvent of(
            String eventId, String actorId, Instant timestamp, String event, Map<String, Object> properties) {
        return new RawEvent(
                eventId, actorId, timestamp, event, Set.of(), EventProperties.of(properties), null, null);
    }

    public EventProperties groupProperties(int groupTypeIndex) {
        EventProperties props = groupProperties.get(groupTypeIndex);
        return props == null ? EventProperties.empty() : props;
    }
}
