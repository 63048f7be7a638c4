package com.funnelscope.service.core.config;

import java.util.List;

/**
 * Selects events by name, by saved action or any event, optionally narrowed by property filters.
 */
public record EventMatcher(Kind kind, String event, Long actionId, List<PropertyFilter> properties) {

    public EventMatcher {
        if (kind == null) {
            throw new IllegalArgumentException("matcher kind is required");
        }
        if (kind == Kind.EVENT && (event == null || event.isBlank())) {
            throw new IllegalArgumentException("event matcher requires an event name");
        }
        if (kind == Kind.ACTION && actionId == null) {
            throw new IllegalArgumentException("action matcher requires an action id");
        }
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public static EventMatcher event(String event) {
        return new EventMatcher(Kind.EVENT, event, null, List.of());
    }

    public static EventMatcher event(String event, List<PropertyFilter> properties) {
        return new EventMatcher(Kind.EVENT, event, null, properties);
    }

    public static EventMatcher action(long actionId) {
        return new EventMatcher(Kind.ACTION, null, actionId, List.of());
    }

    public static EventMatcher anyEvent() {
        return new EventMatcher(Kind.ANY, null, null, List.of());
    }

    public String label() {
        return switch (kind) {
            case EVENT -> event;
            case ACTION -> "action:" + actionId;
            case ANY -> "All events";
        };
    }

    /** Matcher type as reported on step results. */
    public String type() {
        return kind == Kind.ACTION ? "actions" : "events";
    }

    public enum Kind {
        EVENT,
        ACTION,
        ANY
    }
}
