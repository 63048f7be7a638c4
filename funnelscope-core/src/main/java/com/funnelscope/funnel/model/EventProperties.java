package com.funnelscope.funnel.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Property bag attached to an event, a person or a group. Serialises as a plain JSON object.
 */
@JsonInclude(Include.NON_NULL)
public final class EventProperties {
    private static final EventProperties EMPTY = new EventProperties(Map.of());

    private final Map<String, Object> properties;

    public EventProperties() {
        this.properties = new LinkedHashMap<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public EventProperties(Map<String, Object> properties) {
        if (properties != null) {
            this.properties = new LinkedHashMap<>(properties);
        } else {
            this.properties = new LinkedHashMap<>();
        }
    }

    public static EventProperties empty() {
        return EMPTY;
    }

    public static EventProperties of(Map<String, Object> properties) {
        return properties == null || properties.isEmpty() ? EMPTY : new EventProperties(properties);
    }

    /** expose as plain JSON object: {"k":"v"} */
    @JsonAnyGetter
    public Map<String, Object> map() {
        return Collections.unmodifiableMap(properties);
    }

    /** accept arbitrary keys on input */
    @JsonAnySetter
    public void put(String key, Object value) {
        if (this == EMPTY) {
            throw new UnsupportedOperationException("shared empty properties are read-only");
        }
        if (key != null) properties.put(key, value);
    }

    public Object get(String key) {
        return key == null ? null : properties.get(key);
    }

    public boolean has(String key) {
        return key != null && properties.containsKey(key) && properties.get(key) != null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return properties.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventProperties other)) return false;
        return properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
