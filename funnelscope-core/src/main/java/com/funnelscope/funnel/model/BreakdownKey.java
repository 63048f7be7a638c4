package com.funnelscope.funnel.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Value a funnel run is grouped under. Equality is structural.
 *
 * <p>An absent property resolves to {@link #empty()}, never to {@code null}, so runs without the property still form
 * their own group. {@link #other()} is reserved for values folded away by the breakdown limit.
 */
public sealed interface BreakdownKey
        permits BreakdownKey.Scalar,
                BreakdownKey.Composite,
                BreakdownKey.Cohort,
                BreakdownKey.Empty,
                BreakdownKey.Other {

    String OTHER_LABEL = "Other";

    static BreakdownKey empty() {
        return Empty.INSTANCE;
    }

    static BreakdownKey other() {
        return Other.INSTANCE;
    }

    static BreakdownKey of(Object value) {
        if (value == null) {
            return empty();
        }
        if (value instanceof String s && s.isEmpty()) {
            return empty();
        }
        return new Scalar(value);
    }

    static BreakdownKey of(List<?> values) {
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(value == null ? "" : value);
        }
        return new Composite(List.copyOf(normalized));
    }

    static BreakdownKey cohort(long cohortId, String name) {
        return new Cohort(cohortId, name);
    }

    /** Label shown for this key; the empty key displays as an empty string. */
    @JsonValue
    String display();

    default boolean isOther() {
        return false;
    }

    default boolean isCohort() {
        return false;
    }

    record Scalar(Object value) implements BreakdownKey {
        public Scalar {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String display() {
            return String.valueOf(value);
        }
    }

    record Composite(List<Object> values) implements BreakdownKey {
        public Composite {
            values = List.copyOf(values);
        }

        @Override
        public String display() {
            List<String> parts = new ArrayList<>(values.size());
            for (Object value : values) {
                parts.add(String.valueOf(value));
            }
            return String.join("::", parts);
        }
    }

    record Cohort(long cohortId, String name) implements BreakdownKey {
        @Override
        public String display() {
            return name == null ? String.valueOf(cohortId) : name;
        }

        @Override
        public boolean isCohort() {
            return true;
        }
    }

    final class Empty implements BreakdownKey {
        private static final Empty INSTANCE = new Empty();

        private Empty() {}

        @Override
        public String display() {
            return "";
        }

        @Override
        public String toString() {
            return "BreakdownKey.Empty";
        }
    }

    final class Other implements BreakdownKey {
        private static final Other INSTANCE = new Other();

        private Other() {}

        @Override
        public String display() {
            return OTHER_LABEL;
        }

        @Override
        public boolean isOther() {
            return true;
        }

        @Override
        public String toString() {
            return "BreakdownKey.Other";
        }
    }
}
