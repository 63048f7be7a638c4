package com.funnelscope.service.core.config;

import java.util.List;
import java.util.Locale;

/**
 * What a funnel is broken down by: one or more event, person or group properties, or cohort membership.
 *
 * <p>For {@link Type#COHORT} breakdowns {@code cohortIds} lists the cohorts; {@link #ALL_USERS_COHORT_ID} stands for
 * "all users".
 */
public record BreakdownSpec(Type type, List<String> properties, Integer groupTypeIndex, List<Long> cohortIds) {

    public static final long ALL_USERS_COHORT_ID = 0L;

    public BreakdownSpec {
        if (type == null) {
            throw new IllegalArgumentException("breakdown type is required");
        }
        properties = properties == null ? List.of() : List.copyOf(properties);
        cohortIds = cohortIds == null ? List.of() : List.copyOf(cohortIds);
    }

    public static BreakdownSpec event(String... properties) {
        return new BreakdownSpec(Type.EVENT, List.of(properties), null, List.of());
    }

    public static BreakdownSpec person(String... properties) {
        return new BreakdownSpec(Type.PERSON, List.of(properties), null, List.of());
    }

    public static BreakdownSpec group(int groupTypeIndex, String... properties) {
        return new BreakdownSpec(Type.GROUP, List.of(properties), groupTypeIndex, List.of());
    }

    public static BreakdownSpec cohorts(List<Long> cohortIds) {
        return new BreakdownSpec(Type.COHORT, List.of(), null, cohortIds);
    }

    /** Multi-property breakdowns produce composite keys. */
    public boolean multiProperty() {
        return properties.size() > 1;
    }

    public enum Type {
        EVENT,
        PERSON,
        GROUP,
        COHORT;

        public static Type fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return EVENT;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "event" -> EVENT;
                case "person" -> PERSON;
                case "group" -> GROUP;
                case "cohort" -> COHORT;
                default -> throw new IllegalArgumentException("Unsupported breakdown type: " + value);
            };
        }
    }
}
