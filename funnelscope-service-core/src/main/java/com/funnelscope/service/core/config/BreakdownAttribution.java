package com.funnelscope.service.core.config;

import java.util.Locale;

/** Rule choosing which breakdown value represents a run when its events carry different values. */
public sealed interface BreakdownAttribution
        permits BreakdownAttribution.FirstTouch,
                BreakdownAttribution.LastTouch,
                BreakdownAttribution.Step,
                BreakdownAttribution.AllEvents {

    BreakdownAttribution FIRST_TOUCH = new FirstTouch();
    BreakdownAttribution LAST_TOUCH = new LastTouch();
    BreakdownAttribution ALL_EVENTS = new AllEvents();

    static BreakdownAttribution step(int stepIndex) {
        return new Step(stepIndex);
    }

    static BreakdownAttribution fromConfigValue(String type, Integer value) {
        if (type == null || type.isBlank()) {
            return FIRST_TOUCH;
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "first_touch" -> FIRST_TOUCH;
            case "last_touch" -> LAST_TOUCH;
            case "all_events" -> ALL_EVENTS;
            case "step" -> {
                if (value == null) {
                    throw new IllegalArgumentException("step attribution requires an attribution step value");
                }
                yield new Step(value);
            }
            default -> throw new IllegalArgumentException("Unsupported breakdown attribution type: " + type);
        };
    }

    String configValue();

    record FirstTouch() implements BreakdownAttribution {
        @Override
        public String configValue() {
            return "first_touch";
        }
    }

    record LastTouch() implements BreakdownAttribution {
        @Override
        public String configValue() {
            return "last_touch";
        }
    }

    record Step(int stepIndex) implements BreakdownAttribution {
        @Override
        public String configValue() {
            return "step";
        }
    }

    record AllEvents() implements BreakdownAttribution {
        @Override
        public String configValue() {
            return "all_events";
        }
    }
}
