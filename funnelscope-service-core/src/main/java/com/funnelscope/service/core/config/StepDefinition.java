package com.funnelscope.service.core.config;

import java.util.Objects;

public record StepDefinition(int order, EventMatcher matcher, String customName) {

    public StepDefinition {
        Objects.requireNonNull(matcher, "matcher");
    }

    public static StepDefinition of(int order, EventMatcher matcher) {
        return new StepDefinition(order, matcher, null);
    }

    public static StepDefinition event(int order, String event) {
        return new StepDefinition(order, EventMatcher.event(event), null);
    }

    public String name() {
        return matcher.label();
    }
}
