package com.funnelscope.service.core.config;

import java.util.Objects;

/** An event that disqualifies a run when it happens between {@code fromStep} and {@code toStep}. */
public record ExclusionDefinition(EventMatcher matcher, int fromStep, int toStep) {

    public ExclusionDefinition {
        Objects.requireNonNull(matcher, "matcher");
    }

    public static ExclusionDefinition event(String event, int fromStep, int toStep) {
        return new ExclusionDefinition(EventMatcher.event(event), fromStep, toStep);
    }
}
