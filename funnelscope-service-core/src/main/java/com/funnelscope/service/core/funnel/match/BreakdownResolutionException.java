package com.funnelscope.service.core.funnel.match;

/** A stored property value that cannot be used as a breakdown value. Recovered per actor, never fatal to a query. */
public class BreakdownResolutionException extends RuntimeException {
    private final String property;

    public BreakdownResolutionException(String property, String message) {
        super(message);
        this.property = property;
    }

    public String property() {
        return property;
    }
}
