package com.funnelscope.service.core.config;

import java.util.List;

/** A funnel definition that cannot be evaluated; raised before any event is read. */
public class FunnelConfigurationException extends IllegalArgumentException {
    private final List<String> violations;

    public FunnelConfigurationException(List<String> violations) {
        super("Invalid funnel definition: " + String.join("; ", violations));
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public FunnelConfigurationException(String violation) {
        this(List.of(violation));
    }

    public List<String> violations() {
        return violations;
    }
}
