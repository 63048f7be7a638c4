package com.funnelscope.service.core.funnel.query;

import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.funnel.engine.FunnelCancellation;
import java.util.Objects;

/** {@code cancellation} may be {@code null}; the configured engine timeout then applies. */
public record FunnelQueryRequest(
        String team, FunnelDefinition definition, QueryDateRange dateRange, FunnelCancellation cancellation) {

    public FunnelQueryRequest {
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(dateRange, "dateRange");
    }

    public static FunnelQueryRequest of(String team, FunnelDefinition definition, QueryDateRange dateRange) {
        return new FunnelQueryRequest(team, definition, dateRange, null);
    }
}
