package com.funnelscope.service.core.funnel.query;

import com.funnelscope.funnel.model.BreakdownKey;
import java.util.Comparator;
import java.util.Objects;

/**
 * Actors at a funnel step. {@code step} is 1-indexed, negative for drop-offs; {@code breakdownValue} and
 * {@code ordering} are optional.
 */
public record ActorQueryRequest(
        FunnelQueryRequest query,
        int step,
        BreakdownKey breakdownValue,
        Comparator<String> ordering,
        long offset,
        int limit) {

    public ActorQueryRequest {
        Objects.requireNonNull(query, "query");
    }

    public static ActorQueryRequest atStep(FunnelQueryRequest query, int step) {
        return new ActorQueryRequest(query, step, null, null, 0, 0);
    }
}
