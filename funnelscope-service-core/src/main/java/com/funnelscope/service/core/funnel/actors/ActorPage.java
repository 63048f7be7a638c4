package com.funnelscope.service.core.funnel.actors;

import java.util.List;

/** One page of actor ids; {@code total} counts every matching actor, not just this page. */
public record ActorPage(List<String> actorIds, long offset, int limit, long total) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 10_000;

    public ActorPage {
        actorIds = List.copyOf(actorIds);
    }

    public boolean hasMore() {
        return offset + actorIds.size() < total;
    }
}
