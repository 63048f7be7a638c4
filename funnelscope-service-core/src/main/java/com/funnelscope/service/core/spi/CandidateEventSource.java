package com.funnelscope.service.core.spi;

import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.FunnelDefinition;
import java.time.Instant;
import java.util.List;

/**
 * Storage-side collaborator that hands over the candidate events of a funnel query in one bulk fetch.
 *
 * <p>Events may arrive in any actor order; within an actor they are expected in non-decreasing timestamp order. For
 * strict funnels the source must return every event of the actor in range, not only step matches, since unrelated
 * events break step adjacency.
 */
public interface CandidateEventSource {

    List<RawEvent> fetchCandidateEvents(String team, Instant from, Instant to, FunnelDefinition definition);
}
