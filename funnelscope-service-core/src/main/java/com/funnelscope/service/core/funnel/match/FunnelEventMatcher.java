package com.funnelscope.service.core.funnel.match;

import com.funnelscope.funnel.model.ActorEvent;
import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.BreakdownSpec;
import com.funnelscope.service.core.config.EventMatcher;
import com.funnelscope.service.core.config.ExclusionDefinition;
import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.config.FunnelOrder;
import com.funnelscope.service.core.spi.BreakdownResolver;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies raw events against one funnel definition.
 *
 * <p>An event matching several steps yields one {@link ActorEvent} per step, all sharing the event id. Exclusions are
 * tested on every event, so one event can both complete a step and exclude a lineage elsewhere in the funnel. Strict
 * funnels keep events that match nothing because they break adjacency; other disciplines drop them.
 */
@Slf4j
public final class FunnelEventMatcher {
    private final FunnelDefinition definition;
    private final PropertyFilterEvaluator filters;
    private final BreakdownResolver breakdownResolver;
    private final boolean resolvePerEvent;

    public FunnelEventMatcher(
            FunnelDefinition definition, PropertyFilterEvaluator filters, BreakdownResolver breakdownResolver) {
        this.definition = definition;
        this.filters = filters;
        this.breakdownResolver = breakdownResolver;
        this.resolvePerEvent = definition.hasBreakdown() && definition.breakdown().type() != BreakdownSpec.Type.COHORT;
    }

    /** Whether classified events carry a per-event breakdown key. */
    public boolean resolvesBreakdownPerEvent() {
        return resolvePerEvent;
    }

    public List<ActorEvent> classify(RawEvent event) {
        List<Integer> steps = new ArrayList<>(1);
        for (int i = 0; i < definition.stepCount(); i++) {
            if (matches(definition.step(i).matcher(), event)) {
                steps.add(i);
            }
        }
        Set<Integer> exclusions = matchingExclusions(event);
        if (steps.isEmpty() && exclusions.isEmpty() && definition.order() != FunnelOrder.STRICT) {
            return List.of();
        }
        BreakdownKey key = resolveBreakdown(event);
        if (steps.isEmpty()) {
            return List.of(new ActorEvent(
                    event.actorId(), event.eventId(), event.timestamp(), null, exclusions, key, extraFields(event)));
        }
        List<ActorEvent> out = new ArrayList<>(steps.size());
        for (Integer step : steps) {
            out.add(new ActorEvent(
                    event.actorId(), event.eventId(), event.timestamp(), step, exclusions, key, extraFields(event)));
        }
        return out;
    }

    public boolean matches(EventMatcher matcher, RawEvent event) {
        boolean structural = switch (matcher.kind()) {
            case EVENT -> matcher.event().equals(event.event());
            case ACTION -> event.actionIds().contains(matcher.actionId());
            case ANY -> true;
        };
        return structural && filters.matchesAll(matcher.properties(), event);
    }

    private Set<Integer> matchingExclusions(RawEvent event) {
        List<ExclusionDefinition> defs = definition.exclusions();
        if (defs.isEmpty()) {
            return Set.of();
        }
        Set<Integer> matched = new LinkedHashSet<>();
        for (int j = 0; j < defs.size(); j++) {
            if (matches(defs.get(j).matcher(), event)) {
                matched.add(j);
            }
        }
        return matched;
    }

    private BreakdownKey resolveBreakdown(RawEvent event) {
        if (!resolvePerEvent) {
            return null;
        }
        try {
            return breakdownResolver.resolve(event, definition.breakdown());
        } catch (BreakdownResolutionException ex) {
            log.debug(
                    "Breakdown resolution failed actor={} event={} property={}: {}",
                    event.actorId(),
                    event.eventId(),
                    ex.property(),
                    ex.getMessage());
            return null;
        }
    }

    private static Map<String, Object> extraFields(RawEvent event) {
        return event.event() == null ? Map.of() : Map.of("event", event.event());
    }
}
