package com.funnelscope.service.core.funnel.match;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.EventProperties;
import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.BreakdownSpec;
import com.funnelscope.service.core.spi.BreakdownResolver;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Reads breakdown values from the properties carried on the event itself. Only scalars (strings, numbers, booleans)
 * are valid breakdown values; nested maps and arrays are rejected.
 */
@Component
public class PropertyBreakdownResolver implements BreakdownResolver {

    @Override
    public BreakdownKey resolve(RawEvent event, BreakdownSpec spec) {
        if (spec.type() == BreakdownSpec.Type.COHORT) {
            throw new IllegalArgumentException("cohort breakdowns are resolved per actor, not per event");
        }
        EventProperties props = switch (spec.type()) {
            case EVENT -> event.properties();
            case PERSON -> event.actorProperties();
            case GROUP -> event.groupProperties(spec.groupTypeIndex());
            case COHORT -> EventProperties.empty();
        };
        if (!spec.multiProperty()) {
            String property = spec.properties().get(0);
            return BreakdownKey.of(scalar(property, props.get(property)));
        }
        List<Object> values = new ArrayList<>(spec.properties().size());
        for (String property : spec.properties()) {
            values.add(scalar(property, props.get(property)));
        }
        return BreakdownKey.of(values);
    }

    private static Object scalar(String property, Object value) {
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            throw new BreakdownResolutionException(
                    property, "breakdown property '" + property + "' holds a non-scalar value");
        }
        return value;
    }
}
