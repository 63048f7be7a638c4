package com.funnelscope.service.core.spi;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.RawEvent;
import com.funnelscope.service.core.config.BreakdownSpec;
import com.funnelscope.service.core.funnel.match.BreakdownResolutionException;

/** Projects an event onto its breakdown value for event, person and group property breakdowns. */
public interface BreakdownResolver {

    /**
     * Returns the key for {@code event}, {@link BreakdownKey#empty()} when the property is absent.
     *
     * @throws BreakdownResolutionException when the stored value cannot be used as a breakdown value
     */
    BreakdownKey resolve(RawEvent event, BreakdownSpec spec);
}
