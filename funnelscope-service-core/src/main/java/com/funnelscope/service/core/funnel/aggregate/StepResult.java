package com.funnelscope.service.core.funnel.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.funnelscope.funnel.model.BreakdownKey;

/**
 * One row of funnel output. Conversion times are seconds for the transition into this step and are {@code null} for
 * step 0 and for transitions nobody completed. {@code breakdownValue} is {@code null} for funnels without breakdown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepResult(
        int stepIndex,
        String name,
        String customName,
        String type,
        long count,
        Double averageConversionTime,
        Double medianConversionTime,
        BreakdownKey breakdownValue) {

    @JsonIgnore
    public boolean isOther() {
        return breakdownValue != null && breakdownValue.isOther();
    }
}
