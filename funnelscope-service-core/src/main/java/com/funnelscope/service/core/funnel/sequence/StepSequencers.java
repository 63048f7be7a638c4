package com.funnelscope.service.core.funnel.sequence;

import com.funnelscope.service.core.config.FunnelOrder;

public final class StepSequencers {
    private static final StepSequencer ORDERED = new OrderedStepSequencer();
    private static final StepSequencer STRICT = new StrictStepSequencer();
    private static final StepSequencer UNORDERED = new UnorderedStepSequencer();

    private StepSequencers() {}

    public static StepSequencer forOrder(FunnelOrder order) {
        return switch (order) {
            case ORDERED -> ORDERED;
            case STRICT -> STRICT;
            case UNORDERED -> UNORDERED;
        };
    }
}
