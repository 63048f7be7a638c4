package com.funnelscope.service.core.funnel.actors;

import com.funnelscope.funnel.model.FunnelRun;
import com.funnelscope.service.core.config.FunnelConfigurationException;

/**
 * Caller-facing step selector, 1-indexed. A positive value selects actors that reached that step; a negative value
 * selects actors that reached step {@code |value| - 1} but dropped off before step {@code |value|}.
 */
public record StepFilter(int value) {

    public static StepFilter of(int value, int stepCount) {
        if (value == 0) {
            throw new FunnelConfigurationException("step filter 0 does not name a step");
        }
        if (value == -1) {
            throw new FunnelConfigurationException("no actor can drop off before the first step");
        }
        if (Math.abs(value) > stepCount) {
            throw new FunnelConfigurationException(
                    "step filter " + value + " is outside a funnel of " + stepCount + " steps");
        }
        return new StepFilter(value);
    }

    public static StepFilter reached(int step) {
        return new StepFilter(step);
    }

    public static StepFilter droppedBefore(int step) {
        return new StepFilter(-step);
    }

    public boolean dropOff() {
        return value < 0;
    }

    public boolean matches(FunnelRun run) {
        if (value > 0) {
            return run.stepsReached() >= value;
        }
        return run.stepsReached() == -value - 1;
    }
}
