package com.funnelscope.service.core.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Rejects funnel definitions that cannot be evaluated. Runs before any event is fetched so a caller never sees a
 * partial result for a bad definition.
 */
@Component
public class FunnelDefinitionValidator {
    public static final int MAX_EXCLUSIONS = 64;

    private final FunnelProperties properties;

    public FunnelDefinitionValidator(FunnelProperties properties) {
        this.properties = properties;
    }

    public void validate(FunnelDefinition definition) {
        if (definition == null) {
            throw new FunnelConfigurationException("funnel definition is required");
        }
        List<String> violations = new ArrayList<>();
        validateSteps(definition, violations);
        validateWindow(definition, violations);
        if (violations.isEmpty()) {
            validateExclusions(definition, violations);
        }
        if (definition.breakdownLimit() != null && definition.breakdownLimit() < 1) {
            violations.add("breakdown limit must be at least 1");
        }
        if (definition.breakdown() != null) {
            validateBreakdown(definition.breakdown(), violations);
        }
        if (!violations.isEmpty()) {
            throw new FunnelConfigurationException(violations);
        }
        validateAttribution(definition);
    }

    private void validateSteps(FunnelDefinition definition, List<String> violations) {
        List<StepDefinition> steps = definition.steps();
        if (steps.isEmpty()) {
            violations.add("funnel requires at least one step");
            return;
        }
        int max = properties.getSteps().effectiveMax();
        if (steps.size() > max) {
            violations.add("funnel has " + steps.size() + " steps, at most " + max + " are supported");
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).order() != i) {
                violations.add("step orders must be contiguous from 0; found order " + steps.get(i).order()
                        + " at position " + i);
                return;
            }
        }
    }

    private void validateWindow(FunnelDefinition definition, List<String> violations) {
        if (definition.window().value() <= 0) {
            violations.add("conversion window must be positive");
        }
    }

    private void validateExclusions(FunnelDefinition definition, List<String> violations) {
        List<ExclusionDefinition> exclusions = definition.exclusions();
        if (exclusions.isEmpty()) {
            return;
        }
        int stepCount = definition.stepCount();
        if (exclusions.size() > MAX_EXCLUSIONS) {
            violations.add("at most " + MAX_EXCLUSIONS + " exclusions are supported");
            return;
        }
        Set<ExclusionDefinition> seen = new HashSet<>();
        for (int i = 0; i < exclusions.size(); i++) {
            ExclusionDefinition exclusion = exclusions.get(i);
            String label = "exclusion " + i + " (" + exclusion.matcher().label() + ")";
            if (exclusion.fromStep() < 0 || exclusion.fromStep() >= stepCount - 1) {
                violations.add(label + " must start at a step before the last step");
                continue;
            }
            if (exclusion.toStep() <= exclusion.fromStep()) {
                violations.add(label + " must end after the step it starts from");
                continue;
            }
            if (exclusion.toStep() > stepCount - 1) {
                violations.add(label + " ends beyond the last step");
                continue;
            }
            if (definition.order() == FunnelOrder.UNORDERED
                    && (exclusion.fromStep() != 0 || exclusion.toStep() != stepCount - 1)) {
                violations.add(label + " must span the whole funnel for unordered funnels");
                continue;
            }
            if (!seen.add(exclusion)) {
                violations.add(label + " duplicates another exclusion over the same steps");
                continue;
            }
            for (int step = exclusion.fromStep(); step <= exclusion.toStep(); step++) {
                if (coversEveryMatch(exclusion.matcher(), definition.step(step).matcher())) {
                    violations.add(label + " matches every event of step " + step);
                    break;
                }
            }
        }
    }

    private void validateBreakdown(BreakdownSpec breakdown, List<String> violations) {
        if (breakdown.type() == BreakdownSpec.Type.COHORT) {
            if (breakdown.cohortIds().isEmpty()) {
                violations.add("cohort breakdown requires at least one cohort");
            }
            return;
        }
        if (breakdown.properties().isEmpty()) {
            violations.add("property breakdown requires at least one property");
        }
        if (breakdown.type() == BreakdownSpec.Type.GROUP && breakdown.groupTypeIndex() == null) {
            violations.add("group breakdown requires a group type index");
        }
    }

    private void validateAttribution(FunnelDefinition definition) {
        if (definition.attribution() instanceof BreakdownAttribution.Step step) {
            if (step.stepIndex() < 0 || step.stepIndex() >= definition.stepCount()) {
                throw new UnsupportedFunnelSourceException(
                        step.configValue(),
                        "step attribution index " + step.stepIndex() + " is outside a funnel of "
                                + definition.stepCount() + " steps");
            }
        }
    }

    /** Whether every event the step matches is also matched by the exclusion. */
    private static boolean coversEveryMatch(EventMatcher exclusion, EventMatcher step) {
        if (exclusion.kind() != step.kind()) {
            return false;
        }
        boolean sameTarget = switch (exclusion.kind()) {
            case EVENT -> exclusion.event().equals(step.event());
            case ACTION -> exclusion.actionId().equals(step.actionId());
            case ANY -> true;
        };
        return sameTarget && step.properties().containsAll(exclusion.properties());
    }
}
