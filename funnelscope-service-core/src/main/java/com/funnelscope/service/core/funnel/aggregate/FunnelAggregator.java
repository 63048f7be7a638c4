package com.funnelscope.service.core.funnel.aggregate;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.config.FunnelOrder;
import com.funnelscope.service.core.config.FunnelProperties;
import com.funnelscope.service.core.config.StepDefinition;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns a merged {@link FunnelAggregate} into step results.
 *
 * <p>Breakdown values are ranked by step-0 count, ties by descending display value. The top {@code limit} are kept
 * and the rest are folded into a single "Other" bucket whose statistics are recomputed over the union of the folded
 * samples. Cohort keys are never folded.
 */
@Component
public class FunnelAggregator {
    private final FunnelProperties properties;

    public FunnelAggregator(FunnelProperties properties) {
        this.properties = properties;
    }

    public List<StepResult> totals(FunnelAggregate aggregate, FunnelDefinition definition) {
        List<StepResult> out = new ArrayList<>(aggregate.stepCount());
        for (int i = 0; i < aggregate.stepCount(); i++) {
            out.add(stepResult(definition, i, aggregate.total(), null));
        }
        return out;
    }

    public List<StepResult> breakdown(FunnelAggregate aggregate, FunnelDefinition definition, int limit) {
        List<Map.Entry<BreakdownKey, FunnelAggregate.Bucket>> ranked =
                new ArrayList<>(aggregate.buckets().entrySet());
        ranked.sort(rankOrder());

        List<Map.Entry<BreakdownKey, FunnelAggregate.Bucket>> kept = new ArrayList<>();
        List<FunnelAggregate.Bucket> folded = new ArrayList<>();
        for (Map.Entry<BreakdownKey, FunnelAggregate.Bucket> entry : ranked) {
            if (entry.getKey().isCohort() || kept.size() < limit) {
                kept.add(entry);
            } else {
                folded.add(entry.getValue());
            }
        }

        List<StepResult> out = new ArrayList<>();
        for (int i = 0; i < aggregate.stepCount(); i++) {
            List<StepResult> rows = new ArrayList<>(kept.size() + 1);
            for (Map.Entry<BreakdownKey, FunnelAggregate.Bucket> entry : kept) {
                rows.add(stepResult(definition, i, entry.getValue(), entry.getKey()));
            }
            // stable sort keeps rank order among equal counts
            rows.sort(Comparator.comparingLong(StepResult::count).reversed());
            out.addAll(rows);
            if (!folded.isEmpty()) {
                FunnelAggregate.Bucket other = FunnelAggregate.Bucket.union(folded, aggregate.stepCount());
                out.add(stepResult(definition, i, other, BreakdownKey.other()));
            }
        }
        return out;
    }

    /** Breakdown keys that survive the limit, in rank order. Keys outside this set report as "Other". */
    public Set<BreakdownKey> retainedKeys(FunnelAggregate aggregate, int limit) {
        List<Map.Entry<BreakdownKey, FunnelAggregate.Bucket>> ranked =
                new ArrayList<>(aggregate.buckets().entrySet());
        ranked.sort(rankOrder());
        Set<BreakdownKey> kept = new LinkedHashSet<>();
        for (Map.Entry<BreakdownKey, FunnelAggregate.Bucket> entry : ranked) {
            if (entry.getKey().isCohort() || kept.size() < limit) {
                kept.add(entry.getKey());
            }
        }
        return kept;
    }

    private static Comparator<Map.Entry<BreakdownKey, FunnelAggregate.Bucket>> rankOrder() {
        Comparator<Map.Entry<BreakdownKey, FunnelAggregate.Bucket>> byCount =
                Comparator.comparingLong(e -> e.getValue().count(0));
        Comparator<Map.Entry<BreakdownKey, FunnelAggregate.Bucket>> byDisplay =
                Comparator.comparing(e -> e.getKey().display());
        return byCount.reversed().thenComparing(byDisplay.reversed());
    }

    private StepResult stepResult(
            FunnelDefinition definition, int stepIndex, FunnelAggregate.Bucket bucket, BreakdownKey key) {
        ConversionTimeStats stats = stepIndex == 0 ? ConversionTimeStats.EMPTY : statistics(bucket.samples(stepIndex));
        String name;
        String customName;
        String type;
        if (definition.order() == FunnelOrder.UNORDERED) {
            name = completedStepsLabel(stepIndex + 1);
            customName = null;
            type = "events";
        } else {
            StepDefinition step = definition.step(stepIndex);
            name = step.name();
            customName = step.customName();
            type = step.matcher().type();
        }
        return new StepResult(
                stepIndex, name, customName, type, bucket.count(stepIndex), stats.average(), stats.median(), key);
    }

    ConversionTimeStats statistics(ConversionTimeSamples samples) {
        FunnelProperties.ConversionTimes cfg = properties.getConversionTimes();
        return ConversionTimeStats.of(
                samples,
                MedianMode.fromConfigValue(cfg.getMedianMode()),
                cfg.getExactSampleLimit(),
                cfg.getRelativeAccuracy());
    }

    static String completedStepsLabel(int steps) {
        return steps == 1 ? "Completed 1 step" : "Completed " + steps + " steps";
    }
}
