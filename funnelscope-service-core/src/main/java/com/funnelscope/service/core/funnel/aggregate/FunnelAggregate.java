package com.funnelscope.service.core.funnel.aggregate;

import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.FunnelRun;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mergeable partial aggregate: step counts and conversion-time samples for the funnel as a whole and per breakdown
 * key. Workers fill one each; partials are merged in batch order so the final sample order, and with it every
 * floating-point sum, is the same on every run.
 */
public final class FunnelAggregate {
    private final int stepCount;
    private final Bucket total;
    private final Map<BreakdownKey, Bucket> buckets = new LinkedHashMap<>();

    public FunnelAggregate(int stepCount) {
        this.stepCount = stepCount;
        this.total = new Bucket(stepCount);
    }

    public void addTotal(FunnelRun run) {
        total.add(run);
    }

    public void addBreakdown(FunnelRun run) {
        if (run.breakdown() == null) {
            throw new IllegalArgumentException("breakdown run for " + run.actorId() + " carries no key");
        }
        buckets.computeIfAbsent(run.breakdown(), k -> new Bucket(stepCount)).add(run);
    }

    public FunnelAggregate merge(FunnelAggregate other) {
        if (other.stepCount != stepCount) {
            throw new IllegalArgumentException("cannot merge aggregates of " + other.stepCount + " and " + stepCount
                    + " steps");
        }
        total.merge(other.total);
        other.buckets.forEach((key, bucket) ->
                buckets.computeIfAbsent(key, k -> new Bucket(stepCount)).merge(bucket));
        return this;
    }

    public int stepCount() {
        return stepCount;
    }

    public Bucket total() {
        return total;
    }

    public Map<BreakdownKey, Bucket> buckets() {
        return buckets;
    }

    /** Counts and samples of one group; {@code samples(i)} holds times of the transition into step i. */
    public static final class Bucket {
        private final long[] counts;
        private final ConversionTimeSamples[] samples;

        Bucket(int stepCount) {
            this.counts = new long[stepCount];
            this.samples = new ConversionTimeSamples[stepCount];
            for (int i = 0; i < stepCount; i++) {
                samples[i] = new ConversionTimeSamples();
            }
        }

        void add(FunnelRun run) {
            for (int i = 0; i < run.stepsReached() && i < counts.length; i++) {
                counts[i]++;
                if (i > 0) {
                    samples[i].add(run.conversionTimeSeconds(i));
                }
            }
        }

        void merge(Bucket other) {
            for (int i = 0; i < counts.length; i++) {
                counts[i] += other.counts[i];
                samples[i].addAll(other.samples[i]);
            }
        }

        public long count(int step) {
            return counts[step];
        }

        public ConversionTimeSamples samples(int step) {
            return samples[step];
        }

        static Bucket union(Iterable<Bucket> parts, int stepCount) {
            Bucket out = new Bucket(stepCount);
            for (Bucket part : parts) {
                out.merge(part);
            }
            return out;
        }
    }
}
