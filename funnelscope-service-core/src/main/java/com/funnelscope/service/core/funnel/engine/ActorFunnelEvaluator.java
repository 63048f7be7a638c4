package com.funnelscope.service.core.funnel.engine;

import com.funnelscope.funnel.model.ActorEvent;
import com.funnelscope.funnel.model.BreakdownKey;
import com.funnelscope.funnel.model.FunnelRun;
import com.funnelscope.service.core.config.BreakdownAttribution;
import com.funnelscope.service.core.config.BreakdownSpec;
import com.funnelscope.service.core.config.FunnelDefinition;
import com.funnelscope.service.core.funnel.breakdown.BreakdownAttributor;
import com.funnelscope.service.core.funnel.exclusion.ExclusionFilter;
import com.funnelscope.service.core.funnel.sequence.ActorTimeline;
import com.funnelscope.service.core.funnel.sequence.Lineage;
import com.funnelscope.service.core.funnel.sequence.StepSequencer;
import com.funnelscope.service.core.funnel.sequence.StepSequencers;
import com.funnelscope.service.core.spi.CohortMembership;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates one actor: sequences every lineage, drops the excluded ones, keeps the best survivor and attributes it
 * to breakdown keys. Pure function of the actor's events and the definition.
 */
final class ActorFunnelEvaluator {
    private final FunnelDefinition definition;
    private final StepSequencer sequencer;
    private final ExclusionFilter exclusions;
    private final long windowMillis;
    private final BreakdownAttributor attributor;
    private final List<BreakdownKey> cohortKeys;
    private final List<Long> cohortIds;
    private final CohortMembership cohorts;

    ActorFunnelEvaluator(FunnelDefinition definition, CohortMembership cohorts) {
        this.definition = definition;
        this.sequencer = StepSequencers.forOrder(definition.order());
        this.windowMillis = definition.window().toMillis();
        this.exclusions = definition.exclusions().isEmpty()
                ? ExclusionFilter.none()
                : new ExclusionFilter(definition.exclusions(), windowMillis);
        BreakdownSpec breakdown = definition.breakdown();
        boolean cohortBreakdown = breakdown != null && breakdown.type() == BreakdownSpec.Type.COHORT;
        this.attributor = breakdown != null
                        && !cohortBreakdown
                        && !(definition.attribution() instanceof BreakdownAttribution.AllEvents)
                ? new BreakdownAttributor(definition.attribution())
                : null;
        this.cohorts = cohorts;
        if (cohortBreakdown) {
            if (cohorts == null) {
                throw new IllegalStateException("cohort breakdown requires a CohortMembership collaborator");
            }
            this.cohortIds = breakdown.cohortIds();
            this.cohortKeys = new ArrayList<>(cohortIds.size());
            for (Long id : cohortIds) {
                String name = id == BreakdownSpec.ALL_USERS_COHORT_ID ? "all users" : cohorts.cohortName(id);
                cohortKeys.add(BreakdownKey.cohort(id, name));
            }
        } else {
            this.cohortIds = List.of();
            this.cohortKeys = List.of();
        }
    }

    ActorOutcome evaluate(String actorId, List<ActorEvent> events, boolean breakdownExpected) {
        ActorTimeline timeline = ActorTimeline.of(actorId, events, breakdownExpected);
        Selection total = select(timeline);
        if (total.best() == null) {
            return new ActorOutcome(null, List.of(), timeline, total.evaluated(), total.excluded(), false);
        }
        FunnelRun run = toRun(actorId, total.best(), null);
        if (definition.breakdown() == null) {
            return new ActorOutcome(run, List.of(), timeline, total.evaluated(), total.excluded(), false);
        }

        List<FunnelRun> attributed = new ArrayList<>();
        boolean unattributed = false;
        long evaluated = total.evaluated();
        long excluded = total.excluded();
        if (!cohortKeys.isEmpty()) {
            for (int i = 0; i < cohortIds.size(); i++) {
                long cohortId = cohortIds.get(i);
                if (cohortId == BreakdownSpec.ALL_USERS_COHORT_ID || cohorts.isMember(actorId, cohortId)) {
                    attributed.add(run.withBreakdown(cohortKeys.get(i)));
                }
            }
        } else if (attributor == null) {
            for (BreakdownKey key : timeline.stepBreakdowns()) {
                Selection partition = select(timeline.partition(key));
                evaluated += partition.evaluated();
                excluded += partition.excluded();
                if (partition.best() != null) {
                    attributed.add(toRun(actorId, partition.best(), key));
                }
            }
            unattributed = timeline.hasUnresolvedBreakdown();
        } else {
            int position = attributor.position(total.best());
            if (position >= 0) {
                BreakdownKey key = timeline.breakdown(position);
                if (key != null) {
                    attributed.add(run.withBreakdown(key));
                } else {
                    unattributed = true;
                }
            }
        }
        return new ActorOutcome(run, attributed, timeline, evaluated, excluded, unattributed);
    }

    private Selection select(ActorTimeline timeline) {
        if (timeline.isEmpty()) {
            return new Selection(null, 0, 0);
        }
        List<Lineage> candidates = sequencer.lineages(timeline, definition.stepCount(), windowMillis);
        if (exclusions.isEmpty()) {
            return new Selection(Lineage.best(candidates), candidates.size(), 0);
        }
        List<Lineage> surviving = new ArrayList<>(candidates.size());
        for (Lineage lineage : candidates) {
            if (!exclusions.excludes(lineage, timeline)) {
                surviving.add(lineage);
            }
        }
        return new Selection(Lineage.best(surviving), candidates.size(), candidates.size() - surviving.size());
    }

    private static FunnelRun toRun(String actorId, Lineage lineage, BreakdownKey key) {
        List<Instant> timestamps = new ArrayList<>(lineage.stepsReached());
        for (int i = 0; i < lineage.stepsReached(); i++) {
            timestamps.add(Instant.ofEpochMilli(lineage.time(i)));
        }
        return new FunnelRun(actorId, lineage.stepsReached(), timestamps, key, lineage.truncated());
    }

    private record Selection(Lineage best, long evaluated, long excluded) {}

    /**
     * @param total the actor's best run, {@code null} when it never started the funnel or every lineage was excluded
     * @param unattributed the run was left out of breakdown output because a breakdown value failed to resolve
     */
    record ActorOutcome(
            FunnelRun total,
            List<FunnelRun> attributed,
            ActorTimeline timeline,
            long lineagesEvaluated,
            long lineagesExcluded,
            boolean unattributed) {}
}
