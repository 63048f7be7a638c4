package com.funnelscope.service.core.spi;

/** Identity-side lookup used by cohort breakdowns. */
public interface CohortMembership {

    boolean isMember(String actorId, long cohortId);

    /** Display name of the cohort, or {@code null} to fall back to its id. */
    String cohortName(long cohortId);
}
