package com.repo.scorecard.model;

import java.util.OptionalDouble;

/**
 * The four DORA sub-metrics for one contributor.
 * Lead time lives on the scorecard itself as {@code avgLeadTimeMs}.
 */
public record DoraMetrics(
        /** Deployments per pull request */
        double deployFrequency,

        /** Failed deployments over all deployments (0-1) */
        double changeFailureRate,

        /** Lead time used as a stand-in when the contributor handled incidents */
        OptionalDouble timeToRestoreMs) {

    public static DoraMetrics empty() {
        return new DoraMetrics(0, 0, OptionalDouble.empty());
    }
}
