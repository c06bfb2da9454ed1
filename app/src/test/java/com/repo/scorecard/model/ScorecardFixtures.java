package com.repo.scorecard.model;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Builds unscored scorecards for rule and report tests.
 */
public final class ScorecardFixtures {

    public static final long HOUR_MS = 60 * 60 * 1000L;

    private ScorecardFixtures() {
    }

    public static ContributorScorecard card(String username, int commits, int prs) {
        return card(username, commits, prs, 0, null, 0, 0, 0);
    }

    /**
     * @param leadTimeMs null when no pull request reported lead time
     */
    public static ContributorScorecard card(String username, int commits, int prs, long churn, Long leadTimeMs,
            int deployments, int failedDeployments, int incidents) {
        return new ContributorScorecard(
                Identity.of(username),
                commits,
                prs,
                churn,
                0,
                0,
                0,
                leadTimeMs == null ? OptionalDouble.empty() : OptionalDouble.of(leadTimeMs),
                OptionalDouble.empty(),
                OptionalDouble.empty(),
                deployments,
                deployments - failedDeployments,
                failedDeployments,
                incidents,
                List.of(),
                DoraMetrics.empty(),
                OptionalInt.empty(),
                0);
    }
}
