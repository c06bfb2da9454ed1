package com.repo.scorecard.model;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Aggregated performance record for a single contributor.
 * One scorecard exists per non-bot username in an aggregation result.
 */
public record ContributorScorecard(
        Identity identity,

        // Counters
        int commitCount,
        int prCount,

        // Sums over the contributor's pull requests
        long additions,
        long deletions,
        int commentCount,
        int reworkCycleCount,

        // Running means over the contributor's pull requests
        OptionalDouble avgLeadTimeMs,
        OptionalDouble avgMergeTimeMs,
        OptionalDouble avgReworkTimeMs,

        // Deployments and incidents
        int deploymentCount,
        int successfulDeployments,
        int failedDeployments,
        int incidentCount,

        /** Up to five reviewers, most frequent first */
        List<ReviewerCount> topReviewers,

        // Scoring
        DoraMetrics dora,

        /** 35-94, empty when no metric was available */
        OptionalInt doraScore,

        /** Share of team activity (0-100); sums to 100 across a result set */
        int contributionPercentage) {

    public ContributorScorecard {
        topReviewers = topReviewers == null ? List.of() : List.copyOf(topReviewers);
        if (dora == null) {
            dora = DoraMetrics.empty();
        }
    }

    public String username() {
        return identity.username();
    }

    public String displayName() {
        return identity.displayName();
    }

    public ActivityLevel activityLevel() {
        return ActivityLevel.fromCommits(commitCount);
    }

    /**
     * Success rate of the contributor's deployments (0-1), 0 without deployments.
     */
    public double deploymentSuccessRate() {
        return (double) successfulDeployments / Math.max(1, deploymentCount);
    }

    public ContributorScorecard withScore(DoraMetrics metrics, OptionalInt score) {
        return new ContributorScorecard(identity, commitCount, prCount, additions, deletions,
                commentCount, reworkCycleCount, avgLeadTimeMs, avgMergeTimeMs, avgReworkTimeMs,
                deploymentCount, successfulDeployments, failedDeployments, incidentCount,
                topReviewers, metrics, score, contributionPercentage);
    }

    public ContributorScorecard withContributionPercentage(int percentage) {
        return new ContributorScorecard(identity, commitCount, prCount, additions, deletions,
                commentCount, reworkCycleCount, avgLeadTimeMs, avgMergeTimeMs, avgReworkTimeMs,
                deploymentCount, successfulDeployments, failedDeployments, incidentCount,
                topReviewers, dora, doraScore, percentage);
    }
}
