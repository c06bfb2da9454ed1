package com.repo.scorecard.join;

import com.repo.scorecard.core.RunningAverage;
import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.model.DoraMetrics;
import com.repo.scorecard.model.Identity;
import com.repo.scorecard.model.ReviewerCount;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Mutable per-contributor state, owned by a single join.
 */
class ContributorTally {

    /**
     * Mean over every pull request folded so far, including those that did not
     * report the metric. Stays empty until the first reported value.
     */
    static final class MeanTracker {
        private double mean;
        private boolean seen;

        void fold(Long value, int prCount) {
            if (value == null || value <= 0) {
                return;
            }
            mean = RunningAverage.update(mean, prCount - 1, value);
            seen = true;
        }

        OptionalDouble value() {
            return seen ? OptionalDouble.of(mean) : OptionalDouble.empty();
        }
    }

    final String username;
    String displayName;
    String avatarUrl;

    int commitCount;
    int prCount;
    long additions;
    long deletions;
    int commentCount;
    int reworkCycleCount;

    final MeanTracker leadTime = new MeanTracker();
    final MeanTracker mergeTime = new MeanTracker();
    final MeanTracker reworkTime = new MeanTracker();

    int deploymentCount;
    int successfulDeployments;
    int failedDeployments;
    int incidentCount;

    /** Reviewer username to count, in first-seen order */
    final Map<String, Integer> reviewerCounts = new LinkedHashMap<>();

    ContributorTally(String username) {
        this.username = username;
    }

    ContributorScorecard toScorecard(List<ReviewerCount> topReviewers) {
        return new ContributorScorecard(
                new Identity(username, displayName, avatarUrl),
                commitCount,
                prCount,
                additions,
                deletions,
                commentCount,
                reworkCycleCount,
                leadTime.value(),
                mergeTime.value(),
                reworkTime.value(),
                deploymentCount,
                successfulDeployments,
                failedDeployments,
                incidentCount,
                topReviewers,
                DoraMetrics.empty(),
                OptionalInt.empty(),
                0);
    }
}
