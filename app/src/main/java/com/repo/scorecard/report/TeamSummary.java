package com.repo.scorecard.report;

import com.repo.scorecard.model.ContributorScorecard;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Team-wide totals across a scorecard result set.
 */
public record TeamSummary(
        int totalContributors,
        long totalCommits,
        long totalPullRequests,
        long totalAdditions,
        long totalDeletions,

        /** Mean over all contributors; one without the metric counts as 0 */
        double avgLeadTimeMs,
        double avgMergeTimeMs) {

    public static TeamSummary of(List<ContributorScorecard> contributors) {
        if (contributors.isEmpty()) {
            return new TeamSummary(0, 0, 0, 0, 0, 0, 0);
        }
        int count = contributors.size();
        return new TeamSummary(
                count,
                contributors.stream().mapToLong(ContributorScorecard::commitCount).sum(),
                contributors.stream().mapToLong(ContributorScorecard::prCount).sum(),
                contributors.stream().mapToLong(ContributorScorecard::additions).sum(),
                contributors.stream().mapToLong(ContributorScorecard::deletions).sum(),
                contributors.stream().mapToDouble(c -> orZero(c.avgLeadTimeMs())).sum() / count,
                contributors.stream().mapToDouble(c -> orZero(c.avgMergeTimeMs())).sum() / count);
    }

    /**
     * The team lead time, empty when no contributor reported one.
     */
    public OptionalDouble reportedLeadTimeMs() {
        return avgLeadTimeMs > 0 ? OptionalDouble.of(avgLeadTimeMs) : OptionalDouble.empty();
    }

    private static double orZero(OptionalDouble value) {
        return value.orElse(0);
    }
}
