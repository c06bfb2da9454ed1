package com.repo.scorecard.report;

import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.model.ReviewerCount;
import com.repo.scorecard.rules.PodiumRanker;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Converts scorecards to JSON for dashboards and downstream summarizers.
 */
public class JsonDataConverter {

    /**
     * Converts scorecards to a JSON array, one object per contributor.
     */
    public String convertToDataJson(List<ContributorScorecard> data) {
        return data.stream()
                .map(this::scorecardToJson)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Converts scorecards to a self-describing JSON object with metadata, a
     * field schema, the team summary and the podium, suited to AI agents and
     * external tools.
     */
    public String convertToSelfDescribingJson(List<ContributorScorecard> data, List<PodiumRanker.Placement> podium) {
        return String.format(Locale.ROOT,
                "{ \"metadata\": { \"generatedAt\": \"%s\", \"tool\": \"Contributor Scorecard 1.0\", "
                        + "\"description\": \"Per-contributor delivery performance\" }, "
                        + "\"schema\": { "
                        + "\"doraScore\": \"35-94 composite of deployment frequency, lead time, change failure rate and time to restore. null when no metric was available.\", "
                        + "\"contributionPercentage\": \"Share of team activity; sums to 100 across contributors.\", "
                        + "\"avgLeadTimeMs\": \"Mean lead time over the contributor's pull requests, in milliseconds.\", "
                        + "\"timeToRestoreMs\": \"Lead time used as a stand-in for restore time when the contributor handled incidents.\", "
                        + "\"topReviewers\": \"Most frequent reviewers of the contributor's pull requests.\" "
                        + "}, \"summary\": %s, \"podium\": %s, \"contributors\": %s }",
                Instant.now().toString(),
                summaryToJson(TeamSummary.of(data)),
                podiumToJson(podium),
                convertToDataJson(data));
    }

    private String scorecardToJson(ContributorScorecard c) {
        return String.format(Locale.ROOT,
                "{ \"username\": \"%s\", \"displayName\": \"%s\", \"avatarUrl\": %s, \"commitCount\": %d, "
                        + "\"prCount\": %d, \"additions\": %d, \"deletions\": %d, \"commentCount\": %d, "
                        + "\"reworkCycleCount\": %d, \"avgLeadTimeMs\": %s, \"avgMergeTimeMs\": %s, "
                        + "\"avgReworkTimeMs\": %s, \"deploymentCount\": %d, \"successfulDeployments\": %d, "
                        + "\"failedDeployments\": %d, \"incidentCount\": %d, \"deployFrequency\": %.4f, "
                        + "\"changeFailureRate\": %.4f, \"timeToRestoreMs\": %s, \"doraScore\": %s, "
                        + "\"contributionPercentage\": %d, \"activityLevel\": \"%s\", \"topReviewers\": [%s] }",
                escapeJson(c.username()), escapeJson(c.displayName()), stringOrNull(c.identity().avatarUrl()),
                c.commitCount(), c.prCount(), c.additions(), c.deletions(), c.commentCount(),
                c.reworkCycleCount(),
                numberOrNull(c.avgLeadTimeMs()), numberOrNull(c.avgMergeTimeMs()), numberOrNull(c.avgReworkTimeMs()),
                c.deploymentCount(), c.successfulDeployments(), c.failedDeployments(), c.incidentCount(),
                c.dora().deployFrequency(), c.dora().changeFailureRate(), numberOrNull(c.dora().timeToRestoreMs()),
                intOrNull(c.doraScore()), c.contributionPercentage(), c.activityLevel().name(),
                formatReviewers(c.topReviewers()));
    }

    private String summaryToJson(TeamSummary s) {
        return String.format(Locale.ROOT,
                "{ \"totalContributors\": %d, \"totalCommits\": %d, \"totalPullRequests\": %d, "
                        + "\"totalAdditions\": %d, \"totalDeletions\": %d, \"avgLeadTimeMs\": %.1f, \"avgMergeTimeMs\": %.1f }",
                s.totalContributors(), s.totalCommits(), s.totalPullRequests(), s.totalAdditions(),
                s.totalDeletions(), s.avgLeadTimeMs(), s.avgMergeTimeMs());
    }

    private String podiumToJson(List<PodiumRanker.Placement> podium) {
        return podium.stream()
                .map(p -> String.format(Locale.ROOT, "{ \"position\": %d, \"username\": \"%s\", \"score\": %.2f }",
                        p.position(), escapeJson(p.contributor().username()), p.score()))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String formatReviewers(List<ReviewerCount> reviewers) {
        return reviewers.stream()
                .map(r -> String.format(Locale.ROOT, "{ \"username\": \"%s\", \"displayName\": \"%s\", \"count\": %d }",
                        escapeJson(r.username()), escapeJson(r.displayName()), r.count()))
                .collect(Collectors.joining(", "));
    }

    private String numberOrNull(OptionalDouble value) {
        return value.isPresent() ? String.format(Locale.ROOT, "%.1f", value.getAsDouble()) : "null";
    }

    private String intOrNull(OptionalInt value) {
        return value.isPresent() ? String.valueOf(value.getAsInt()) : "null";
    }

    private String stringOrNull(String s) {
        return s == null ? "null" : "\"" + escapeJson(s) + "\"";
    }

    private String escapeJson(String s) {
        if (s == null)
            return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (char ch : s.toCharArray()) {
            switch (ch) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        sb.append(String.format(Locale.ROOT, "\\u%04x", (int) ch));
                    } else {
                        sb.append(ch);
                    }
                }
            }
        }
        return sb.toString();
    }
}
