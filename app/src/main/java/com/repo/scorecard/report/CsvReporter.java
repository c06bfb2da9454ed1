package com.repo.scorecard.report;

import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.model.ReviewerCount;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class CsvReporter {

    static final String HEADER = "Username,Display Name,Commits,PRs,Additions,Deletions,Comments,Rework Cycles,"
            + "Avg Lead Time,Avg Merge Time,Avg Rework Time,Deployments,Successful,Failed,Incidents,"
            + "Deploy Frequency,Change Failure Rate,DORA Score,Contribution %,Activity,Top Reviewers\n";

    public void generate(List<ContributorScorecard> data, Path outputPath) throws IOException {
        Files.writeString(outputPath, render(data));
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    public String render(List<ContributorScorecard> data) {
        StringBuilder csv = new StringBuilder(HEADER);

        for (ContributorScorecard c : data) {
            csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%d,%d,%d,%s,%s,%s,%d,%d,%d,%d,%.2f,%.2f,%s,%d,%s,%s\n",
                    escape(c.username()),
                    escape(c.displayName()),
                    c.commitCount(),
                    c.prCount(),
                    c.additions(),
                    c.deletions(),
                    c.commentCount(),
                    c.reworkCycleCount(),
                    DurationFormatter.format(c.avgLeadTimeMs()),
                    DurationFormatter.format(c.avgMergeTimeMs()),
                    DurationFormatter.format(c.avgReworkTimeMs()),
                    c.deploymentCount(),
                    c.successfulDeployments(),
                    c.failedDeployments(),
                    c.incidentCount(),
                    c.dora().deployFrequency(),
                    c.dora().changeFailureRate(),
                    c.doraScore().isPresent() ? String.valueOf(c.doraScore().getAsInt()) : "",
                    c.contributionPercentage(),
                    c.activityLevel().label(),
                    escape(formatReviewers(c.topReviewers()))));
        }
        return csv.toString();
    }

    private String formatReviewers(List<ReviewerCount> reviewers) {
        return reviewers.stream()
                .map(r -> r.username() + " (" + r.count() + ")")
                .collect(Collectors.joining(";"));
    }

    private String escape(String s) {
        if (s == null)
            return "";
        // Quote fields containing separators, doubling embedded quotes
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
