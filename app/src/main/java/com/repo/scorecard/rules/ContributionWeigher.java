package com.repo.scorecard.rules;

import com.repo.scorecard.model.ContributorScorecard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes each contributor's share of team activity.
 * Percentages are whole numbers that always sum to exactly 100 for a
 * non-empty team.
 */
public class ContributionWeigher {

    private static final Logger log = LoggerFactory.getLogger(ContributionWeigher.class);

    private static final double MS_PER_HOUR = 60 * 60 * 1000;

    private static final double WEIGHT_PRS = 0.35;
    private static final double WEIGHT_COMMITS = 0.20;
    private static final double WEIGHT_CHURN = 0.15;
    private static final double WEIGHT_DEPLOY_SUCCESS = 0.20;
    private static final double WEIGHT_SPEED = 0.10;

    private static final long CHURN_CAP_LINES = 5000;
    private static final double LEAD_TIME_CAP_HOURS = 168;

    /**
     * @return percentages in the same order as {@code contributors}
     */
    public int[] weigh(List<ContributorScorecard> contributors) {
        int n = contributors.size();
        int[] percentages = new int[n];
        if (n == 0) {
            return percentages;
        }

        double[] weights = new double[n];
        double total = 0;
        for (int i = 0; i < n; i++) {
            weights[i] = weightedScore(contributors.get(i));
            total += weights[i];
        }

        if (total > 0) {
            for (int i = 0; i < n; i++) {
                percentages[i] = (int) Math.round(100 * weights[i] / total);
            }
        }

        if (n >= 2 && allEqual(percentages)) {
            log.debug("Weighted shares did not discriminate between {} contributors, using PR share", n);
            percentages = prShare(contributors);
        }

        correctDrift(percentages);
        return percentages;
    }

    /**
     * Apply {@link #weigh(List)} and return updated copies.
     */
    public List<ContributorScorecard> apply(List<ContributorScorecard> contributors) {
        int[] percentages = weigh(contributors);
        List<ContributorScorecard> result = new ArrayList<>(contributors.size());
        for (int i = 0; i < contributors.size(); i++) {
            result.add(contributors.get(i).withContributionPercentage(percentages[i]));
        }
        return result;
    }

    public double weightedScore(ContributorScorecard card) {
        double churn = Math.min(CHURN_CAP_LINES, card.additions() + card.deletions()) / 100.0;
        double deploySuccess = (double) card.successfulDeployments() / Math.max(1, card.deploymentCount()) * 100;

        return WEIGHT_PRS * card.prCount()
                + WEIGHT_COMMITS * card.commitCount()
                + WEIGHT_CHURN * churn
                + WEIGHT_DEPLOY_SUCCESS * deploySuccess
                + WEIGHT_SPEED * speedScore(card);
    }

    /**
     * 10 for instant lead times down to 3 at a week or more; 0 when unknown.
     */
    static double speedScore(ContributorScorecard card) {
        if (card.avgLeadTimeMs().isEmpty()) {
            return 0;
        }
        double leadTimeHours = card.avgLeadTimeMs().getAsDouble() / MS_PER_HOUR;
        return Math.max(0, 10 - Math.min(LEAD_TIME_CAP_HOURS, leadTimeHours) / 24);
    }

    private int[] prShare(List<ContributorScorecard> contributors) {
        int[] shares = new int[contributors.size()];
        long totalPrs = contributors.stream().mapToLong(ContributorScorecard::prCount).sum();
        if (totalPrs == 0) {
            return shares;
        }
        for (int i = 0; i < shares.length; i++) {
            shares[i] = (int) Math.round(100.0 * contributors.get(i).prCount() / totalPrs);
        }
        return shares;
    }

    /**
     * Push any rounding difference onto the largest share (first one on ties).
     */
    static void correctDrift(int[] percentages) {
        if (percentages.length == 0) {
            return;
        }
        int sum = 0;
        int top = 0;
        for (int i = 0; i < percentages.length; i++) {
            sum += percentages[i];
            if (percentages[i] > percentages[top]) {
                top = i;
            }
        }
        if (sum != 100) {
            percentages[top] += 100 - sum;
        }
    }

    private static boolean allEqual(int[] values) {
        for (int value : values) {
            if (value != values[0]) {
                return false;
            }
        }
        return true;
    }
}
