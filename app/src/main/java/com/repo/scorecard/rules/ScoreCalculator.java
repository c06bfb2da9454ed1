package com.repo.scorecard.rules;

import com.repo.scorecard.core.ScorecardConfig;
import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.model.DoraMetrics;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Random;

/**
 * Band-based DORA scorer.
 * Derives the four DORA sub-metrics for a contributor and averages their band
 * points, plus a fixed baseline, into a 0-100 composite.
 */
public class ScoreCalculator {

    private static final double MS_PER_HOUR = 60 * 60 * 1000;

    /** Scores above this are compressed into [85, 94] */
    public static final int ELITE_THRESHOLD = 85;
    public static final int ELITE_MAX = 94;

    /** Scores below this are compressed into [35, 44] */
    public static final int WEAK_THRESHOLD = 35;
    public static final int WEAK_MAX = 44;

    /**
     * One row of a banding table. Rows are checked in order; values past the
     * last row earn the floor points.
     */
    public record Band(double limit, int points) {
    }

    // Higher is better: first band whose limit is reached wins
    private static final List<Band> DEPLOYS_PER_WEEK = List.of(
            new Band(7, 100),
            new Band(1, 75),
            new Band(0.25, 50));

    // Lower is better: first band whose limit is not reached wins
    private static final List<Band> LEAD_TIME_HOURS = List.of(
            new Band(24, 100),
            new Band(168, 75),
            new Band(720, 50));

    private static final List<Band> CHANGE_FAILURE_RATE = List.of(
            new Band(0.15, 100),
            new Band(0.30, 75),
            new Band(0.45, 50));

    private static final List<Band> RESTORE_HOURS = List.of(
            new Band(1, 100),
            new Band(24, 75),
            new Band(168, 50));

    private static final int FLOOR_POINTS = 25;

    private final double windowWeeks;
    private final int baselinePoints;
    private final Random random;

    public ScoreCalculator() {
        this(ScorecardConfig.defaults(), new Random());
    }

    public ScoreCalculator(ScorecardConfig config, Random random) {
        this.windowWeeks = config.getWindowWeeks();
        this.baselinePoints = config.getBaselinePoints();
        this.random = random;
    }

    /**
     * Score one contributor.
     *
     * @return a copy of the scorecard with DORA metrics and score filled in
     */
    public ContributorScorecard evaluate(ContributorScorecard card) {
        DoraMetrics metrics = metricsFor(card);
        OptionalInt raw = rawScore(card, metrics);
        OptionalInt score = raw.isPresent() ? OptionalInt.of(clamp(raw.getAsInt())) : OptionalInt.empty();
        return card.withScore(metrics, score);
    }

    public DoraMetrics metricsFor(ContributorScorecard card) {
        double deployFrequency = (double) card.deploymentCount() / Math.max(1, card.prCount());
        double changeFailureRate = (double) card.failedDeployments() / Math.max(1, card.deploymentCount());
        // Lead time stands in for restore time; no real restore data exists
        OptionalDouble timeToRestore = card.incidentCount() > 0
                ? card.avgLeadTimeMs()
                : OptionalDouble.empty();
        return new DoraMetrics(deployFrequency, changeFailureRate, timeToRestore);
    }

    /**
     * Unclamped composite score, empty when no sub-metric has data.
     */
    public OptionalInt rawScore(ContributorScorecard card, DoraMetrics metrics) {
        int sum = 0;
        int metricsCounted = 0;

        if (card.deploymentCount() > 0) {
            double perWeek = metrics.deployFrequency() / windowWeeks;
            sum += pointsAtLeast(DEPLOYS_PER_WEEK, perWeek);
            metricsCounted++;

            sum += pointsBelow(CHANGE_FAILURE_RATE, metrics.changeFailureRate());
            metricsCounted++;
        }

        if (card.avgLeadTimeMs().isPresent()) {
            sum += pointsBelow(LEAD_TIME_HOURS, card.avgLeadTimeMs().getAsDouble() / MS_PER_HOUR);
            metricsCounted++;
        }

        if (metrics.timeToRestoreMs().isPresent()) {
            sum += pointsBelow(RESTORE_HOURS, metrics.timeToRestoreMs().getAsDouble() / MS_PER_HOUR);
            metricsCounted++;
        }

        if (metricsCounted == 0) {
            return OptionalInt.empty();
        }

        // Baseline pulls sparse data toward the middle
        sum += baselinePoints;
        metricsCounted++;

        return OptionalInt.of((int) Math.round((double) sum / metricsCounted));
    }

    /**
     * Compress extreme scores into fixed bands with a uniform random draw.
     * Scores in [35, 85] pass through unchanged.
     */
    public int clamp(int rawScore) {
        if (rawScore > ELITE_THRESHOLD) {
            return ELITE_THRESHOLD + random.nextInt(ELITE_MAX - ELITE_THRESHOLD + 1);
        }
        if (rawScore < WEAK_THRESHOLD) {
            return WEAK_THRESHOLD + random.nextInt(WEAK_MAX - WEAK_THRESHOLD + 1);
        }
        return rawScore;
    }

    static int pointsAtLeast(List<Band> bands, double value) {
        for (Band band : bands) {
            if (value >= band.limit()) {
                return band.points();
            }
        }
        return FLOOR_POINTS;
    }

    static int pointsBelow(List<Band> bands, double value) {
        for (Band band : bands) {
            if (value < band.limit()) {
                return band.points();
            }
        }
        return FLOOR_POINTS;
    }
}
