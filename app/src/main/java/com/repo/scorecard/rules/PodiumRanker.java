package com.repo.scorecard.rules;

import com.repo.scorecard.model.ContributorScorecard;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Picks the top contributors for the podium view by a blended ranking score.
 */
public class PodiumRanker {

    private static final double MS_PER_HOUR = 60 * 60 * 1000;

    /**
     * A contributor with the score used to place them.
     */
    public record Placement(int position, ContributorScorecard contributor, double score) {
    }

    private final int size;

    public PodiumRanker(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Podium size must not be negative: " + size);
        }
        this.size = size;
    }

    /**
     * @return the top {@code size} contributors, best first; empty if the team
     *         has fewer than {@code size} contributors
     */
    public List<Placement> rank(List<ContributorScorecard> contributors) {
        if (contributors.size() < size) {
            return List.of();
        }
        List<ContributorScorecard> ordered = contributors.stream()
                .sorted(Comparator.comparingDouble(PodiumRanker::rankingScore).reversed())
                .limit(size)
                .collect(Collectors.toList());

        return IntStream.range(0, ordered.size())
                .mapToObj(i -> new Placement(i + 1, ordered.get(i), rankingScore(ordered.get(i))))
                .collect(Collectors.toList());
    }

    public static double rankingScore(ContributorScorecard c) {
        double score = c.commitCount() * 5 + c.prCount() * 15;

        score += (c.additions() + c.deletions()) / 100.0;

        if (c.deploymentCount() > 0) {
            score += c.deploymentSuccessRate() * 100;
        }

        if (c.doraScore().isPresent()) {
            score += c.doraScore().getAsInt() * 2;
        }

        // Slow lead times cost up to 50 points
        if (c.avgLeadTimeMs().isPresent()) {
            double leadTimeHours = c.avgLeadTimeMs().getAsDouble() / MS_PER_HOUR;
            score -= Math.min(50, leadTimeHours / 10);
        }

        return Math.max(0, score);
    }
}
