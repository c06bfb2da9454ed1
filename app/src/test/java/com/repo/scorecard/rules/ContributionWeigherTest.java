package com.repo.scorecard.rules;

import com.repo.scorecard.model.ContributorScorecard;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static com.repo.scorecard.model.ScorecardFixtures.HOUR_MS;
import static com.repo.scorecard.model.ScorecardFixtures.card;
import static org.junit.jupiter.api.Assertions.*;

class ContributionWeigherTest {

    private final ContributionWeigher weigher = new ContributionWeigher();

    private static int sum(int[] values) {
        return Arrays.stream(values).sum();
    }

    @Test
    void testWeightedShares() {
        // alice: 0.35 * 3 + 0.20 * 12 = 3.45, bob: 0.35 + 0.40 = 0.75
        int[] percentages = weigher.weigh(List.of(card("alice", 12, 3), card("bob", 2, 1)));

        assertArrayEquals(new int[] { 82, 18 }, percentages);
    }

    @Test
    void testWeightedScoreComponents() {
        // 0.7 PRs + 0.8 commits + 7.5 capped churn + 15 deploy success + 0.9 speed
        ContributorScorecard c = card("alice", 4, 2, 6000, 24 * HOUR_MS, 4, 1, 0);

        assertEquals(24.9, weigher.weightedScore(c), 1e-9);
    }

    @Test
    void testSpeedScore() {
        assertEquals(8.0, ContributionWeigher.speedScore(card("a", 1, 1, 0, 48 * HOUR_MS, 0, 0, 0)), 1e-9);
        assertEquals(3.0, ContributionWeigher.speedScore(card("a", 1, 1, 0, 400 * HOUR_MS, 0, 0, 0)), 1e-9,
                "Lead time is capped at a week");
        assertEquals(0.0, ContributionWeigher.speedScore(card("a", 1, 1)));
    }

    @Test
    void testSingleContributorGetsEverything() {
        assertArrayEquals(new int[] { 100 }, weigher.weigh(List.of(card("alice", 1, 1))));
    }

    @Test
    void testEmptyTeam() {
        assertEquals(0, weigher.weigh(List.of()).length);
    }

    @Test
    void testEqualSharesFallBackToPullRequestShare() {
        // Both weigh 0.7: 2 PRs vs 1 PR + 1 commit + 100 lines
        ContributorScorecard twoPrs = card("alice", 0, 2);
        ContributorScorecard onePr = card("bob", 1, 1, 100, null, 0, 0, 0);

        int[] percentages = weigher.weigh(List.of(twoPrs, onePr));

        assertArrayEquals(new int[] { 67, 33 }, percentages);
    }

    @Test
    void testIdenticalContributorsAbsorbRoundingOnFirst() {
        int[] percentages = weigher.weigh(List.of(card("a", 1, 1), card("b", 1, 1), card("c", 1, 1)));

        assertArrayEquals(new int[] { 34, 33, 33 }, percentages);
    }

    @Test
    void testDriftCorrection() {
        int[] over = { 50, 51 };
        ContributionWeigher.correctDrift(over);
        assertArrayEquals(new int[] { 50, 50 }, over, "Excess comes off the largest share");

        int[] exact = { 20, 40, 40, 0 };
        ContributionWeigher.correctDrift(exact);
        assertArrayEquals(new int[] { 20, 40, 40, 0 }, exact);

        int[] tie = { 33, 33, 33 };
        ContributionWeigher.correctDrift(tie);
        assertArrayEquals(new int[] { 34, 33, 33 }, tie, "First of equal shares takes the difference");

        int[] zeros = { 0, 0 };
        ContributionWeigher.correctDrift(zeros);
        assertArrayEquals(new int[] { 100, 0 }, zeros);
    }

    @Test
    void testSharesAlwaysSumToHundred() {
        Random random = new Random(7);
        for (int team = 0; team < 200; team++) {
            int size = 1 + random.nextInt(12);
            List<ContributorScorecard> members = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                int deployments = random.nextInt(5);
                Long leadTime = random.nextBoolean() ? (long) random.nextInt(300) * HOUR_MS : null;
                members.add(card("dev" + i, random.nextInt(40), 1 + random.nextInt(10),
                        random.nextInt(8000), leadTime, deployments, deployments == 0 ? 0 : random.nextInt(deployments + 1),
                        0));
            }

            int[] percentages = weigher.weigh(members);

            assertEquals(100, sum(percentages), "Team " + team + " shares: " + Arrays.toString(percentages));
            for (int p : percentages) {
                assertTrue(p >= 0 && p <= 100, "Share out of range: " + p);
            }
        }
    }

    @Test
    void testApplySetsPercentages() {
        List<ContributorScorecard> result = weigher.apply(List.of(card("alice", 12, 3), card("bob", 2, 1)));

        assertEquals(82, result.get(0).contributionPercentage());
        assertEquals(18, result.get(1).contributionPercentage());
    }
}
