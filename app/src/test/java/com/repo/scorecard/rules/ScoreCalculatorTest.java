package com.repo.scorecard.rules;

import com.repo.scorecard.core.ScorecardConfig;
import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.model.DoraMetrics;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;
import java.util.Random;

import static com.repo.scorecard.model.ScorecardFixtures.HOUR_MS;
import static com.repo.scorecard.model.ScorecardFixtures.card;
import static org.junit.jupiter.api.Assertions.*;

class ScoreCalculatorTest {

    private final ScoreCalculator calculator = new ScoreCalculator(ScorecardConfig.defaults(), new Random(42));

    /** Always draws the given offset within the band */
    private static Random fixedDraw(boolean highest) {
        return new Random() {
            @Override
            public int nextInt(int bound) {
                return highest ? bound - 1 : 0;
            }
        };
    }

    private OptionalInt scoreOf(ContributorScorecard card) {
        return calculator.evaluate(card).doraScore();
    }

    @Test
    void testDoraSubMetrics() {
        ContributorScorecard c = card("alice", 10, 4, 0, 3 * HOUR_MS, 6, 2, 1);

        DoraMetrics metrics = calculator.metricsFor(c);

        assertEquals(1.5, metrics.deployFrequency(), 1e-9);
        assertEquals(2.0 / 6, metrics.changeFailureRate(), 1e-9);
        assertEquals(3.0 * HOUR_MS, metrics.timeToRestoreMs().getAsDouble(), 1e-9,
                "Lead time stands in for restore time");
    }

    @Test
    void testNoIncidentsMeansNoRestoreTime() {
        DoraMetrics metrics = calculator.metricsFor(card("alice", 1, 1, 0, HOUR_MS, 0, 0, 0));
        assertTrue(metrics.timeToRestoreMs().isEmpty());
        assertEquals(0.0, metrics.deployFrequency());
        assertEquals(0.0, metrics.changeFailureRate());
    }

    @Test
    void testNoMetricsMeansNoScore() {
        ContributorScorecard scored = calculator.evaluate(card("alice", 3, 2));
        assertTrue(scored.doraScore().isEmpty());
    }

    @Test
    void testLeadTimeOnly() {
        // (100 + 40) / 2
        assertEquals(OptionalInt.of(70), scoreOf(card("alice", 1, 1, 0, 2 * HOUR_MS, 0, 0, 0)));
    }

    @Test
    void testDeploymentsAndLeadTime() {
        // 1 deploy/PR over 4 weeks = 0.25/wk -> 50, CFR 0 -> 100, 48h -> 75, baseline 40
        // (50 + 100 + 75 + 40) / 4 = 66.25
        assertEquals(OptionalInt.of(66), scoreOf(card("alice", 4, 4, 0, 48 * HOUR_MS, 4, 0, 0)));
    }

    @Test
    void testLeadTimeAndRestoreTime() {
        // (100 + 100 + 40) / 3
        assertEquals(OptionalInt.of(80), scoreOf(card("alice", 1, 1, 0, HOUR_MS / 2, 0, 0, 1)));
    }

    @Test
    void testBandEdges() {
        // 720h lead time falls to the floor band: (25 + 40) / 2 = 32.5 -> 33 -> weak band
        OptionalInt weak = scoreOf(card("alice", 1, 1, 0, 720 * HOUR_MS, 0, 0, 0));
        assertTrue(weak.getAsInt() >= 35 && weak.getAsInt() <= 44);

        // 24h is not "under a day": (75 + 40) / 2 = 57.5 -> 58
        assertEquals(OptionalInt.of(58), scoreOf(card("alice", 1, 1, 0, 24 * HOUR_MS, 0, 0, 0)));

        // CFR 0.15 is not under 0.15: 2 deploys/PR -> 0.5/wk -> 50, CFR 75, (50 + 75 + 40) / 3 = 55
        ContributorScorecard c = card("alice", 1, 20, 0, null, 40, 6, 0);
        assertEquals(OptionalInt.of(55), scoreOf(c));
    }

    @Test
    void testRawScoreAtEliteThresholdPassesThrough() {
        // 28 deploys for 1 PR -> 7/wk -> 100, CFR 0 -> 100, 1h lead -> 100; (300 + 40) / 4 = 85
        ContributorScorecard c = card("alice", 1, 1, 0, HOUR_MS, 28, 0, 0);
        assertEquals(OptionalInt.of(85), calculator.rawScore(c, calculator.metricsFor(c)));
        assertEquals(OptionalInt.of(85), scoreOf(c));
    }

    @Test
    void testEliteScoresAreCompressed() {
        // (100 + 100 + 100 + 100 + 40) / 5 = 88
        ContributorScorecard c = card("alice", 1, 1, 0, HOUR_MS / 2, 40, 0, 1);
        assertEquals(OptionalInt.of(88), calculator.rawScore(c, calculator.metricsFor(c)));

        for (int i = 0; i < 50; i++) {
            int score = scoreOf(c).getAsInt();
            assertTrue(score >= 85 && score <= 94, "Elite score out of band: " + score);
        }
    }

    @Test
    void testWeakScoresAreCompressed() {
        // 0.025/wk -> 25, CFR 1 -> 25, 1000h -> 25, restore 1000h -> 25; (100 + 40) / 5 = 28
        ContributorScorecard c = card("alice", 10, 10, 0, 1000 * HOUR_MS, 1, 1, 2);
        assertEquals(OptionalInt.of(28), calculator.rawScore(c, calculator.metricsFor(c)));

        for (int i = 0; i < 50; i++) {
            int score = scoreOf(c).getAsInt();
            assertTrue(score >= 35 && score <= 44, "Weak score out of band: " + score);
        }
    }

    @Test
    void testClampBandsAreInclusive() {
        ScoreCalculator low = new ScoreCalculator(ScorecardConfig.defaults(), fixedDraw(false));
        ScoreCalculator high = new ScoreCalculator(ScorecardConfig.defaults(), fixedDraw(true));

        assertEquals(85, low.clamp(100));
        assertEquals(94, high.clamp(86));
        assertEquals(35, low.clamp(0));
        assertEquals(44, high.clamp(34));
    }

    @Test
    void testMiddleScoresAreDeterministic() {
        for (int raw = 35; raw <= 85; raw++) {
            assertEquals(raw, calculator.clamp(raw));
        }
    }

    @Test
    void testEvaluateKeepsCounters() {
        ContributorScorecard c = card("alice", 7, 3, 120, 2 * HOUR_MS, 2, 1, 0);
        ContributorScorecard scored = calculator.evaluate(c);

        assertEquals(7, scored.commitCount());
        assertEquals(3, scored.prCount());
        assertEquals(2, scored.deploymentCount());
        assertEquals(0.5, scored.dora().changeFailureRate(), 1e-9);
    }
}
