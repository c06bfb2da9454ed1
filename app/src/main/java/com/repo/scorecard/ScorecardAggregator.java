package com.repo.scorecard;

import com.repo.scorecard.core.ScorecardConfig;
import com.repo.scorecard.join.EventJoiner;
import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.model.DeploymentEvent;
import com.repo.scorecard.model.Identity;
import com.repo.scorecard.model.IncidentEvent;
import com.repo.scorecard.model.PullRequestEvent;
import com.repo.scorecard.rules.ContributionWeigher;
import com.repo.scorecard.rules.ScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Reduces one time window's events into sorted contributor scorecards.
 *
 * Each call builds its state from scratch, so a single instance can serve
 * concurrent callers. Results are deterministic except for DORA scores that
 * land in a compressed band (see {@link ScoreCalculator#clamp(int)}).
 */
public class ScorecardAggregator {

    private static final Logger log = LoggerFactory.getLogger(ScorecardAggregator.class);

    /** Most commits first, then most PRs; remaining ties keep encounter order */
    static final Comparator<ContributorScorecard> RESULT_ORDER = Comparator
            .comparingInt(ContributorScorecard::commitCount).reversed()
            .thenComparing(Comparator.comparingInt(ContributorScorecard::prCount).reversed());

    private final EventJoiner joiner;
    private final ScoreCalculator scoreCalculator;
    private final ContributionWeigher weigher;

    public ScorecardAggregator() {
        this(ScorecardConfig.defaults());
    }

    public ScorecardAggregator(ScorecardConfig config) {
        this(config, new Random());
    }

    public ScorecardAggregator(ScorecardConfig config, Random random) {
        this(new EventJoiner(config.botFilter(), config.getTopReviewerLimit()),
                new ScoreCalculator(config, random),
                new ContributionWeigher());
    }

    public ScorecardAggregator(EventJoiner joiner, ScoreCalculator scoreCalculator, ContributionWeigher weigher) {
        this.joiner = joiner;
        this.scoreCalculator = scoreCalculator;
        this.weigher = weigher;
    }

    public List<ContributorScorecard> aggregate(List<PullRequestEvent> pullRequests,
            List<DeploymentEvent> deployments,
            List<IncidentEvent> incidents) {
        return aggregate(pullRequests, deployments, incidents, List.of());
    }

    /**
     * @param knownIdentities display names and avatars to prefer over bare
     *                        usernames, e.g. from a merged contributor roster
     */
    public List<ContributorScorecard> aggregate(List<PullRequestEvent> pullRequests,
            List<DeploymentEvent> deployments,
            List<IncidentEvent> incidents,
            Collection<Identity> knownIdentities) {
        List<ContributorScorecard> joined = joiner.join(pullRequests, deployments, incidents, knownIdentities);

        List<ContributorScorecard> scored = new ArrayList<>(joined.size());
        for (ContributorScorecard card : joined) {
            scored.add(scoreCalculator.evaluate(card));
        }

        List<ContributorScorecard> weighed = weigher.apply(scored);

        // List.sort is stable
        List<ContributorScorecard> result = new ArrayList<>(weighed);
        result.sort(RESULT_ORDER);

        log.info("Aggregated {} contributors from {} pull requests, {} deployments, {} incidents",
                result.size(), sizeOf(pullRequests), sizeOf(deployments), sizeOf(incidents));
        return result;
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
