package com.repo.scorecard.join;

import com.repo.scorecard.core.BotFilter;
import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.model.DeploymentEvent;
import com.repo.scorecard.model.DeploymentStatus;
import com.repo.scorecard.model.Identity;
import com.repo.scorecard.model.IncidentEvent;
import com.repo.scorecard.model.PullRequestEvent;
import com.repo.scorecard.model.ReviewerCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Folds pull request, deployment and incident events into one unscored
 * scorecard per human contributor.
 *
 * Only pull request authors become contributors. Deployments and incidents are
 * attached to contributors already known from pull requests; everything else is
 * dropped. Bots are excluded at every join point, reviewers included.
 */
public class EventJoiner {

    private static final Logger log = LoggerFactory.getLogger(EventJoiner.class);

    private final BotFilter botFilter;
    private final int topReviewerLimit;

    public EventJoiner(BotFilter botFilter, int topReviewerLimit) {
        this.botFilter = botFilter;
        this.topReviewerLimit = topReviewerLimit;
    }

    /**
     * Join events without a known identity directory.
     */
    public List<ContributorScorecard> join(List<PullRequestEvent> pullRequests,
            List<DeploymentEvent> deployments,
            List<IncidentEvent> incidents) {
        return join(pullRequests, deployments, incidents, List.of());
    }

    /**
     * Join events into scorecards in first-seen author order.
     *
     * @param knownIdentities identities (e.g. from a merged roster) used to
     *                        resolve display names and avatars; never creates
     *                        contributors on its own
     */
    public List<ContributorScorecard> join(List<PullRequestEvent> pullRequests,
            List<DeploymentEvent> deployments,
            List<IncidentEvent> incidents,
            Collection<Identity> knownIdentities) {
        Map<String, Identity> directory = indexIdentities(knownIdentities);
        Map<String, ContributorTally> tallies = new LinkedHashMap<>();

        int skipped = 0;
        for (PullRequestEvent pr : nullToEmpty(pullRequests)) {
            if (!foldPullRequest(pr, tallies)) {
                skipped++;
            }
        }
        for (DeploymentEvent deployment : nullToEmpty(deployments)) {
            if (!foldDeployment(deployment, tallies)) {
                skipped++;
            }
        }
        for (IncidentEvent incident : nullToEmpty(incidents)) {
            if (!foldIncident(incident, tallies)) {
                skipped++;
            }
        }
        log.debug("Joined {} contributors, {} events not attached", tallies.size(), skipped);

        List<ContributorScorecard> scorecards = new ArrayList<>(tallies.size());
        for (ContributorTally tally : tallies.values()) {
            resolveIdentity(tally, directory);
            scorecards.add(tally.toScorecard(topReviewers(tally, tallies, directory)));
        }
        return scorecards;
    }

    private boolean foldPullRequest(PullRequestEvent pr, Map<String, ContributorTally> tallies) {
        if (pr == null || isBlank(pr.authorUsername())) {
            log.warn("Skipping pull request without an author: {}", pr);
            return false;
        }
        if (hasNegativeCount(pr)) {
            log.warn("Skipping pull request with a negative count: {}", pr);
            return false;
        }
        String author = pr.authorUsername();
        if (botFilter.isBot(author)) {
            return false;
        }

        ContributorTally tally = tallies.computeIfAbsent(author, ContributorTally::new);
        tally.prCount++;
        tally.commitCount += pr.commitCount();
        tally.additions += pr.additions();
        tally.deletions += pr.deletions();
        tally.commentCount += pr.commentCount();
        tally.reworkCycleCount += pr.reworkCycles();

        // Means are taken over the post-increment PR count
        tally.leadTime.fold(pr.leadTimeMs(), tally.prCount);
        tally.mergeTime.fold(pr.mergeTimeMs(), tally.prCount);
        tally.reworkTime.fold(pr.reworkTimeMs(), tally.prCount);

        if (tally.displayName == null && !isBlank(pr.authorDisplayName())) {
            tally.displayName = pr.authorDisplayName();
        }
        if (tally.avatarUrl == null && !isBlank(pr.authorAvatarUrl())) {
            tally.avatarUrl = pr.authorAvatarUrl();
        }

        // A reviewer is counted once per pull request
        Set<String> reviewers = new LinkedHashSet<>(pr.reviewerUsernames());
        for (String reviewer : reviewers) {
            if (isBlank(reviewer) || reviewer.equals(author) || botFilter.isBot(reviewer)) {
                continue;
            }
            tally.reviewerCounts.merge(reviewer, 1, Integer::sum);
        }
        return true;
    }

    private boolean foldDeployment(DeploymentEvent deployment, Map<String, ContributorTally> tallies) {
        if (deployment == null || isBlank(deployment.actorUsername()) || deployment.status() == null) {
            log.warn("Skipping malformed deployment: {}", deployment);
            return false;
        }
        String actor = deployment.actorUsername();
        if (botFilter.isBot(actor)) {
            return false;
        }
        ContributorTally tally = tallies.get(actor);
        if (tally == null) {
            return false;
        }

        tally.deploymentCount++;
        if (deployment.status() == DeploymentStatus.SUCCESS) {
            tally.successfulDeployments++;
        } else {
            tally.failedDeployments++;
        }
        return true;
    }

    private boolean foldIncident(IncidentEvent incident, Map<String, ContributorTally> tallies) {
        if (incident == null || isBlank(incident.assigneeUsername())) {
            log.warn("Skipping incident without an assignee: {}", incident);
            return false;
        }
        String assignee = incident.assigneeUsername();
        if (botFilter.isBot(assignee)) {
            return false;
        }
        ContributorTally tally = tallies.get(assignee);
        if (tally == null) {
            return false;
        }
        tally.incidentCount++;
        return true;
    }

    private void resolveIdentity(ContributorTally tally, Map<String, Identity> directory) {
        Identity known = directory.get(tally.username);
        if (known == null) {
            return;
        }
        if (tally.displayName == null) {
            tally.displayName = known.displayName();
        }
        if (tally.avatarUrl == null) {
            tally.avatarUrl = known.avatarUrl();
        }
    }

    private List<ReviewerCount> topReviewers(ContributorTally owner,
            Map<String, ContributorTally> tallies,
            Map<String, Identity> directory) {
        // Stable sort keeps first-seen order among equal counts
        return owner.reviewerCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(topReviewerLimit)
                .map(e -> new ReviewerCount(e.getKey(), displayNameOf(e.getKey(), tallies, directory),
                        e.getValue()))
                .collect(Collectors.toList());
    }

    private String displayNameOf(String username,
            Map<String, ContributorTally> tallies,
            Map<String, Identity> directory) {
        ContributorTally tally = tallies.get(username);
        if (tally != null && tally.displayName != null) {
            return tally.displayName;
        }
        Identity known = directory.get(username);
        return known != null ? known.displayName() : username;
    }

    private Map<String, Identity> indexIdentities(Collection<Identity> identities) {
        Map<String, Identity> index = new HashMap<>();
        if (identities == null) {
            return index;
        }
        for (Identity identity : identities) {
            if (identity != null && !isBlank(identity.username()) && !botFilter.isBot(identity.username())) {
                index.putIfAbsent(identity.username(), identity);
            }
        }
        return index;
    }

    private static boolean hasNegativeCount(PullRequestEvent pr) {
        return pr.commitCount() < 0 || pr.additions() < 0 || pr.deletions() < 0
                || pr.commentCount() < 0 || pr.reworkCycles() < 0;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
