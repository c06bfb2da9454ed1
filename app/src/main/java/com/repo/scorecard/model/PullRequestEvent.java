package com.repo.scorecard.model;

import java.util.List;

/**
 * A pull request attributed to its author, already normalized upstream.
 * Time metrics are optional and null when the source did not report them.
 */
public record PullRequestEvent(
        String authorUsername,
        /** Optional, used to resolve the contributor's display name */
        String authorDisplayName,
        String authorAvatarUrl,
        int commitCount,
        long additions,
        long deletions,
        int commentCount,
        int reworkCycles,
        Long leadTimeMs,
        Long mergeTimeMs,
        Long reworkTimeMs,
        List<String> reviewerUsernames) {

    public PullRequestEvent {
        reviewerUsernames = reviewerUsernames == null ? List.of() : List.copyOf(reviewerUsernames);
    }

    /**
     * Create a pull request carrying only counts, without identity details, time
     * metrics or reviewers.
     */
    public static PullRequestEvent basic(String authorUsername, int commitCount, long additions, long deletions) {
        return new PullRequestEvent(authorUsername, null, null, commitCount, additions, deletions,
                0, 0, null, null, null, List.of());
    }

    public PullRequestEvent withLeadTime(Long leadTimeMs) {
        return new PullRequestEvent(authorUsername, authorDisplayName, authorAvatarUrl, commitCount,
                additions, deletions, commentCount, reworkCycles, leadTimeMs, mergeTimeMs, reworkTimeMs,
                reviewerUsernames);
    }

    public PullRequestEvent withReviewers(List<String> reviewers) {
        return new PullRequestEvent(authorUsername, authorDisplayName, authorAvatarUrl, commitCount,
                additions, deletions, commentCount, reworkCycles, leadTimeMs, mergeTimeMs, reworkTimeMs,
                reviewers);
    }
}
