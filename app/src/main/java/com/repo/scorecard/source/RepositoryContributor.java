package com.repo.scorecard.source;

/**
 * One contributor as listed by a single repository.
 */
public record RepositoryContributor(
        String login,
        long id,
        String avatarUrl,
        String htmlUrl,
        /** Account type reported by the host, e.g. "User" or "Bot" */
        String type,
        int contributions) {
}
