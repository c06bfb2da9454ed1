package com.repo.scorecard.source;

import com.repo.scorecard.model.Identity;

import java.util.List;

/**
 * A contributor merged across all of a team's repositories.
 */
public record RosterEntry(
        String login,
        long id,
        String avatarUrl,
        String htmlUrl,
        String type,
        /** Sum over all repositories */
        int contributions,
        List<RepositoryShare> repositories) {

    /**
     * Contributions made to one repository.
     */
    public record RepositoryShare(String name, int contributions) {
    }

    public RosterEntry {
        repositories = List.copyOf(repositories);
    }

    public Identity toIdentity() {
        return new Identity(login, login, avatarUrl);
    }
}
