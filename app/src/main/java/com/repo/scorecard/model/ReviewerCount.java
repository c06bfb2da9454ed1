package com.repo.scorecard.model;

/**
 * How many of a contributor's pull requests one reviewer took part in.
 */
public record ReviewerCount(
        String username,
        String displayName,
        int count) {
}
