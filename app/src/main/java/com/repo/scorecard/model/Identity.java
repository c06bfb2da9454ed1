package com.repo.scorecard.model;

/**
 * A human contributor.
 * The username is the unique key; the display name falls back to the username.
 */
public record Identity(
        String username,
        String displayName,
        /** May be null when no avatar is known */
        String avatarUrl) {

    public Identity {
        if (displayName == null || displayName.isBlank()) {
            displayName = username;
        }
    }

    public static Identity of(String username) {
        return new Identity(username, username, null);
    }
}
