package com.repo.scorecard.model;

import java.time.Instant;

/**
 * A deployment triggered by an actor.
 */
public record DeploymentEvent(
        String actorUsername,
        DeploymentStatus status,
        Instant timestamp) {
}
