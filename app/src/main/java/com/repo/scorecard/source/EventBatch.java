package com.repo.scorecard.source;

import com.repo.scorecard.model.DeploymentEvent;
import com.repo.scorecard.model.IncidentEvent;
import com.repo.scorecard.model.PullRequestEvent;

import java.util.List;

/**
 * The three event streams of one time window.
 */
public record EventBatch(
        List<PullRequestEvent> pullRequests,
        List<DeploymentEvent> deployments,
        List<IncidentEvent> incidents) {

    public static EventBatch empty() {
        return new EventBatch(List.of(), List.of(), List.of());
    }
}
