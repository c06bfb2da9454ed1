package com.repo.scorecard.model;

/**
 * An incident assigned to a contributor.
 */
public record IncidentEvent(String assigneeUsername) {
}
