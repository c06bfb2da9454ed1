package com.repo.scorecard.model;

import java.util.Locale;

public enum DeploymentStatus {
    SUCCESS,
    FAILURE;

    /**
     * Parse a status label case-insensitively ("success", "FAILURE").
     *
     * @throws IllegalArgumentException for any other label
     */
    public static DeploymentStatus parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Deployment status is missing");
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "success" -> SUCCESS;
            case "failure" -> FAILURE;
            default -> throw new IllegalArgumentException("Unknown deployment status: " + label);
        };
    }
}
