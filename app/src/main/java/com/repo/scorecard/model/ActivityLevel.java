package com.repo.scorecard.model;

/**
 * Coarse activity label derived from a contributor's commit count.
 */
public enum ActivityLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    VERY_HIGH("Very High");

    private final String label;

    ActivityLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ActivityLevel fromCommits(int commits) {
        if (commits >= 50) {
            return VERY_HIGH;
        } else if (commits >= 30) {
            return HIGH;
        } else if (commits >= 10) {
            return MEDIUM;
        }
        return LOW;
    }
}
