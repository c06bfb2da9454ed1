package com.repo.scorecard.core;

/**
 * Incremental mean update.
 * {@code mean' = (mean * (n - 1) + value) / n} where {@code n = previousCount + 1}.
 */
public final class RunningAverage {

    private RunningAverage() {
    }

    /**
     * @param previousMean  mean over the first {@code previousCount} samples
     * @param previousCount samples already folded in, never negative
     * @param newValue      the sample being added
     * @return the mean over {@code previousCount + 1} samples
     */
    public static double update(double previousMean, int previousCount, double newValue) {
        if (previousCount < 0) {
            throw new IllegalArgumentException("Sample count cannot be negative: " + previousCount);
        }
        int count = previousCount + 1;
        return (previousMean * previousCount + newValue) / count;
    }
}
