package com.rerag.search;

public record SearchPolicy(int initialMultiplier, double growthFactor, int maxAttempts) {
    public static final int DEFAULT_INITIAL_MULTIPLIER = 2;
    public static final double DEFAULT_GROWTH_FACTOR = 2.0;
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    public SearchPolicy {
        if (initialMultiplier < 1) {
            throw new IllegalArgumentException("initialMultiplier must be >= 1, got " + initialMultiplier);
        }
        if (!(growthFactor > 1.0) || Double.isInfinite(growthFactor)) {
            throw new IllegalArgumentException("growthFactor must be a finite value > 1, got " + growthFactor);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
    }

    public static SearchPolicy defaults() {
        return new SearchPolicy(DEFAULT_INITIAL_MULTIPLIER, DEFAULT_GROWTH_FACTOR, DEFAULT_MAX_ATTEMPTS);
    }

    int nextMultiplier(int multiplier) {
        double grown = multiplier * growthFactor;
        if (grown >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return Math.max(multiplier + 1, (int) grown);
    }
}
