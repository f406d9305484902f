package com.purchasingpower.testgen.service.context;

/**
 * Coarse ranking derived from a dependency's numeric score.
 */
public enum ImportanceLevel {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private static final double CRITICAL_THRESHOLD = 3.0;
    private static final double HIGH_THRESHOLD = 1.5;
    private static final double MEDIUM_THRESHOLD = 0.5;

    private final int rank;

    ImportanceLevel(int rank) {
        this.rank = rank;
    }

    public static ImportanceLevel fromScore(double score) {
        if (score >= CRITICAL_THRESHOLD) {
            return CRITICAL;
        }
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    public boolean isAtLeast(ImportanceLevel other) {
        return rank >= other.rank;
    }
}
