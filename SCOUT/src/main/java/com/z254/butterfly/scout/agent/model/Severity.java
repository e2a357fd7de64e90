package com.z254.butterfly.scout.agent.model;

/**
 * Severity of a finding, also used as a risk level. Ordered from least to most severe.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static Severity ofRank(int rank) {
        for (Severity severity : values()) {
            if (severity.rank == rank) {
                return severity;
            }
        }
        return rank > CRITICAL.rank ? CRITICAL : LOW;
    }
}
