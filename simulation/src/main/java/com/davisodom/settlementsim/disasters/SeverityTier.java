package com.davisodom.settlementsim.disasters;

/**
 * Severity bands; the resilience gain is awarded to affected settlements on resolution.
 */
public enum SeverityTier {
    MILD(30, 2),
    MODERATE(60, 5),
    MAJOR(85, 10),
    CATASTROPHIC(Double.MAX_VALUE, 15);

    private final double upperBound; // Exclusive
    private final double resilienceGain;

    SeverityTier(double upperBound, double resilienceGain) {
        this.upperBound = upperBound;
        this.resilienceGain = resilienceGain;
    }

    public double getResilienceGain() {
        return resilienceGain;
    }

    public static SeverityTier fromSeverity(double severity) {
        for (SeverityTier tier : values()) {
            if (severity < tier.upperBound) {
                return tier;
            }
        }
        return CATASTROPHIC;
    }
}
