package com.davisodom.settlementsim.production;

/**
 * Extractor tier multiplier: a step-and-slope function of structure level.
 *
 * <pre>
 * levels  1-5 : 0.5 + (L - 1)  * 0.05
 * levels 6-10 : 1.0 + (L - 6)  * 0.08
 * levels 11+  : 1.6 + (L - 11) * 0.10
 * </pre>
 */
public final class TierMultiplier {

    public static final int TIER_2_START = 6;
    public static final int TIER_3_START = 11;

    private TierMultiplier() {}

    public static double forLevel(int level) {
        if (level < 1) {
            throw new IllegalArgumentException("level must be at least 1: " + level);
        }
        if (level < TIER_2_START) {
            return 0.5 + (level - 1) * 0.05;
        }
        if (level < TIER_3_START) {
            return 1.0 + (level - TIER_2_START) * 0.08;
        }
        return 1.6 + (level - TIER_3_START) * 0.10;
    }

    /**
     * Tier band (1, 2 or 3) of a level.
     */
    public static int tierOf(int level) {
        if (level < TIER_2_START) return 1;
        if (level < TIER_3_START) return 2;
        return 3;
    }
}
