package com.davisodom.settlementsim.settlements;

import java.util.UUID;

/**
 * Headcount and happiness of a settlement. Mutated under the settlement lock.
 */
public class PopulationRecord {

    private final UUID settlementId;
    private int count;
    private double happiness;
    private long lastGrowthAt;
    private int lowHappinessStreak;

    public PopulationRecord(UUID settlementId, int count, double happiness, long lastGrowthAt) {
        this.settlementId = settlementId;
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
        this.count = count;
        this.happiness = clampHappiness(happiness);
        this.lastGrowthAt = lastGrowthAt;
    }

    public UUID getSettlementId() { return settlementId; }
    public int getCount() { return count; }
    public double getHappiness() { return happiness; }
    public long getLastGrowthAt() { return lastGrowthAt; }
    public int getLowHappinessStreak() { return lowHappinessStreak; }

    /**
     * Set the headcount, clamped to {@code [0, capacity]}.
     *
     * @return the stored count
     */
    public int setCount(int newCount, int capacity) {
        this.count = Math.max(0, Math.min(newCount, capacity));
        return count;
    }

    /**
     * Remove people, never going below zero.
     *
     * @return number actually removed
     */
    public int remove(int people) {
        if (people < 0) {
            throw new IllegalArgumentException("Cannot remove a negative number of people: " + people);
        }
        int removed = Math.min(count, people);
        count -= removed;
        return removed;
    }

    public void setHappiness(double happiness) {
        this.happiness = clampHappiness(happiness);
    }

    public void setLastGrowthAt(long lastGrowthAt) {
        this.lastGrowthAt = lastGrowthAt;
    }

    public void setLowHappinessStreak(int lowHappinessStreak) {
        this.lowHappinessStreak = Math.max(0, lowHappinessStreak);
    }

    /**
     * Overwrite every field (persistence load and command rollback).
     */
    public void restore(int count, double happiness, long lastGrowthAt, int lowHappinessStreak) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
        this.count = count;
        this.happiness = clampHappiness(happiness);
        this.lastGrowthAt = lastGrowthAt;
        this.lowHappinessStreak = Math.max(0, lowHappinessStreak);
    }

    private static double clampHappiness(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    @Override
    public String toString() {
        return String.format("PopulationRecord{settlement=%s, count=%d, happiness=%.1f}", settlementId, count, happiness);
    }
}
