package com.davisodom.settlementsim.settlements;

import com.davisodom.settlementsim.catalog.StructureCategory;

import java.util.Objects;
import java.util.UUID;

/**
 * A built structure instance.
 *
 * Mutable; callers must hold the owning settlement's lock. Health only goes down through
 * {@link #applyDamage(double)} and only goes up through {@link #repair()}.
 */
public class Structure {

    public static final double MAX_HEALTH = 100.0;

    private final UUID id;
    private final UUID settlementId;
    private final String definitionId;
    private final StructureCategory category;
    private final UUID tileId;
    private final Integer slotPosition;
    private final long createdAt;
    private int level;
    private double health;
    private int populationAssigned;
    private boolean destroyed;

    private Structure(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id cannot be null");
        this.settlementId = Objects.requireNonNull(b.settlementId, "settlementId cannot be null");
        this.definitionId = Objects.requireNonNull(b.definitionId, "definitionId cannot be null");
        this.category = Objects.requireNonNull(b.category, "category cannot be null");
        this.tileId = b.tileId;
        this.slotPosition = b.slotPosition;
        this.createdAt = b.createdAt;
        this.level = b.level;
        this.health = b.health;
        this.populationAssigned = b.populationAssigned;
        this.destroyed = b.destroyed;

        if (level < 1) {
            throw new IllegalArgumentException("level must be at least 1: " + level);
        }
        if (health < 0 || health > MAX_HEALTH) {
            throw new IllegalArgumentException("health must be within 0-100: " + health);
        }
        if (category == StructureCategory.EXTRACTOR && (tileId == null || slotPosition == null)) {
            throw new IllegalArgumentException("Extractor structures need a tile and slot");
        }
    }

    public UUID getId() { return id; }
    public UUID getSettlementId() { return settlementId; }
    public String getDefinitionId() { return definitionId; }
    public StructureCategory getCategory() { return category; }
    public UUID getTileId() { return tileId; }
    public Integer getSlotPosition() { return slotPosition; }
    public long getCreatedAt() { return createdAt; }
    public int getLevel() { return level; }
    public double getHealth() { return health; }
    public int getPopulationAssigned() { return populationAssigned; }
    public boolean isDestroyed() { return destroyed; }

    public boolean isExtractor() {
        return category == StructureCategory.EXTRACTOR;
    }

    public boolean occupies(UUID tile, int slot) {
        return !destroyed && tileId != null && tileId.equals(tile) && slotPosition != null && slotPosition == slot;
    }

    public void upgradeTo(int newLevel) {
        if (newLevel <= level) {
            throw new IllegalArgumentException(String.format("Upgrade must raise level: %d -> %d", level, newLevel));
        }
        this.level = newLevel;
    }

    /**
     * Reduce health, marking the structure destroyed at zero.
     *
     * @return health actually removed
     */
    public double applyDamage(double amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Damage cannot be negative: " + amount);
        }
        if (destroyed) {
            return 0;
        }
        double removed = Math.min(health, amount);
        health -= removed;
        if (health <= 0) {
            health = 0;
            destroyed = true;
            populationAssigned = 0;
        }
        return removed;
    }

    /**
     * Restore full health. Destroyed structures cannot be repaired.
     */
    public void repair() {
        if (destroyed) {
            throw new IllegalStateException("Cannot repair destroyed structure " + id);
        }
        this.health = MAX_HEALTH;
    }

    /**
     * Raise health by up to {@code amount}, never past {@link #MAX_HEALTH}.
     *
     * @return health actually restored
     */
    public double restoreHealth(double amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Restored health cannot be negative: " + amount);
        }
        if (destroyed) {
            throw new IllegalStateException("Cannot restore destroyed structure " + id);
        }
        double restored = Math.min(MAX_HEALTH - health, amount);
        health += restored;
        return restored;
    }

    public void setPopulationAssigned(int populationAssigned) {
        if (populationAssigned < 0) {
            throw new IllegalArgumentException("populationAssigned cannot be negative");
        }
        this.populationAssigned = populationAssigned;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Structure)) return false;
        return id.equals(((Structure) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Structure{id=%s, def=%s, level=%d, health=%.1f%s}",
                id, definitionId, level, health, destroyed ? ", destroyed" : "");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private UUID settlementId;
        private String definitionId;
        private StructureCategory category;
        private UUID tileId;
        private Integer slotPosition;
        private long createdAt = System.currentTimeMillis();
        private int level = 1;
        private double health = MAX_HEALTH;
        private int populationAssigned;
        private boolean destroyed;

        public Builder id(UUID id) { this.id = id; return this; }
        public Builder settlementId(UUID settlementId) { this.settlementId = settlementId; return this; }
        public Builder definitionId(String definitionId) { this.definitionId = definitionId; return this; }
        public Builder category(StructureCategory category) { this.category = category; return this; }
        public Builder tileId(UUID tileId) { this.tileId = tileId; return this; }
        public Builder slotPosition(Integer slotPosition) { this.slotPosition = slotPosition; return this; }
        public Builder createdAt(long createdAt) { this.createdAt = createdAt; return this; }
        public Builder level(int level) { this.level = level; return this; }
        public Builder health(double health) { this.health = health; return this; }
        public Builder populationAssigned(int populationAssigned) { this.populationAssigned = populationAssigned; return this; }
        public Builder destroyed(boolean destroyed) { this.destroyed = destroyed; return this; }

        public Structure build() {
            return new Structure(this);
        }
    }
}
