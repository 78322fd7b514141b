package com.davisodom.settlementsim.settlements;

import com.davisodom.settlementsim.construction.ConstructionQueue;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A player-owned settlement: structures, population, research and construction queue.
 *
 * Resource balances are not held here; the {@code ResourceLedger} owns them by settlement id.
 * Mutated only while holding the lock of the enclosing {@link SettlementContext}.
 */
public class Settlement {

    private final UUID id;
    private final UUID ownerId;
    private final String name;
    private final String worldName;
    private final Tile tile;
    private final long createdAt;
    private final Map<UUID, Structure> structures = new LinkedHashMap<>();
    private final Set<String> research = new LinkedHashSet<>();
    private final ConstructionQueue queue = new ConstructionQueue();
    private final Map<UUID, Double> staffingMultipliers = new HashMap<>();
    private final Map<UUID, Integer> understaffed = new LinkedHashMap<>();
    private final PopulationRecord population;
    private int tier;
    private long lastCollectedAt;
    private long lastPassiveRepairAt;
    private double resilience;
    private long lastDisasterAt;
    private double lastDisasterSeverity;

    public Settlement(UUID id, UUID ownerId, String name, String worldName, Tile tile,
                      int tier, int population, long createdAt) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.worldName = Objects.requireNonNull(worldName, "worldName cannot be null");
        this.tile = Objects.requireNonNull(tile, "tile cannot be null");
        this.tier = Math.max(1, tier);
        this.createdAt = createdAt;
        this.lastCollectedAt = createdAt;
        this.lastPassiveRepairAt = createdAt;
        this.population = new PopulationRecord(id, population, 50.0, createdAt);
    }

    public UUID getId() { return id; }
    public UUID getOwnerId() { return ownerId; }
    public String getName() { return name; }
    public String getWorldName() { return worldName; }
    public Tile getTile() { return tile; }
    public long getCreatedAt() { return createdAt; }
    public PopulationRecord getPopulation() { return population; }
    public ConstructionQueue getQueue() { return queue; }
    public int getTier() { return tier; }
    public long getLastCollectedAt() { return lastCollectedAt; }
    public long getLastPassiveRepairAt() { return lastPassiveRepairAt; }
    public double getResilience() { return resilience; }
    public long getLastDisasterAt() { return lastDisasterAt; }
    public double getLastDisasterSeverity() { return lastDisasterSeverity; }

    public void setTier(int tier) { this.tier = Math.max(1, tier); }
    public void setLastCollectedAt(long lastCollectedAt) { this.lastCollectedAt = lastCollectedAt; }
    public void setLastPassiveRepairAt(long lastPassiveRepairAt) { this.lastPassiveRepairAt = lastPassiveRepairAt; }
    public void setResilience(double resilience) { this.resilience = Math.max(0, resilience); }

    public void recordDisaster(long at, double severity) {
        this.lastDisasterAt = at;
        this.lastDisasterSeverity = severity;
    }

    public boolean isOwnedBy(UUID playerId) {
        return ownerId.equals(playerId);
    }

    public List<Structure> getStructures() {
        return new ArrayList<>(structures.values());
    }

    /**
     * Structures that are not destroyed.
     */
    public List<Structure> getActiveStructures() {
        return structures.values().stream().filter(s -> !s.isDestroyed()).collect(Collectors.toList());
    }

    public Optional<Structure> findStructure(UUID structureId) {
        return Optional.ofNullable(structures.get(structureId));
    }

    public void addStructure(Structure structure) {
        if (!structure.getSettlementId().equals(id)) {
            throw new IllegalArgumentException("Structure " + structure.getId() + " belongs to another settlement");
        }
        structures.put(structure.getId(), structure);
    }

    /**
     * Remove a structure outright (demolition).
     */
    public Optional<Structure> removeStructure(UUID structureId) {
        staffingMultipliers.remove(structureId);
        understaffed.remove(structureId);
        return Optional.ofNullable(structures.remove(structureId));
    }

    /**
     * Highest level among active instances of a definition, 0 if none.
     */
    public int highestLevelOf(String definitionId) {
        return structures.values().stream()
                .filter(s -> !s.isDestroyed() && s.getDefinitionId().equals(definitionId))
                .mapToInt(Structure::getLevel)
                .max()
                .orElse(0);
    }

    public boolean isSlotOccupied(UUID tileId, int slot) {
        return structures.values().stream().anyMatch(s -> s.occupies(tileId, slot));
    }

    public Set<String> getResearch() {
        return Collections.unmodifiableSet(research);
    }

    public void addResearch(String researchId) {
        research.add(researchId);
    }

    public double getStaffingMultiplier(UUID structureId) {
        return staffingMultipliers.getOrDefault(structureId, 1.0);
    }

    public Map<UUID, Integer> getUnderstaffed() {
        return Collections.unmodifiableMap(understaffed);
    }

    public void applyStaffing(Map<UUID, Double> multipliers, Map<UUID, Integer> deficits) {
        staffingMultipliers.clear();
        staffingMultipliers.putAll(multipliers);
        understaffed.clear();
        understaffed.putAll(deficits);
    }

    /**
     * Replace structures and research wholesale (persistence load and rollback).
     */
    public void restoreStructures(Collection<Structure> restored, Collection<String> restoredResearch) {
        structures.clear();
        restored.forEach(s -> structures.put(s.getId(), s));
        research.clear();
        research.addAll(restoredResearch);
    }

    @Override
    public String toString() {
        return String.format("Settlement{id=%s, name=%s, world=%s, structures=%d, population=%d}",
                id, name, worldName, structures.size(), population.getCount());
    }
}
