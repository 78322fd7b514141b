package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.settlements.Settlement;

import java.util.*;

/**
 * A disaster affecting one world, from scheduling to resolution.
 *
 * Phase start timestamps are recorded as the event advances; the next transition is due a
 * phase duration after the current phase started. Mutated only by the {@link DisasterCoordinator}.
 */
public class DisasterEvent {

    private final UUID id;
    private final String worldName;
    private final DisasterType type;
    private final double severity;
    private final Set<String> affectedBiomes;
    private final Set<String> affectedRegions;
    private final long scheduledAt;
    private final long warningMillis;
    private final long impactMillis;
    private final long aftermathMillis;
    private final long seed;

    private DisasterStatus status = DisasterStatus.SCHEDULED;
    private long warningStartedAt;
    private long impactStartedAt;
    private long aftermathStartedAt;
    private long resolvedAt;
    private boolean imminentNotified;
    private int roundsApplied;
    private int totalRounds;
    private final Set<UUID> affectedSettlements = new LinkedHashSet<>();
    private final Map<UUID, Double> netDamage = new HashMap<>();
    private final Map<UUID, Double> pendingCasualties = new LinkedHashMap<>();
    private final Set<UUID> damagedStructures = new LinkedHashSet<>();
    private final Set<UUID> destroyedStructures = new LinkedHashSet<>();
    private double totalDamage;
    private int casualties;
    private ResourceAmounts estimatedRepairCost = ResourceAmounts.ZERO;
    private long repairWindowEndsAt;

    private DisasterEvent(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id cannot be null");
        this.worldName = Objects.requireNonNull(b.worldName, "worldName cannot be null");
        this.type = Objects.requireNonNull(b.type, "type cannot be null");
        this.severity = b.severity;
        this.affectedBiomes = Collections.unmodifiableSet(new LinkedHashSet<>(b.affectedBiomes));
        this.affectedRegions = Collections.unmodifiableSet(new LinkedHashSet<>(b.affectedRegions));
        this.scheduledAt = b.scheduledAt;
        this.warningMillis = b.warningMillis;
        this.impactMillis = b.impactMillis;
        this.aftermathMillis = b.aftermathMillis;
        this.seed = b.seed;

        if (severity < 0 || severity > 100) {
            throw new IllegalArgumentException("severity must be within 0-100: " + severity);
        }
        if (warningMillis < 0 || impactMillis < 0 || aftermathMillis < 0) {
            throw new IllegalArgumentException("Phase durations cannot be negative");
        }
    }

    public UUID getId() { return id; }
    public String getWorldName() { return worldName; }
    public DisasterType getType() { return type; }
    public double getSeverity() { return severity; }
    public Set<String> getAffectedBiomes() { return affectedBiomes; }
    public Set<String> getAffectedRegions() { return affectedRegions; }
    public long getScheduledAt() { return scheduledAt; }
    public long getWarningMillis() { return warningMillis; }
    public long getImpactMillis() { return impactMillis; }
    public long getAftermathMillis() { return aftermathMillis; }
    public long getSeed() { return seed; }
    public DisasterStatus getStatus() { return status; }
    public long getWarningStartedAt() { return warningStartedAt; }
    public long getImpactStartedAt() { return impactStartedAt; }
    public long getAftermathStartedAt() { return aftermathStartedAt; }
    public long getResolvedAt() { return resolvedAt; }
    public boolean isImminentNotified() { return imminentNotified; }
    public int getRoundsApplied() { return roundsApplied; }
    public int getTotalRounds() { return totalRounds; }
    public double getTotalDamage() { return totalDamage; }
    public int getCasualties() { return casualties; }
    public ResourceAmounts getEstimatedRepairCost() { return estimatedRepairCost; }
    public long getRepairWindowEndsAt() { return repairWindowEndsAt; }

    public SeverityTier getTier() {
        return SeverityTier.fromSeverity(severity);
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    /**
     * Whether the settlement lies in an affected biome or region. No filters means the whole world.
     */
    public boolean covers(Settlement settlement) {
        if (!settlement.getWorldName().equals(worldName)) {
            return false;
        }
        if (affectedBiomes.isEmpty() && affectedRegions.isEmpty()) {
            return true;
        }
        String biome = settlement.getTile().biome();
        String region = settlement.getTile().region();
        return (biome != null && affectedBiomes.contains(biome.toUpperCase(Locale.ROOT)))
                || (region != null && affectedRegions.contains(region));
    }

    /**
     * When the current phase ends, or {@code Long.MAX_VALUE} once resolved.
     */
    public long nextTransitionAt() {
        switch (status) {
            case SCHEDULED: return scheduledAt;
            case WARNING: return warningStartedAt + warningMillis;
            case IMPACT: return impactStartedAt + impactMillis;
            case AFTERMATH: return aftermathStartedAt + aftermathMillis;
            default: return Long.MAX_VALUE;
        }
    }

    public long impactAt() {
        return status.ordinal() > DisasterStatus.WARNING.ordinal()
                ? impactStartedAt
                : (status == DisasterStatus.WARNING ? warningStartedAt : scheduledAt) + warningMillis;
    }

    public Set<UUID> getAffectedSettlements() {
        return Collections.unmodifiableSet(affectedSettlements);
    }

    public Set<UUID> getDamagedStructures() {
        return Collections.unmodifiableSet(damagedStructures);
    }

    public Set<UUID> getDestroyedStructures() {
        return Collections.unmodifiableSet(destroyedStructures);
    }

    public Map<UUID, Double> getPendingCasualties() {
        return Collections.unmodifiableMap(pendingCasualties);
    }

    public double netDamageFor(UUID settlementId) {
        return netDamage.getOrDefault(settlementId, 0.0);
    }

    void transitionTo(DisasterStatus next, long at) {
        if (status.isTerminal() || next != status.next()) {
            throw new IllegalStateException(String.format("Illegal disaster transition %s -> %s", status, next));
        }
        status = next;
        switch (next) {
            case WARNING: warningStartedAt = at; break;
            case IMPACT: impactStartedAt = at; break;
            case AFTERMATH: aftermathStartedAt = at; break;
            case RESOLVED: resolvedAt = at; break;
            default: break;
        }
    }

    void markImminentNotified() {
        imminentNotified = true;
    }

    void beginImpact(Map<UUID, Double> damageBySettlement, int rounds) {
        affectedSettlements.clear();
        affectedSettlements.addAll(damageBySettlement.keySet());
        netDamage.clear();
        netDamage.putAll(damageBySettlement);
        totalRounds = rounds;
    }

    void recordRound() {
        roundsApplied++;
    }

    void recordDamage(UUID structureId, double amount, boolean destroyed) {
        totalDamage += amount;
        damagedStructures.add(structureId);
        if (destroyed) {
            destroyedStructures.add(structureId);
        }
    }

    void addPendingCasualties(UUID settlementId, double amount) {
        pendingCasualties.merge(settlementId, amount, Double::sum);
    }

    void recordCasualties(int applied) {
        casualties += applied;
    }

    void clearTransientState() {
        pendingCasualties.clear();
        netDamage.clear();
    }

    void setEstimatedRepairCost(ResourceAmounts cost) {
        this.estimatedRepairCost = cost;
    }

    void setRepairWindowEndsAt(long repairWindowEndsAt) {
        this.repairWindowEndsAt = repairWindowEndsAt;
    }

    /**
     * Restore lifecycle state from persisted fields.
     */
    public void restoreState(DisasterStatus status, long warningStartedAt, long impactStartedAt,
                             long aftermathStartedAt, long resolvedAt, boolean imminentNotified,
                             int roundsApplied, int totalRounds, Map<UUID, Double> netDamage,
                             Map<UUID, Double> pendingCasualties, Collection<UUID> damaged,
                             Collection<UUID> destroyed, double totalDamage, int casualties,
                             ResourceAmounts estimatedRepairCost, long repairWindowEndsAt) {
        this.status = status;
        this.warningStartedAt = warningStartedAt;
        this.impactStartedAt = impactStartedAt;
        this.aftermathStartedAt = aftermathStartedAt;
        this.resolvedAt = resolvedAt;
        this.imminentNotified = imminentNotified;
        this.roundsApplied = roundsApplied;
        this.totalRounds = totalRounds;
        this.affectedSettlements.clear();
        this.affectedSettlements.addAll(netDamage.keySet());
        this.netDamage.clear();
        this.netDamage.putAll(netDamage);
        this.pendingCasualties.clear();
        this.pendingCasualties.putAll(pendingCasualties);
        this.damagedStructures.clear();
        this.damagedStructures.addAll(damaged);
        this.destroyedStructures.clear();
        this.destroyedStructures.addAll(destroyed);
        this.totalDamage = totalDamage;
        this.casualties = casualties;
        this.estimatedRepairCost = estimatedRepairCost;
        this.repairWindowEndsAt = repairWindowEndsAt;
    }

    @Override
    public String toString() {
        return String.format("DisasterEvent{id=%s, world=%s, type=%s, severity=%.1f, status=%s}",
                id, worldName, type, severity, status);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private String worldName;
        private DisasterType type;
        private double severity;
        private Set<String> affectedBiomes = new LinkedHashSet<>();
        private Set<String> affectedRegions = new LinkedHashSet<>();
        private long scheduledAt;
        private long warningMillis;
        private long impactMillis;
        private long aftermathMillis;
        private long seed = new Random().nextLong();

        public Builder id(UUID id) { this.id = id; return this; }
        public Builder worldName(String worldName) { this.worldName = worldName; return this; }
        public Builder type(DisasterType type) { this.type = type; return this; }
        public Builder severity(double severity) { this.severity = severity; return this; }
        public Builder affectedBiomes(Collection<String> biomes) {
            this.affectedBiomes = new LinkedHashSet<>();
            biomes.forEach(b -> this.affectedBiomes.add(b.toUpperCase(Locale.ROOT)));
            return this;
        }
        public Builder affectedRegions(Collection<String> regions) { this.affectedRegions = new LinkedHashSet<>(regions); return this; }
        public Builder scheduledAt(long scheduledAt) { this.scheduledAt = scheduledAt; return this; }
        public Builder warningMillis(long warningMillis) { this.warningMillis = warningMillis; return this; }
        public Builder impactMillis(long impactMillis) { this.impactMillis = impactMillis; return this; }
        public Builder aftermathMillis(long aftermathMillis) { this.aftermathMillis = aftermathMillis; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }

        public DisasterEvent build() {
            return new DisasterEvent(this);
        }
    }
}
