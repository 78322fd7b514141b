package com.davisodom.settlementsim.construction;

import com.davisodom.settlementsim.economy.ResourceAmounts;

import java.util.Objects;
import java.util.UUID;

/**
 * A build or upgrade request in a settlement's construction queue.
 * Immutable; state changes produce a new instance.
 */
public class ConstructionQueueItem {

    /**
     * Item lifecycle. QUEUED may go to IN_PROGRESS or CANCELLED; IN_PROGRESS only to COMPLETE.
     */
    public enum Status {
        QUEUED,       // Waiting for an active slot
        IN_PROGRESS,  // Building; completes at completesAt
        COMPLETE,     // Materialized into a structure
        CANCELLED     // Refunded and removed
    }

    private final UUID id;
    private final UUID settlementId;
    private final String definitionId;
    private final UUID existingStructureId;
    private final int targetLevel;
    private final ResourceAmounts deductedResources;
    private final Status status;
    private final int position;
    private final long durationMillis;
    private final long createdAt;
    private final long startedAt;
    private final long completesAt;
    private final UUID tileId;
    private final Integer slotPosition;
    private final boolean emergency;

    private ConstructionQueueItem(UUID id, UUID settlementId, String definitionId, UUID existingStructureId,
                                  int targetLevel, ResourceAmounts deductedResources, Status status, int position,
                                  long durationMillis, long createdAt, long startedAt, long completesAt,
                                  UUID tileId, Integer slotPosition, boolean emergency) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.settlementId = Objects.requireNonNull(settlementId, "settlementId cannot be null");
        this.definitionId = Objects.requireNonNull(definitionId, "definitionId cannot be null");
        this.existingStructureId = existingStructureId;
        this.targetLevel = targetLevel;
        this.deductedResources = Objects.requireNonNull(deductedResources, "deductedResources cannot be null");
        this.status = Objects.requireNonNull(status, "status cannot be null");
        this.position = position;
        this.durationMillis = durationMillis;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.completesAt = completesAt;
        this.tileId = tileId;
        this.slotPosition = slotPosition;
        this.emergency = emergency;

        if (targetLevel < 1) {
            throw new IllegalArgumentException("targetLevel must be at least 1: " + targetLevel);
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        if (durationMillis < 0) {
            throw new IllegalArgumentException("durationMillis must be non-negative: " + durationMillis);
        }
    }

    public UUID getId() { return id; }
    public UUID getSettlementId() { return settlementId; }
    public String getDefinitionId() { return definitionId; }
    public UUID getExistingStructureId() { return existingStructureId; }
    public int getTargetLevel() { return targetLevel; }
    public ResourceAmounts getDeductedResources() { return deductedResources; }
    public Status getStatus() { return status; }
    public int getPosition() { return position; }
    public long getDurationMillis() { return durationMillis; }
    public long getCreatedAt() { return createdAt; }
    public long getStartedAt() { return startedAt; }
    public long getCompletesAt() { return completesAt; }
    public UUID getTileId() { return tileId; }
    public Integer getSlotPosition() { return slotPosition; }
    public boolean isEmergency() { return emergency; }

    public boolean isUpgrade() {
        return existingStructureId != null;
    }

    public boolean isTerminal() {
        return status == Status.COMPLETE || status == Status.CANCELLED;
    }

    public boolean isActive() {
        return status == Status.IN_PROGRESS;
    }

    public boolean isDue(long now) {
        return status == Status.IN_PROGRESS && completesAt <= now;
    }

    public boolean reserves(UUID tile, int slot) {
        return !isTerminal() && !isUpgrade() && tileId != null && tileId.equals(tile)
                && slotPosition != null && slotPosition == slot;
    }

    /**
     * Start building now.
     */
    public ConstructionQueueItem start(long now) {
        if (status != Status.QUEUED) {
            throw new IllegalStateException("Only QUEUED items can start, was " + status);
        }
        return copy(Status.IN_PROGRESS, position, now, now + durationMillis);
    }

    public ConstructionQueueItem complete() {
        if (status != Status.IN_PROGRESS) {
            throw new IllegalStateException("Only IN_PROGRESS items can complete, was " + status);
        }
        return copy(Status.COMPLETE, position, startedAt, completesAt);
    }

    public ConstructionQueueItem asCancelled() {
        if (status != Status.QUEUED) {
            throw new IllegalStateException("Only QUEUED items can be cancelled, was " + status);
        }
        return copy(Status.CANCELLED, position, startedAt, completesAt);
    }

    public ConstructionQueueItem withPosition(int newPosition) {
        return newPosition == position ? this : copy(status, newPosition, startedAt, completesAt);
    }

    private ConstructionQueueItem copy(Status newStatus, int newPosition, long newStartedAt, long newCompletesAt) {
        return new ConstructionQueueItem(id, settlementId, definitionId, existingStructureId, targetLevel,
                deductedResources, newStatus, newPosition, durationMillis, createdAt, newStartedAt, newCompletesAt,
                tileId, slotPosition, emergency);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstructionQueueItem)) return false;
        return id.equals(((ConstructionQueueItem) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("ConstructionQueueItem{id=%s, def=%s, level=%d, status=%s, position=%d}",
                id, definitionId, targetLevel, status, position);
    }

    public static ConstructionQueueItemBuilder builder() {
        return new ConstructionQueueItemBuilder();
    }

    public static class ConstructionQueueItemBuilder {
        private UUID id = UUID.randomUUID();
        private UUID settlementId;
        private String definitionId;
        private UUID existingStructureId;
        private int targetLevel = 1;
        private ResourceAmounts deductedResources = ResourceAmounts.ZERO;
        private Status status = Status.QUEUED;
        private int position;
        private long durationMillis;
        private long createdAt = System.currentTimeMillis();
        private long startedAt;
        private long completesAt;
        private UUID tileId;
        private Integer slotPosition;
        private boolean emergency;

        public ConstructionQueueItemBuilder id(UUID id) { this.id = id; return this; }
        public ConstructionQueueItemBuilder settlementId(UUID settlementId) { this.settlementId = settlementId; return this; }
        public ConstructionQueueItemBuilder definitionId(String definitionId) { this.definitionId = definitionId; return this; }
        public ConstructionQueueItemBuilder existingStructureId(UUID existingStructureId) { this.existingStructureId = existingStructureId; return this; }
        public ConstructionQueueItemBuilder targetLevel(int targetLevel) { this.targetLevel = targetLevel; return this; }
        public ConstructionQueueItemBuilder deductedResources(ResourceAmounts deductedResources) { this.deductedResources = deductedResources; return this; }
        public ConstructionQueueItemBuilder status(Status status) { this.status = status; return this; }
        public ConstructionQueueItemBuilder position(int position) { this.position = position; return this; }
        public ConstructionQueueItemBuilder durationMillis(long durationMillis) { this.durationMillis = durationMillis; return this; }
        public ConstructionQueueItemBuilder createdAt(long createdAt) { this.createdAt = createdAt; return this; }
        public ConstructionQueueItemBuilder startedAt(long startedAt) { this.startedAt = startedAt; return this; }
        public ConstructionQueueItemBuilder completesAt(long completesAt) { this.completesAt = completesAt; return this; }
        public ConstructionQueueItemBuilder tileId(UUID tileId) { this.tileId = tileId; return this; }
        public ConstructionQueueItemBuilder slotPosition(Integer slotPosition) { this.slotPosition = slotPosition; return this; }
        public ConstructionQueueItemBuilder emergency(boolean emergency) { this.emergency = emergency; return this; }

        public ConstructionQueueItem build() {
            return new ConstructionQueueItem(id, settlementId, definitionId, existingStructureId, targetLevel,
                    deductedResources, status, position, durationMillis, createdAt, startedAt, completesAt,
                    tileId, slotPosition, emergency);
        }
    }
}
