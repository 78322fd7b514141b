package com.davisodom.settlementsim.economy;

import java.util.Objects;
import java.util.UUID;

/**
 * A shipment of one resource between two settlements.
 * Immutable; the sender is debited when the transfer is created.
 */
public final class ResourceTransfer {

    public enum Status {
        IN_TRANSIT,
        COMPLETED
    }

    private final UUID id;
    private final UUID fromSettlementId;
    private final UUID toSettlementId;
    private final ResourceType resource;
    private final long sentUnits;
    private final long receivedUnits;
    private final double lossPercent;
    private final int distance;
    private final long startedAt;
    private final long arrivesAt;
    private final Status status;

    public ResourceTransfer(UUID id, UUID fromSettlementId, UUID toSettlementId, ResourceType resource,
                            long sentUnits, long receivedUnits, double lossPercent, int distance,
                            long startedAt, long arrivesAt, Status status) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.fromSettlementId = Objects.requireNonNull(fromSettlementId, "fromSettlementId cannot be null");
        this.toSettlementId = Objects.requireNonNull(toSettlementId, "toSettlementId cannot be null");
        this.resource = Objects.requireNonNull(resource, "resource cannot be null");
        this.sentUnits = sentUnits;
        this.receivedUnits = receivedUnits;
        this.lossPercent = lossPercent;
        this.distance = distance;
        this.startedAt = startedAt;
        this.arrivesAt = arrivesAt;
        this.status = Objects.requireNonNull(status, "status cannot be null");
        if (receivedUnits > sentUnits || receivedUnits < 0) {
            throw new IllegalArgumentException(String.format("received %d must be within 0-%d", receivedUnits, sentUnits));
        }
    }

    public UUID getId() { return id; }
    public UUID getFromSettlementId() { return fromSettlementId; }
    public UUID getToSettlementId() { return toSettlementId; }
    public ResourceType getResource() { return resource; }
    public long getSentUnits() { return sentUnits; }
    public long getReceivedUnits() { return receivedUnits; }
    public double getLossPercent() { return lossPercent; }
    public int getDistance() { return distance; }
    public long getStartedAt() { return startedAt; }
    public long getArrivesAt() { return arrivesAt; }
    public Status getStatus() { return status; }

    public boolean isDue(long now) {
        return status == Status.IN_TRANSIT && arrivesAt <= now;
    }

    public ResourceTransfer asCompleted() {
        return new ResourceTransfer(id, fromSettlementId, toSettlementId, resource, sentUnits, receivedUnits,
                lossPercent, distance, startedAt, arrivesAt, Status.COMPLETED);
    }

    @Override
    public String toString() {
        return String.format("ResourceTransfer{id=%s, %s -> %s, %d %s (receives %d), status=%s}",
                id, fromSettlementId, toSettlementId, sentUnits, resource.id(), receivedUnits, status);
    }
}
