package com.davisodom.settlementsim.persistence;

import com.davisodom.settlementsim.catalog.StructureCategory;
import com.davisodom.settlementsim.construction.ConstructionQueueItem;
import com.davisodom.settlementsim.disasters.DisasterEvent;
import com.davisodom.settlementsim.disasters.DisasterStatus;
import com.davisodom.settlementsim.disasters.DisasterType;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceTransfer;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.settlements.PopulationRecord;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.Structure;
import com.davisodom.settlementsim.settlements.Tile;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Converts between domain objects and their serialized form.
 *
 * {@link #restoreInto(Settlement, SettlementData)} overwrites a live settlement in place, which is
 * how a failed command rolls back to its pre-command snapshot.
 */
public final class PersistenceMapper {

    private PersistenceMapper() {
    }

    public static SettlementData toData(Settlement settlement, ResourceAmounts balances) {
        SettlementData data = new SettlementData();
        data.id = settlement.getId().toString();
        data.ownerId = settlement.getOwnerId().toString();
        data.name = settlement.getName();
        data.worldName = settlement.getWorldName();
        data.tile = toData(settlement.getTile());
        data.tier = settlement.getTier();
        data.createdAt = settlement.getCreatedAt();
        data.lastCollectedAt = settlement.getLastCollectedAt();
        data.lastPassiveRepairAt = settlement.getLastPassiveRepairAt();
        data.resilience = settlement.getResilience();
        data.lastDisasterAt = settlement.getLastDisasterAt();
        data.lastDisasterSeverity = settlement.getLastDisasterSeverity();

        PopulationRecord population = settlement.getPopulation();
        data.population = new SettlementData.PopulationData();
        data.population.count = population.getCount();
        data.population.happiness = population.getHappiness();
        data.population.lastGrowthAt = population.getLastGrowthAt();
        data.population.lowHappinessStreak = population.getLowHappinessStreak();

        data.balances = toMillisMap(balances);
        data.research = new ArrayList<>(settlement.getResearch());
        data.structures = settlement.getStructures().stream().map(PersistenceMapper::toData).collect(Collectors.toList());
        data.queue = settlement.getQueue().getItems().stream().map(PersistenceMapper::toData).collect(Collectors.toList());
        return data;
    }

    /**
     * Build a new settlement from its serialized form.
     */
    public static Settlement fromData(SettlementData data) {
        Settlement settlement = new Settlement(UUID.fromString(data.id), UUID.fromString(data.ownerId), data.name,
                data.worldName, fromData(data.tile), data.tier, 0, data.createdAt);
        restoreInto(settlement, data);
        return settlement;
    }

    /**
     * Overwrite the mutable state of a settlement with the serialized values.
     */
    public static void restoreInto(Settlement settlement, SettlementData data) {
        if (!settlement.getId().toString().equals(data.id)) {
            throw new IllegalArgumentException("Snapshot " + data.id + " does not belong to " + settlement.getId());
        }
        settlement.setTier(data.tier);
        settlement.setLastCollectedAt(data.lastCollectedAt);
        // files written before passive repair existed carry 0
        settlement.setLastPassiveRepairAt(data.lastPassiveRepairAt > 0 ? data.lastPassiveRepairAt : data.lastCollectedAt);
        settlement.setResilience(data.resilience);
        settlement.recordDisaster(data.lastDisasterAt, data.lastDisasterSeverity);
        if (data.population != null) {
            settlement.getPopulation().restore(data.population.count, data.population.happiness,
                    data.population.lastGrowthAt, data.population.lowHappinessStreak);
        }
        UUID settlementId = settlement.getId();
        settlement.restoreStructures(
                data.structures.stream().map(s -> fromData(settlementId, s)).collect(Collectors.toList()),
                data.research);
        settlement.getQueue().restore(
                data.queue.stream().map(q -> fromData(settlementId, q)).collect(Collectors.toList()));
    }

    public static ResourceAmounts balancesOf(SettlementData data) {
        return fromMillisMap(data.balances);
    }

    public static DisasterData toData(DisasterEvent event) {
        DisasterData data = new DisasterData();
        data.id = event.getId().toString();
        data.worldName = event.getWorldName();
        data.type = event.getType().name();
        data.severity = event.getSeverity();
        data.affectedBiomes = new ArrayList<>(event.getAffectedBiomes());
        data.affectedRegions = new ArrayList<>(event.getAffectedRegions());
        data.scheduledAt = event.getScheduledAt();
        data.warningMillis = event.getWarningMillis();
        data.impactMillis = event.getImpactMillis();
        data.aftermathMillis = event.getAftermathMillis();
        data.seed = event.getSeed();
        data.status = event.getStatus().name();
        data.warningStartedAt = event.getWarningStartedAt();
        data.impactStartedAt = event.getImpactStartedAt();
        data.aftermathStartedAt = event.getAftermathStartedAt();
        data.resolvedAt = event.getResolvedAt();
        data.imminentNotified = event.isImminentNotified();
        data.roundsApplied = event.getRoundsApplied();
        data.totalRounds = event.getTotalRounds();
        for (UUID settlementId : event.getAffectedSettlements()) {
            data.netDamage.put(settlementId.toString(), event.netDamageFor(settlementId));
        }
        event.getPendingCasualties().forEach((id, amount) -> data.pendingCasualties.put(id.toString(), amount));
        data.damagedStructures = event.getDamagedStructures().stream().map(UUID::toString).collect(Collectors.toList());
        data.destroyedStructures = event.getDestroyedStructures().stream().map(UUID::toString).collect(Collectors.toList());
        data.totalDamage = event.getTotalDamage();
        data.casualties = event.getCasualties();
        data.estimatedRepairCost = toMillisMap(event.getEstimatedRepairCost());
        data.repairWindowEndsAt = event.getRepairWindowEndsAt();
        return data;
    }

    public static DisasterEvent fromData(DisasterData data) {
        DisasterEvent event = DisasterEvent.builder()
                .id(UUID.fromString(data.id))
                .worldName(data.worldName)
                .type(DisasterType.valueOf(data.type))
                .severity(data.severity)
                .affectedBiomes(data.affectedBiomes)
                .affectedRegions(data.affectedRegions)
                .scheduledAt(data.scheduledAt)
                .warningMillis(data.warningMillis)
                .impactMillis(data.impactMillis)
                .aftermathMillis(data.aftermathMillis)
                .seed(data.seed)
                .build();
        event.restoreState(DisasterStatus.valueOf(data.status), data.warningStartedAt, data.impactStartedAt,
                data.aftermathStartedAt, data.resolvedAt, data.imminentNotified, data.roundsApplied,
                data.totalRounds, uuidKeys(data.netDamage), uuidKeys(data.pendingCasualties),
                uuids(data.damagedStructures), uuids(data.destroyedStructures), data.totalDamage,
                data.casualties, fromMillisMap(data.estimatedRepairCost), data.repairWindowEndsAt);
        return event;
    }

    public static TransferData toData(ResourceTransfer transfer) {
        TransferData data = new TransferData();
        data.id = transfer.getId().toString();
        data.fromSettlementId = transfer.getFromSettlementId().toString();
        data.toSettlementId = transfer.getToSettlementId().toString();
        data.resource = transfer.getResource().id();
        data.sentUnits = transfer.getSentUnits();
        data.receivedUnits = transfer.getReceivedUnits();
        data.lossPercent = transfer.getLossPercent();
        data.distance = transfer.getDistance();
        data.startedAt = transfer.getStartedAt();
        data.arrivesAt = transfer.getArrivesAt();
        data.status = transfer.getStatus().name();
        return data;
    }

    public static ResourceTransfer fromData(TransferData data) {
        return new ResourceTransfer(UUID.fromString(data.id), UUID.fromString(data.fromSettlementId),
                UUID.fromString(data.toSettlementId), ResourceType.fromId(data.resource), data.sentUnits,
                data.receivedUnits, data.lossPercent, data.distance, data.startedAt, data.arrivesAt,
                ResourceTransfer.Status.valueOf(data.status));
    }

    private static SettlementData.TileData toData(Tile tile) {
        SettlementData.TileData data = new SettlementData.TileData();
        data.id = tile.id().toString();
        data.biome = tile.biome();
        data.region = tile.region();
        data.x = tile.x();
        data.y = tile.y();
        tile.quality().forEach((type, value) -> data.quality.put(type.id(), value));
        data.baseProductionModifier = tile.baseProductionModifier();
        data.slotCount = tile.slotCount();
        return data;
    }

    private static Tile fromData(SettlementData.TileData data) {
        Map<ResourceType, Integer> quality = new EnumMap<>(ResourceType.class);
        data.quality.forEach((id, value) -> quality.put(ResourceType.fromId(id), value));
        return new Tile(UUID.fromString(data.id), data.biome, data.region, data.x, data.y, quality,
                data.baseProductionModifier, data.slotCount);
    }

    private static SettlementData.StructureData toData(Structure structure) {
        SettlementData.StructureData data = new SettlementData.StructureData();
        data.id = structure.getId().toString();
        data.definitionId = structure.getDefinitionId();
        data.category = structure.getCategory().name();
        data.tileId = structure.getTileId() != null ? structure.getTileId().toString() : null;
        data.slotPosition = structure.getSlotPosition();
        data.createdAt = structure.getCreatedAt();
        data.level = structure.getLevel();
        data.health = structure.getHealth();
        data.populationAssigned = structure.getPopulationAssigned();
        data.destroyed = structure.isDestroyed();
        return data;
    }

    private static Structure fromData(UUID settlementId, SettlementData.StructureData data) {
        return Structure.builder()
                .id(UUID.fromString(data.id))
                .settlementId(settlementId)
                .definitionId(data.definitionId)
                .category(StructureCategory.valueOf(data.category))
                .tileId(data.tileId != null ? UUID.fromString(data.tileId) : null)
                .slotPosition(data.slotPosition)
                .createdAt(data.createdAt)
                .level(data.level)
                .health(data.health)
                .populationAssigned(data.populationAssigned)
                .destroyed(data.destroyed)
                .build();
    }

    private static SettlementData.QueueItemData toData(ConstructionQueueItem item) {
        SettlementData.QueueItemData data = new SettlementData.QueueItemData();
        data.id = item.getId().toString();
        data.definitionId = item.getDefinitionId();
        data.existingStructureId = item.getExistingStructureId() != null ? item.getExistingStructureId().toString() : null;
        data.targetLevel = item.getTargetLevel();
        data.deductedResources = toMillisMap(item.getDeductedResources());
        data.status = item.getStatus().name();
        data.position = item.getPosition();
        data.durationMillis = item.getDurationMillis();
        data.createdAt = item.getCreatedAt();
        data.startedAt = item.getStartedAt();
        data.completesAt = item.getCompletesAt();
        data.tileId = item.getTileId() != null ? item.getTileId().toString() : null;
        data.slotPosition = item.getSlotPosition();
        data.emergency = item.isEmergency();
        return data;
    }

    private static ConstructionQueueItem fromData(UUID settlementId, SettlementData.QueueItemData data) {
        return ConstructionQueueItem.builder()
                .id(UUID.fromString(data.id))
                .settlementId(settlementId)
                .definitionId(data.definitionId)
                .existingStructureId(data.existingStructureId != null ? UUID.fromString(data.existingStructureId) : null)
                .targetLevel(data.targetLevel)
                .deductedResources(fromMillisMap(data.deductedResources))
                .status(ConstructionQueueItem.Status.valueOf(data.status))
                .position(data.position)
                .durationMillis(data.durationMillis)
                .createdAt(data.createdAt)
                .startedAt(data.startedAt)
                .completesAt(data.completesAt)
                .tileId(data.tileId != null ? UUID.fromString(data.tileId) : null)
                .slotPosition(data.slotPosition)
                .emergency(data.emergency)
                .build();
    }

    private static Map<String, Long> toMillisMap(ResourceAmounts amounts) {
        Map<String, Long> map = new LinkedHashMap<>();
        amounts.asMillisMap().forEach((type, value) -> map.put(type.id(), value));
        return map;
    }

    private static ResourceAmounts fromMillisMap(Map<String, Long> map) {
        Map<ResourceType, Long> millis = new EnumMap<>(ResourceType.class);
        if (map != null) {
            map.forEach((id, value) -> millis.put(ResourceType.fromId(id), value));
        }
        return ResourceAmounts.ofMillis(millis);
    }

    private static <V> Map<UUID, V> uuidKeys(Map<String, V> map) {
        Map<UUID, V> result = new LinkedHashMap<>();
        map.forEach((id, value) -> result.put(UUID.fromString(id), value));
        return result;
    }

    private static List<UUID> uuids(List<String> ids) {
        return ids.stream().map(UUID::fromString).collect(Collectors.toList());
    }
}
