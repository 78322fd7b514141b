package com.davisodom.settlementsim.construction;

import com.davisodom.settlementsim.DebugFlags;
import com.davisodom.settlementsim.catalog.Prerequisite;
import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.economy.LedgerResult;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementService;
import com.davisodom.settlementsim.settlements.Structure;

import java.util.*;
import java.util.logging.Logger;

/**
 * Submission, cancellation and advancement of settlement construction queues.
 *
 * Every method expects the caller to hold the settlement's lock. Submission validates
 * everything before the single fallible mutation (the ledger debit), so a rejected
 * submission leaves balances, queue and slot reservations untouched.
 */
public class ConstructionService {

    private final Logger logger;
    private final StructureCatalog catalog;
    private final ResourceLedger ledger;
    private final AreaValidator areaValidator;
    private final SettlementService settlementService;
    private final SimulationConfig.ConstructionSettings settings;

    public ConstructionService(Logger logger, StructureCatalog catalog, ResourceLedger ledger,
                               AreaValidator areaValidator, SettlementService settlementService,
                               SimulationConfig.ConstructionSettings settings) {
        this.logger = logger;
        this.catalog = catalog;
        this.ledger = ledger;
        this.areaValidator = areaValidator;
        this.settlementService = settlementService;
        this.settings = settings;
    }

    /**
     * Validate, debit and enqueue a build or upgrade.
     *
     * @throws SimulationException on any rejection; nothing is mutated in that case
     */
    public SubmissionResult submit(SettlementContext context, ConstructionRequest request, long now) {
        Settlement settlement = context.getSettlement();
        if (request.definitionId() == null || request.definitionId().isBlank()) {
            throw new SimulationException(ErrorCode.INVALID_REQUEST, "structureId is required");
        }
        StructureDefinition definition = catalog.findDefinition(request.definitionId())
                .orElseThrow(() -> new SimulationException(ErrorCode.UNKNOWN_STRUCTURE_TYPE,
                        "Unknown structure type: " + request.definitionId(),
                        Map.of("structureId", request.definitionId())));

        int targetLevel = 1;
        if (request.isUpgrade()) {
            targetLevel = validateUpgrade(settlement, definition, request.existingStructureId());
        }

        checkPrerequisites(settlement, definition);

        if (!request.isUpgrade()) {
            if (definition.isExtractor()) {
                checkSlot(settlement, request);
            } else {
                areaValidator.check(settlement, definition);
            }
        }

        ConstructionQueue queue = settlement.getQueue();
        if (queue.size() >= settings.maxItems) {
            throw new SimulationException(ErrorCode.QUEUE_FULL,
                    String.format("Construction queue is full (%d items)", settings.maxItems),
                    Map.of("maxItems", settings.maxItems, "queued", queue.size()));
        }

        ResourceAmounts cost = costFor(definition, targetLevel, request.emergency());
        LedgerResult debit = ledger.debit(settlement.getId(), cost, "construction:" + definition.getId());
        if (!debit.isSuccess()) {
            throw debit.toException();
        }

        boolean startNow = queue.activeCount() < settings.maxConcurrent;
        long duration = durationFor(definition, targetLevel, request.emergency());
        ConstructionQueueItem item = ConstructionQueueItem.builder()
                .settlementId(settlement.getId())
                .definitionId(definition.getId())
                .existingStructureId(request.existingStructureId())
                .targetLevel(targetLevel)
                .deductedResources(cost)
                .position(queue.size())
                .durationMillis(duration)
                .createdAt(now)
                .tileId(definition.isExtractor() && !request.isUpgrade() ? request.tileId() : null)
                .slotPosition(definition.isExtractor() && !request.isUpgrade() ? request.slotPosition() : null)
                .emergency(request.emergency())
                .build();
        if (startNow) {
            item = item.start(now);
        }
        queue.append(item);

        DebugFlags.debugConstruction(String.format("%s: submitted %s", settlement.getId(), item));
        EventType type = startNow ? EventType.CONSTRUCTION_STARTED : EventType.CONSTRUCTION_QUEUED;
        return new SubmissionResult(item, List.of(itemEvent(type, item, now)));
    }

    /**
     * Cancel a QUEUED item and refund its deducted resources in full.
     */
    public CancellationResult cancel(SettlementContext context, UUID itemId, long now) {
        Settlement settlement = context.getSettlement();
        ConstructionQueueItem item = settlement.getQueue().find(itemId)
                .orElseThrow(() -> SimulationException.notFound(ErrorCode.QUEUE_ITEM_NOT_FOUND, itemId));
        if (item.getStatus() != ConstructionQueueItem.Status.QUEUED) {
            throw new SimulationException(ErrorCode.ITEM_NOT_CANCELLABLE,
                    "Only queued items can be cancelled; item is " + item.getStatus(),
                    Map.of("itemId", itemId.toString(), "status", item.getStatus().name()));
        }

        settlement.getQueue().remove(itemId);
        ledger.refund(settlement.getId(), item.getDeductedResources(), "refund:" + item.getId());
        ConstructionQueueItem cancelled = item.asCancelled();

        Map<String, Object> payload = itemPayload(cancelled);
        payload.put("refunded", item.getDeductedResources().toUnitsMap());
        SimulationEvent event = SimulationEvent.settlement(EventType.CONSTRUCTION_CANCELLED,
                settlement.getId(), now, payload);
        return new CancellationResult(cancelled, item.getDeductedResources(), List.of(event));
    }

    /**
     * Complete due items and promote waiting ones.
     *
     * @return events for every completion and promotion, in order
     */
    public List<SimulationEvent> advance(SettlementContext context, long now) {
        Settlement settlement = context.getSettlement();
        ConstructionQueue queue = settlement.getQueue();
        List<SimulationEvent> events = new ArrayList<>();
        boolean progressed = true;

        while (progressed) {
            progressed = false;
            for (ConstructionQueueItem item : queue.due(now)) {
                queue.remove(item.getId());
                events.addAll(materialize(context, item.complete(), now));
                progressed = true;
            }
            List<ConstructionQueueItem> waiting = queue.waiting();
            for (int i = 0; i < waiting.size() && queue.activeCount() < settings.maxConcurrent; i++) {
                ConstructionQueueItem started = waiting.get(i).start(now);
                queue.replace(started);
                events.add(itemEvent(EventType.CONSTRUCTION_STARTED, started, now));
                progressed = true;
            }
        }
        return events;
    }

    /**
     * Resources a build or upgrade to {@code targetLevel} costs.
     */
    public ResourceAmounts costFor(StructureDefinition definition, int targetLevel, boolean emergency) {
        double factor = Math.pow(settings.upgradeCostScaling, targetLevel - 1);
        if (emergency) {
            factor *= settings.emergencyCostMultiplier;
        }
        return definition.getCosts().scale(factor);
    }

    public long durationFor(StructureDefinition definition, int targetLevel, boolean emergency) {
        double duration = definition.getConstructionMillis() * Math.pow(settings.upgradeTimeScaling, targetLevel - 1);
        if (emergency) {
            duration /= settings.emergencySpeedMultiplier;
        }
        return Math.round(duration);
    }

    private int validateUpgrade(Settlement settlement, StructureDefinition definition, UUID structureId) {
        Structure structure = settlement.findStructure(structureId)
                .orElseThrow(() -> SimulationException.notFound(ErrorCode.STRUCTURE_NOT_FOUND, structureId));
        if (!structure.getDefinitionId().equals(definition.getId())) {
            throw new SimulationException(ErrorCode.INVALID_REQUEST,
                    String.format("Structure %s is a %s, not a %s", structureId, structure.getDefinitionId(), definition.getId()));
        }
        if (structure.isDestroyed()) {
            throw new SimulationException(ErrorCode.STRUCTURE_DESTROYED,
                    "Destroyed structures cannot be upgraded", Map.of("structureId", structureId.toString()));
        }
        int targetLevel = structure.getLevel() + (int) settlement.getQueue().pendingUpgrades(structureId) + 1;
        if (targetLevel > definition.getMaxLevel()) {
            throw new SimulationException(ErrorCode.MAX_LEVEL_REACHED,
                    String.format("%s is already at (or queued to) its max level %d", definition.getName(), definition.getMaxLevel()),
                    Map.of("maxLevel", definition.getMaxLevel(), "targetLevel", targetLevel));
        }
        return targetLevel;
    }

    private void checkPrerequisites(Settlement settlement, StructureDefinition definition) {
        List<String> missing = new ArrayList<>();
        for (Prerequisite prerequisite : definition.getPrerequisites()) {
            boolean met = prerequisite.isResearch()
                    ? settlement.getResearch().contains(prerequisite.researchId())
                    : settlement.highestLevelOf(prerequisite.structureId()) >= prerequisite.minLevel();
            if (!met) {
                missing.add(prerequisite.describe());
            }
        }
        if (!missing.isEmpty()) {
            throw new SimulationException(ErrorCode.PREREQUISITES_NOT_MET,
                    definition.getName() + " is missing prerequisites: " + String.join(", ", missing),
                    Map.of("missing", missing));
        }
    }

    private void checkSlot(Settlement settlement, ConstructionRequest request) {
        if (request.tileId() == null || request.slotPosition() == null) {
            throw new SimulationException(ErrorCode.TILE_REQUIRED, "Extractors need a tile and slot position");
        }
        if (!settlement.getTile().id().equals(request.tileId())) {
            throw new SimulationException(ErrorCode.TILE_NOT_IN_SETTLEMENT,
                    "Tile " + request.tileId() + " is not part of settlement " + settlement.getId(),
                    Map.of("tileId", request.tileId().toString()));
        }
        int slot = request.slotPosition();
        int slotCount = settlement.getTile().slotCount();
        if (slot < 0 || slot >= slotCount) {
            throw new SimulationException(ErrorCode.SLOT_OUT_OF_RANGE,
                    String.format("Slot %d is outside 0-%d", slot, slotCount - 1),
                    Map.of("slotPosition", slot, "slotCount", slotCount));
        }
        Map<String, Object> details = Map.of("tileId", request.tileId().toString(), "slotPosition", slot);
        if (settlement.isSlotOccupied(request.tileId(), slot)) {
            throw new SimulationException(ErrorCode.SLOT_OCCUPIED, "Slot " + slot + " already has an extractor", details);
        }
        if (settlement.getQueue().isReserved(request.tileId(), slot)) {
            throw new SimulationException(ErrorCode.SLOT_RESERVED, "Slot " + slot + " is reserved by queued construction", details);
        }
    }

    private List<SimulationEvent> materialize(SettlementContext context, ConstructionQueueItem item, long now) {
        Settlement settlement = context.getSettlement();
        Optional<StructureDefinition> definition = catalog.findDefinition(item.getDefinitionId());
        if (definition.isEmpty()) {
            logger.severe(String.format("Completed item %s references unknown definition %s; refunded",
                    item.getId(), item.getDefinitionId()));
            return List.of(fail(settlement, item, "unknown_definition", now));
        }

        Map<String, Object> payload = itemPayload(item);
        EventType type;
        if (item.isUpgrade()) {
            Optional<Structure> existing = settlement.findStructure(item.getExistingStructureId())
                    .filter(s -> !s.isDestroyed());
            if (existing.isEmpty()) {
                logger.warning(String.format("Upgrade %s finished but structure %s is gone; refunded",
                        item.getId(), item.getExistingStructureId()));
                return List.of(fail(settlement, item, "target_lost", now));
            }
            Structure structure = existing.get();
            int from = structure.getLevel();
            if (item.getTargetLevel() > from) {
                structure.upgradeTo(item.getTargetLevel());
            }
            payload.put("structureId", structure.getId().toString());
            payload.put("fromLevel", from);
            type = EventType.STRUCTURE_UPGRADED;
        } else {
            Structure structure = Structure.builder()
                    .settlementId(settlement.getId())
                    .definitionId(item.getDefinitionId())
                    .category(definition.get().getCategory())
                    .tileId(item.getTileId())
                    .slotPosition(item.getSlotPosition())
                    .createdAt(item.getCompletesAt())
                    .build();
            settlement.addStructure(structure);
            payload.put("structureId", structure.getId().toString());
            type = EventType.STRUCTURE_BUILT;
        }

        context.markStaffingDirty();
        settlementService.refreshStorageCapacity(context);
        int townHallTier = Math.min(3, SettlementAreaValidator.townHallLevel(catalog, settlement));
        if (townHallTier > settlement.getTier()) {
            settlement.setTier(townHallTier);
        }
        logger.fine(String.format("Settlement %s: %s %s level %d", settlement.getId(),
                type == EventType.STRUCTURE_BUILT ? "built" : "upgraded", item.getDefinitionId(), item.getTargetLevel()));
        return List.of(SimulationEvent.settlement(type, settlement.getId(), now, payload));
    }

    /**
     * Refund a completed item that could not be applied.
     */
    private SimulationEvent fail(Settlement settlement, ConstructionQueueItem item, String reason, long now) {
        ledger.refund(settlement.getId(), item.getDeductedResources(), "refund:" + item.getId());
        Map<String, Object> payload = itemPayload(item);
        if (item.isUpgrade()) {
            payload.put("structureId", item.getExistingStructureId().toString());
        }
        payload.put("reason", reason);
        payload.put("refunded", item.getDeductedResources().toUnitsMap());
        return SimulationEvent.settlement(EventType.CONSTRUCTION_FAILED, settlement.getId(), now, payload);
    }

    private SimulationEvent itemEvent(EventType type, ConstructionQueueItem item, long now) {
        return SimulationEvent.settlement(type, item.getSettlementId(), now, itemPayload(item));
    }

    private static Map<String, Object> itemPayload(ConstructionQueueItem item) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("itemId", item.getId().toString());
        payload.put("structureType", item.getDefinitionId());
        payload.put("targetLevel", item.getTargetLevel());
        payload.put("status", item.getStatus().name());
        payload.put("position", item.getPosition());
        if (item.getStartedAt() > 0 || item.isActive()) {
            payload.put("startedAt", item.getStartedAt());
            payload.put("completesAt", item.getCompletesAt());
        }
        return payload;
    }

    /**
     * A queued item and the events its submission produced.
     */
    public record SubmissionResult(ConstructionQueueItem item, List<SimulationEvent> events) {
    }

    public record CancellationResult(ConstructionQueueItem item, ResourceAmounts refunded,
                                     List<SimulationEvent> events) {
    }
}
