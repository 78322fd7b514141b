package com.davisodom.settlementsim.commands;

import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.construction.ConstructionRequest;
import com.davisodom.settlementsim.construction.ConstructionService;
import com.davisodom.settlementsim.disasters.DisasterCoordinator;
import com.davisodom.settlementsim.economy.LedgerResult;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.economy.TransferService;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.events.EventDispatcher;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.obs.Metrics;
import com.davisodom.settlementsim.persistence.PersistenceMapper;
import com.davisodom.settlementsim.persistence.SettlementData;
import com.davisodom.settlementsim.persistence.SettlementRepository;
import com.davisodom.settlementsim.production.ProductionService;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementService;
import com.davisodom.settlementsim.settlements.Structure;

import java.io.IOException;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Player-facing commands.
 *
 * Each command runs under the target settlement's lock: ownership check, snapshot, mutation,
 * save. If the save fails the settlement and its balances are restored from the snapshot and the
 * command fails with PERSISTENCE_FAILED. Events are dispatched only after a successful save.
 */
public class CommandService {

    private final Logger logger;
    private final SettlementService settlementService;
    private final ResourceLedger ledger;
    private final StructureCatalog catalog;
    private final ConstructionService constructionService;
    private final ProductionService productionService;
    private final TransferService transferService;
    private final DisasterCoordinator disasterCoordinator;
    private final SettlementRepository repository;
    private final EventDispatcher dispatcher;
    private final Metrics metrics;

    /**
     * @param repository may be {@code null} when persistence is disabled
     */
    public CommandService(Logger logger, SettlementService settlementService, ResourceLedger ledger,
                          StructureCatalog catalog, ConstructionService constructionService,
                          ProductionService productionService, TransferService transferService,
                          DisasterCoordinator disasterCoordinator, SettlementRepository repository,
                          EventDispatcher dispatcher, Metrics metrics) {
        this.logger = logger;
        this.settlementService = settlementService;
        this.ledger = ledger;
        this.catalog = catalog;
        this.constructionService = constructionService;
        this.productionService = productionService;
        this.transferService = transferService;
        this.disasterCoordinator = disasterCoordinator;
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    public ConstructionService.SubmissionResult submitConstruction(UUID actorId, ConstructionRequest request, long now) {
        Objects.requireNonNull(request, "request cannot be null");
        if (request.settlementId() == null) {
            throw new SimulationException(ErrorCode.INVALID_REQUEST, "settlementId is required");
        }
        SettlementContext context = settlementService.require(request.settlementId());
        return execute("submit_construction", actorId, context,
                ctx -> constructionService.submit(ctx, request, now),
                ConstructionService.SubmissionResult::events, null);
    }

    public ConstructionService.CancellationResult cancelConstruction(UUID actorId, UUID itemId, long now) {
        SettlementContext context = settlementService.findByQueueItem(itemId)
                .orElseThrow(() -> SimulationException.notFound(ErrorCode.QUEUE_ITEM_NOT_FOUND, itemId));
        return execute("cancel_construction", actorId, context,
                ctx -> constructionService.cancel(ctx, itemId, now),
                ConstructionService.CancellationResult::events, null);
    }

    public ProductionService.CollectionResult collectResources(UUID actorId, UUID settlementId, long now) {
        SettlementContext context = settlementService.require(settlementId);
        return execute("collect_resources", actorId, context,
                ctx -> productionService.collect(ctx, now),
                ProductionService.CollectionResult::events, null);
    }

    public TransferService.TransferResult initiateTransfer(UUID actorId, UUID fromId, UUID toId,
                                                           ResourceType resource, long amount, long now) {
        SettlementContext context = settlementService.require(fromId);
        return execute("initiate_transfer", actorId, context,
                ctx -> transferService.initiate(ctx, toId, resource, amount, now),
                TransferService.TransferResult::events,
                result -> transferService.discard(result.transfer().getId()));
    }

    /**
     * Restore a damaged structure to full health, paying the repair cost.
     */
    public RepairResult repairStructure(UUID actorId, UUID settlementId, UUID structureId, long now) {
        SettlementContext context = settlementService.require(settlementId);
        return execute("repair_structure", actorId, context,
                ctx -> repair(ctx, structureId, now), RepairResult::events, null);
    }

    /**
     * Tear down a structure. Nothing is refunded; structures with a queued upgrade are refused.
     */
    public DemolitionResult demolishStructure(UUID actorId, UUID settlementId, UUID structureId, long now) {
        SettlementContext context = settlementService.require(settlementId);
        return execute("demolish_structure", actorId, context,
                ctx -> demolish(ctx, structureId, now), DemolitionResult::events, null);
    }

    private DemolitionResult demolish(SettlementContext context, UUID structureId, long now) {
        Settlement settlement = context.getSettlement();
        Structure structure = settlement.findStructure(structureId)
                .orElseThrow(() -> SimulationException.notFound(ErrorCode.STRUCTURE_NOT_FOUND, structureId));
        if (settlement.getQueue().pendingUpgrades(structureId) > 0) {
            throw new SimulationException(ErrorCode.UPGRADE_PENDING,
                    "Structure has a queued upgrade; cancel it first", Map.of("structureId", structureId.toString()));
        }
        settlement.removeStructure(structureId);
        settlementService.refreshStorageCapacity(context);
        context.markStaffingDirty();
        int evicted = settlementService.clampPopulation(context);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("structureId", structureId.toString());
        payload.put("definitionId", structure.getDefinitionId());
        payload.put("level", structure.getLevel());
        payload.put("wasDestroyed", structure.isDestroyed());
        payload.put("evicted", evicted);
        SimulationEvent event = SimulationEvent.settlement(EventType.STRUCTURE_DEMOLISHED, settlement.getId(), now, payload);
        return new DemolitionResult(structure, List.of(event));
    }

    private RepairResult repair(SettlementContext context, UUID structureId, long now) {
        Settlement settlement = context.getSettlement();
        Structure structure = settlement.findStructure(structureId)
                .orElseThrow(() -> SimulationException.notFound(ErrorCode.STRUCTURE_NOT_FOUND, structureId));
        if (structure.isDestroyed()) {
            throw new SimulationException(ErrorCode.STRUCTURE_DESTROYED,
                    "Destroyed structures cannot be repaired", Map.of("structureId", structureId.toString()));
        }
        if (structure.getHealth() >= Structure.MAX_HEALTH) {
            throw new SimulationException(ErrorCode.NOTHING_TO_REPAIR,
                    "Structure is at full health", Map.of("structureId", structureId.toString()));
        }
        StructureDefinition definition = catalog.findDefinition(structure.getDefinitionId())
                .orElseThrow(() -> new SimulationException(ErrorCode.UNKNOWN_STRUCTURE_TYPE,
                        "Unknown structure type: " + structure.getDefinitionId(),
                        Map.of("structureId", structure.getDefinitionId())));

        DisasterCoordinator.RepairQuote quote = disasterCoordinator.repairQuote(settlement, structure, definition, now);
        LedgerResult debit = ledger.debit(settlement.getId(), quote.cost(), "repair:" + structureId);
        if (!debit.isSuccess()) {
            throw debit.toException();
        }
        double previousHealth = structure.getHealth();
        structure.repair();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("structureId", structureId.toString());
        payload.put("definitionId", structure.getDefinitionId());
        payload.put("previousHealth", previousHealth);
        payload.put("cost", quote.cost().toUnitsMap());
        payload.put("discounted", quote.discounted());
        SimulationEvent event = SimulationEvent.settlement(EventType.STRUCTURE_REPAIRED, settlement.getId(), now, payload);
        return new RepairResult(structure, quote, List.of(event));
    }

    /**
     * @param transferUndo set for commands that start a transfer: in-transit transfers are saved
     *        with the settlement, and the hook drops the new transfer on rollback
     */
    private <T> T execute(String operation, UUID actorId, SettlementContext context,
                          Function<SettlementContext, T> action,
                          Function<T, List<SimulationEvent>> eventsOf,
                          Consumer<T> transferUndo) {
        String correlationId = metrics.newCorrelationId();
        T result;
        context.lock();
        try {
            settlementService.requireOwner(context, actorId);
            Settlement settlement = context.getSettlement();
            SettlementData snapshot = PersistenceMapper.toData(settlement, ledger.getBalances(settlement.getId()));

            result = action.apply(context);

            if (repository != null) {
                try {
                    repository.saveSettlement(settlement, ledger.getBalances(settlement.getId()));
                    if (transferUndo != null) {
                        repository.saveTransfers(transferService.getInTransit());
                    }
                } catch (IOException e) {
                    rollback(context, snapshot);
                    if (transferUndo != null) {
                        transferUndo.accept(result);
                    }
                    metrics.increment("commands.rolled_back");
                    logger.warning(String.format("[%s] %s on %s rolled back: %s", correlationId,
                            operation, settlement.getId(), e.getMessage()));
                    throw new SimulationException(ErrorCode.PERSISTENCE_FAILED,
                            "Failed to save settlement " + settlement.getId(),
                            Map.of("operation", operation, "settlementId", settlement.getId().toString()), e);
                }
            }
        } catch (SimulationException e) {
            metrics.increment("commands.rejected");
            logger.fine(String.format("[%s] %s rejected: %s", correlationId, operation, e));
            throw e;
        } finally {
            context.unlock();
        }

        metrics.increment("commands." + operation);
        dispatcher.dispatch(eventsOf.apply(result));
        return result;
    }

    private void rollback(SettlementContext context, SettlementData snapshot) {
        Settlement settlement = context.getSettlement();
        PersistenceMapper.restoreInto(settlement, snapshot);
        ledger.restore(settlement.getId(), PersistenceMapper.balancesOf(snapshot));
        settlementService.refreshStorageCapacity(context);
        context.markStaffingDirty();
        settlementService.clampPopulation(context);
    }

    /**
     * Outcome of a repair.
     */
    public record RepairResult(Structure structure, DisasterCoordinator.RepairQuote quote,
                               List<SimulationEvent> events) {
    }

    public record DemolitionResult(Structure structure, List<SimulationEvent> events) {
    }
}
