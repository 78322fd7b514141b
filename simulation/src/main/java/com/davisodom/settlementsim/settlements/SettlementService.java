package com.davisodom.settlementsim.settlements;

import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Registry of settlement contexts.
 *
 * Responsibilities:
 * - Creating and registering settlements
 * - Lookup by id, world or queued construction item
 * - Ownership checks for commands
 * - Keeping the ledger's storage ceiling in line with storage structures
 */
public class SettlementService {

    private final Logger logger;
    private final StructureCatalog catalog;
    private final ResourceLedger ledger;
    private final SimulationConfig config;
    private final Map<UUID, SettlementContext> settlements = new ConcurrentHashMap<>();

    public SettlementService(Logger logger, StructureCatalog catalog, ResourceLedger ledger, SimulationConfig config) {
        this.logger = logger;
        this.catalog = catalog;
        this.ledger = ledger;
        this.config = config;
    }

    /**
     * Found a new settlement with starting population and resources. A starting population above
     * the base housing ceiling is cut down to it.
     */
    public SettlementContext createSettlement(UUID ownerId, String name, String worldName, Tile tile,
                                              int population, ResourceAmounts startingResources, long now) {
        Settlement settlement = new Settlement(UUID.randomUUID(), ownerId, name, worldName, tile, 1, population, now);
        SettlementContext context = register(settlement);
        refreshStorageCapacity(context);
        clampPopulation(context);
        ledger.credit(settlement.getId(), startingResources, "founding");
        logger.info(String.format("Created settlement %s (%s) for %s in %s", settlement.getId(), name, ownerId, worldName));
        return context;
    }

    /**
     * Register an existing settlement (persistence load).
     */
    public SettlementContext register(Settlement settlement) {
        SettlementContext context = new SettlementContext(settlement);
        SettlementContext existing = settlements.putIfAbsent(settlement.getId(), context);
        if (existing != null) {
            throw new IllegalArgumentException("Settlement already registered: " + settlement.getId());
        }
        return context;
    }

    public Optional<SettlementContext> get(UUID settlementId) {
        return Optional.ofNullable(settlements.get(settlementId));
    }

    /**
     * @throws SimulationException NOT_FOUND when no such settlement exists
     */
    public SettlementContext require(UUID settlementId) {
        SettlementContext context = settlements.get(settlementId);
        if (context == null) {
            throw SimulationException.notFound(ErrorCode.SETTLEMENT_NOT_FOUND, settlementId);
        }
        return context;
    }

    /**
     * @throws SimulationException CONFLICT when the actor does not own the settlement
     */
    public void requireOwner(SettlementContext context, UUID actorId) {
        Settlement settlement = context.getSettlement();
        if (!settlement.isOwnedBy(actorId)) {
            throw new SimulationException(ErrorCode.NOT_OWNER,
                    "Player " + actorId + " does not own settlement " + settlement.getId(),
                    Map.of("settlementId", settlement.getId().toString(), "actorId", String.valueOf(actorId)));
        }
    }

    /**
     * Find the settlement whose queue holds an item.
     */
    public Optional<SettlementContext> findByQueueItem(UUID itemId) {
        for (SettlementContext context : settlements.values()) {
            boolean found = context.withLock(() -> context.getSettlement().getQueue().find(itemId).isPresent());
            if (found) {
                return Optional.of(context);
            }
        }
        return Optional.empty();
    }

    /**
     * All settlements in a stable (id) order.
     */
    public List<SettlementContext> getAll() {
        return settlements.values().stream()
                .sorted(Comparator.comparing(c -> c.getSettlement().getId()))
                .collect(Collectors.toList());
    }

    public List<SettlementContext> getInWorld(String worldName) {
        return getAll().stream()
                .filter(c -> c.getSettlement().getWorldName().equals(worldName))
                .collect(Collectors.toList());
    }

    /**
     * Recompute the per-resource storage ceiling from storage structures. Caller holds the lock.
     */
    public ResourceAmounts refreshStorageCapacity(SettlementContext context) {
        Settlement settlement = context.getSettlement();
        long units = config.production.baseStorageCapacity;
        for (Structure structure : settlement.getActiveStructures()) {
            units += catalog.findDefinition(structure.getDefinitionId())
                    .map(StructureDefinition::getStorageCapacity)
                    .orElse(0) * (long) structure.getLevel();
        }
        ResourceAmounts.Builder capacity = ResourceAmounts.builder();
        for (ResourceType type : ResourceType.values()) {
            capacity.units(type, units);
        }
        ResourceAmounts result = capacity.build();
        ledger.setCapacity(settlement.getId(), result);
        return result;
    }

    /**
     * Base capacity plus the housing of active structures, scaled by level.
     */
    public int populationCapacity(Settlement settlement) {
        int capacity = config.population.baseCapacity;
        for (Structure structure : settlement.getActiveStructures()) {
            capacity += catalog.findDefinition(structure.getDefinitionId())
                    .map(StructureDefinition::getPopulationCapacity)
                    .orElse(0) * structure.getLevel();
        }
        return capacity;
    }

    /**
     * Cut the headcount down to the housing ceiling after capacity was lost. Caller holds the lock.
     *
     * @return people removed
     */
    public int clampPopulation(SettlementContext context) {
        Settlement settlement = context.getSettlement();
        PopulationRecord population = settlement.getPopulation();
        int before = population.getCount();
        int capacity = populationCapacity(settlement);
        if (before <= capacity) {
            return 0;
        }
        population.setCount(before, capacity);
        context.markStaffingDirty();
        logger.info(String.format("Settlement %s over housing capacity: %d -> %d",
                settlement.getId(), before, capacity));
        return before - capacity;
    }

    public int size() {
        return settlements.size();
    }
}
