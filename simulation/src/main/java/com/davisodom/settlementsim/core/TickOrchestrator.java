package com.davisodom.settlementsim.core;

import com.davisodom.settlementsim.construction.ConstructionService;
import com.davisodom.settlementsim.disasters.DisasterCoordinator;
import com.davisodom.settlementsim.disasters.PassiveRepairService;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.economy.TransferService;
import com.davisodom.settlementsim.events.EventDispatcher;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.obs.Metrics;
import com.davisodom.settlementsim.persistence.SettlementRepository;
import com.davisodom.settlementsim.population.PopulationEngine;
import com.davisodom.settlementsim.population.StaffingAssigner;
import com.davisodom.settlementsim.production.ProductionService;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementService;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * One simulation tick.
 *
 * Order:
 * 1. Every settlement in parallel, each under its own lock: construction queue, then
 *    production and consumption, then population, then passive repair, then staffing when
 *    structures or headcount changed
 * 2. Arrived transfers
 * 3. Disaster phases and damage
 * 4. Save settlements that changed, then hand all events to the dispatcher
 *
 * A failure in one settlement is logged and does not affect the others.
 */
public class TickOrchestrator implements TickEngine.TickableSystem {

    private final Logger logger;
    private final SettlementService settlementService;
    private final ResourceLedger ledger;
    private final ConstructionService constructionService;
    private final ProductionService productionService;
    private final PopulationEngine populationEngine;
    private final StaffingAssigner staffingAssigner;
    private final PassiveRepairService passiveRepair;
    private final TransferService transferService;
    private final DisasterCoordinator disasterCoordinator;
    private final SettlementRepository repository;
    private final EventDispatcher dispatcher;
    private final Metrics metrics;
    private final ExecutorService workers;

    /**
     * @param repository may be {@code null} when persistence is disabled
     */
    public TickOrchestrator(Logger logger, SettlementService settlementService, ResourceLedger ledger,
                            ConstructionService constructionService, ProductionService productionService,
                            PopulationEngine populationEngine, StaffingAssigner staffingAssigner,
                            PassiveRepairService passiveRepair, TransferService transferService, DisasterCoordinator disasterCoordinator,
                            SettlementRepository repository, EventDispatcher dispatcher, Metrics metrics,
                            ExecutorService workers) {
        this.logger = logger;
        this.settlementService = settlementService;
        this.ledger = ledger;
        this.constructionService = constructionService;
        this.productionService = productionService;
        this.populationEngine = populationEngine;
        this.staffingAssigner = staffingAssigner;
        this.passiveRepair = passiveRepair;
        this.transferService = transferService;
        this.disasterCoordinator = disasterCoordinator;
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.workers = workers;
    }

    @Override
    public void tick(long tick, long now) {
        runTick(now);
    }

    /**
     * Run a full tick at simulation time {@code now}.
     *
     * @return every event produced, in processing order
     */
    public List<SimulationEvent> runTick(long now) {
        List<SimulationEvent> events = new ArrayList<>(processSettlements(now));

        try {
            events.addAll(transferService.completeDue(now));
        } catch (RuntimeException e) {
            metrics.increment("tick.transfers_failed");
            logger.severe("Transfer completion failed: " + e);
        }

        List<SimulationEvent> disasterEvents = List.of();
        try {
            disasterEvents = disasterCoordinator.step(now);
            events.addAll(disasterEvents);
        } catch (RuntimeException e) {
            metrics.increment("tick.disasters_failed");
            logger.severe("Disaster step failed: " + e);
        }

        persist(events, !disasterEvents.isEmpty());
        dispatcher.dispatch(events);
        metrics.increment("tick.completed");
        return events;
    }

    /**
     * Queue, production, population, passive repair and staffing for one settlement. Takes the settlement lock.
     */
    public List<SimulationEvent> processSettlement(SettlementContext context, long now) {
        return context.withLock(() -> {
            List<SimulationEvent> events = new ArrayList<>();
            events.addAll(constructionService.advance(context, now));
            events.addAll(productionService.collect(context, now).events());
            events.addAll(populationEngine.evaluate(context, now));
            events.addAll(passiveRepair.apply(context, now));
            if (context.consumeStaffingDirty()) {
                events.add(staffingEvent(context.getSettlement(), staffingAssigner.apply(context.getSettlement()), now));
            }
            return events;
        });
    }

    private List<SimulationEvent> processSettlements(long now) {
        List<SettlementContext> contexts = settlementService.getAll();
        List<Callable<List<SimulationEvent>>> tasks = new ArrayList<>();
        for (SettlementContext context : contexts) {
            tasks.add(() -> {
                long start = System.nanoTime();
                try {
                    return processSettlement(context, now);
                } finally {
                    metrics.recordSettlementTickTime(context.getSettlement().getId(), (System.nanoTime() - start) / 1000);
                }
            });
        }

        List<SimulationEvent> events = new ArrayList<>();
        List<Future<List<SimulationEvent>>> futures;
        try {
            futures = workers.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Interrupted while processing settlements");
            return events;
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                events.addAll(futures.get(i).get());
            } catch (ExecutionException e) {
                metrics.increment("tick.settlement_failed");
                logger.severe(String.format("Settlement %s failed this tick: %s",
                        contexts.get(i).getSettlement().getId(), e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return events;
            }
        }
        return events;
    }

    private void persist(List<SimulationEvent> events, boolean disastersChanged) {
        if (repository == null) {
            return;
        }
        Set<UUID> dirty = new LinkedHashSet<>();
        boolean transfersChanged = false;
        for (SimulationEvent event : events) {
            if (event.scope() == SimulationEvent.Scope.SETTLEMENT) {
                dirty.add(UUID.fromString(event.scopeId()));
            }
            transfersChanged |= event.type() == EventType.TRANSFER_COMPLETED;
        }
        for (UUID settlementId : dirty) {
            Optional<SettlementContext> context = settlementService.get(settlementId);
            if (context.isEmpty()) continue;
            context.get().lock();
            try {
                repository.saveSettlement(context.get().getSettlement(), ledger.getBalances(settlementId));
            } catch (IOException e) {
                metrics.increment("persistence.save_failed");
                logger.severe(String.format("Failed to save settlement %s: %s", settlementId, e.getMessage()));
            } finally {
                context.get().unlock();
            }
        }
        try {
            if (disastersChanged) {
                repository.saveDisasters(disasterCoordinator.getAll());
            }
            if (transfersChanged) {
                repository.saveTransfers(transferService.getInTransit());
            }
        } catch (IOException e) {
            metrics.increment("persistence.save_failed");
            logger.severe("Failed to save world state: " + e.getMessage());
        }
    }

    private static SimulationEvent staffingEvent(Settlement settlement, StaffingAssigner.StaffingResult result, long now) {
        Map<String, Object> payload = new LinkedHashMap<>();
        Map<String, Integer> assigned = new LinkedHashMap<>();
        result.assigned().forEach((id, workers) -> assigned.put(id.toString(), workers));
        Map<String, Integer> understaffed = new LinkedHashMap<>();
        result.understaffed().forEach((id, deficit) -> understaffed.put(id.toString(), deficit));
        payload.put("assigned", assigned);
        payload.put("understaffed", understaffed);
        payload.put("unassigned", result.unassigned());
        return SimulationEvent.settlement(EventType.STAFFING_UPDATED, settlement.getId(), now, payload);
    }
}
