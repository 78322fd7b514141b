package com.davisodom.settlementsim.core;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.construction.ConstructionRequest;
import com.davisodom.settlementsim.construction.ConstructionService;
import com.davisodom.settlementsim.construction.SettlementAreaValidator;
import com.davisodom.settlementsim.disasters.DisasterCoordinator;
import com.davisodom.settlementsim.disasters.DisasterDamageCalculator;
import com.davisodom.settlementsim.disasters.DisasterEvent;
import com.davisodom.settlementsim.disasters.DisasterType;
import com.davisodom.settlementsim.disasters.PassiveRepairService;
import com.davisodom.settlementsim.disasters.RepairCostCalculator;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.economy.TransferService;
import com.davisodom.settlementsim.events.EventDispatcher;
import com.davisodom.settlementsim.events.EventPublisher;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.obs.Metrics;
import com.davisodom.settlementsim.persistence.SettlementRepository;
import com.davisodom.settlementsim.population.HappinessCalculator;
import com.davisodom.settlementsim.population.PopulationEngine;
import com.davisodom.settlementsim.population.StaffingAssigner;
import com.davisodom.settlementsim.production.ProductionCalculator;
import com.davisodom.settlementsim.production.ProductionService;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.Structure;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.davisodom.settlementsim.SimulationFixture.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TickOrchestratorTest {

    private SimulationFixture fx;
    private Metrics metrics;
    private EventPublisher publisher;
    private EventDispatcher dispatcher;
    private ExecutorService workers;
    private ConstructionService construction;
    private ProductionService production;
    private PopulationEngine population;
    private DisasterCoordinator disasters;
    private TransferService transfers;

    @BeforeEach
    void setUp() {
        fx = SimulationFixture.create();
        metrics = new Metrics(fx.logger);
        publisher = mock(EventPublisher.class);
        dispatcher = new EventDispatcher(fx.logger, publisher, metrics);
        workers = Executors.newFixedThreadPool(2);
        construction = new ConstructionService(fx.logger, fx.catalog, fx.ledger,
                new SettlementAreaValidator(fx.catalog, fx.config.construction), fx.settlements, fx.config.construction);
        production = new ProductionService(fx.catalog, fx.ledger, new ProductionCalculator(fx.config.production), fx.config);
        population = new PopulationEngine(fx.logger, fx.config.population, fx.stats,
                new HappinessCalculator(fx.config.population, fx.stats), fx.ledger, new Random(1));
        disasters = new DisasterCoordinator(fx.logger, fx.settlements, fx.catalog,
                new DisasterDamageCalculator(fx.catalog, fx.stats, fx.config.disasters), new RepairCostCalculator(),
                population, fx.config.disasters);
        production.setModifierSource(disasters);
        transfers = new TransferService(fx.logger, fx.settlements, fx.ledger, fx.config.transfers,
                world -> disasters.activeDisaster(world).isPresent());
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        dispatcher.shutdown();
    }

    private TickOrchestrator orchestrator(ConstructionService constructionService, SettlementRepository repository) {
        return new TickOrchestrator(fx.logger, fx.settlements, fx.ledger, constructionService, production, population,
                new StaffingAssigner(fx.catalog), new PassiveRepairService(fx.logger, fx.stats, disasters, fx.config.disasters),
                transfers, disasters, repository, dispatcher, metrics, workers);
    }

    private static List<EventType> types(List<SimulationEvent> events) {
        return events.stream().map(SimulationEvent::type).collect(Collectors.toList());
    }

    @Test
    @DisplayName("A second tick at the same instant changes nothing")
    void testZeroElapsedTickIsIdempotent() {
        TickOrchestrator orchestrator = orchestrator(construction, null);
        SettlementContext context = fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());
        UUID id = context.getSettlement().getId();

        List<SimulationEvent> first = orchestrator.runTick(T0 + 5_000);
        ResourceAmounts after = fx.ledger.getBalances(id);
        List<SimulationEvent> second = orchestrator.runTick(T0 + 5_000);

        assertTrue(types(first).contains(EventType.RESOURCES_UPDATED));
        assertTrue(types(first).contains(EventType.STAFFING_UPDATED));
        assertTrue(second.isEmpty());
        assertEquals(after, fx.ledger.getBalances(id));
    }

    @Test
    @DisplayName("A structure finished this tick counts toward this tick's production")
    void testCompletedStructureContributesThisTick() {
        TickOrchestrator orchestrator = orchestrator(construction, null);
        SettlementContext context = fx.settlement(UUID.randomUUID(), 0,
                ResourceAmounts.ofUnits(Map.of(ResourceType.FOOD, 990, ResourceType.WOOD, 900, ResourceType.STONE, 900)));
        UUID id = context.getSettlement().getId();
        construction.submit(context, ConstructionRequest.building(id, "warehouse"), T0);

        List<SimulationEvent> events = orchestrator.runTick(T0 + 300_000);

        List<EventType> types = types(events);
        assertTrue(types.indexOf(EventType.STRUCTURE_BUILT) < types.indexOf(EventType.RESOURCES_UPDATED));
        // 990 + 300 ticks x 0.12 would overflow the old 1000 cap
        assertEquals(1026.0, fx.ledger.getBalances(id).getUnits(ResourceType.FOOD), 0.01);
    }

    @Test
    @DisplayName("A settlement with a workshop mends damaged structures hourly during the tick")
    void testPassiveRepairRunsInTick() {
        TickOrchestrator orchestrator = orchestrator(construction, null);
        SettlementContext context = fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());
        fx.addBuilding(context, "workshop", 1);
        Structure house = fx.addBuilding(context, "house", 1);
        house.applyDamage(40);

        List<SimulationEvent> events = orchestrator.runTick(T0 + 3_600_000L);

        List<EventType> types = types(events);
        assertTrue(types.indexOf(EventType.RESOURCES_UPDATED) < types.indexOf(EventType.PASSIVE_REPAIR_APPLIED));
        assertEquals(61.0, house.getHealth(), 1e-9);
    }

    @Test
    void testFailingSettlementDoesNotAffectOthers() {
        SettlementContext bad = fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());
        SettlementContext good = fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());
        ConstructionService failing = mock(ConstructionService.class);
        when(failing.advance(any(), anyLong())).thenAnswer(invocation -> {
            SettlementContext target = invocation.getArgument(0);
            if (target == bad) {
                throw new IllegalStateException("boom");
            }
            return List.of();
        });

        List<SimulationEvent> events = orchestrator(failing, null).runTick(T0 + 5_000);

        String goodId = good.getSettlement().getId().toString();
        String badId = bad.getSettlement().getId().toString();
        assertTrue(events.stream().anyMatch(e -> e.scopeId().equals(goodId)));
        assertTrue(events.stream().noneMatch(e -> e.scopeId().equals(badId)));
        assertEquals(1, metrics.getCounter("tick.settlement_failed"));
        assertEquals(T0, bad.getSettlement().getLastCollectedAt());
    }

    @Test
    void testTransfersAndDisastersRunAfterSettlements() {
        TickOrchestrator orchestrator = orchestrator(construction, null);
        SettlementContext from = fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());
        SettlementContext to = fx.settlement(UUID.randomUUID(), SimulationFixture.grassland(0, 10), 10, ResourceAmounts.ZERO);
        transfers.initiate(from, to.getSettlement().getId(), ResourceType.ORE, 100, T0);
        disasters.schedule(DisasterEvent.builder()
                .worldName("overworld").type(DisasterType.DROUGHT).severity(20)
                .scheduledAt(T0).warningMillis(86_400_000L).impactMillis(3_600_000L).aftermathMillis(3_600_000L)
                .build());

        List<SimulationEvent> events = orchestrator.runTick(T0 + 60_000);

        List<EventType> types = types(events);
        assertTrue(types.indexOf(EventType.RESOURCES_UPDATED) < types.indexOf(EventType.TRANSFER_COMPLETED));
        assertTrue(types.indexOf(EventType.TRANSFER_COMPLETED) < types.indexOf(EventType.DISASTER_WARNING));
        assertTrue(fx.ledger.getBalances(to.getSettlement().getId()).getUnits(ResourceType.ORE) > 0);
    }

    @Test
    void testChangedSettlementsAreSavedAndEventsPublished() throws Exception {
        SettlementRepository repository = mock(SettlementRepository.class);
        TickOrchestrator orchestrator = orchestrator(construction, repository);
        SettlementContext context = fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());

        orchestrator.runTick(T0 + 5_000);

        verify(repository).saveSettlement(eq(context.getSettlement()), any());
        verify(repository, never()).saveDisasters(anyCollection());
        verify(publisher, timeout(2_000).atLeastOnce()).publish(any());
        assertEquals(1, metrics.getCounter("tick.completed"));
    }

    @Test
    void testSaveFailureIsCountedNotThrown() throws Exception {
        SettlementRepository repository = mock(SettlementRepository.class);
        doThrow(new IOException("disk full")).when(repository).saveSettlement(any(), any());
        fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());

        assertDoesNotThrow(() -> orchestrator(construction, repository).runTick(T0 + 5_000));
        assertEquals(1, metrics.getCounter("persistence.save_failed"));
    }
}
