package com.davisodom.settlementsim.production;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.settlements.SettlementContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static com.davisodom.settlementsim.SimulationFixture.T0;
import static org.junit.jupiter.api.Assertions.*;

class ProductionServiceTest {

    private SimulationFixture fx;
    private ProductionService service;
    private SettlementContext context;
    private UUID id;

    @BeforeEach
    void setUp() {
        fx = SimulationFixture.create();
        service = new ProductionService(fx.catalog, fx.ledger, new ProductionCalculator(fx.config.production), fx.config);
        context = fx.settlement(UUID.randomUUID(), 10,
                ResourceAmounts.ofUnits(Map.of(ResourceType.FOOD, 100, ResourceType.WATER, 100)));
        id = context.getSettlement().getId();
    }

    @Test
    void testElapsedTicksTruncates() {
        assertEquals(0, service.elapsedTicks(T0, T0 + 999));
        assertEquals(1, service.elapsedTicks(T0, T0 + 1999));
        assertEquals(0, service.elapsedTicks(T0, T0 - 5000));
    }

    @Test
    @DisplayName("No elapsed tick means no change and no event")
    void testZeroElapsedIsNoOp() {
        ProductionService.CollectionResult result = service.collect(context, T0 + 500);

        assertEquals(0, result.elapsedTicks());
        assertTrue(result.events().isEmpty());
        assertEquals(100.0, fx.ledger.getBalances(id).getUnits(ResourceType.FOOD), 1e-9);
        assertEquals(T0, context.getSettlement().getLastCollectedAt());
    }

    @Test
    void testCollectCreditsNetProduction() {
        ProductionService.CollectionResult result = service.collect(context, T0 + 100_000);

        assertEquals(100, result.elapsedTicks());
        // food: 0.12/tick produced, 10 people x 0.005 eaten
        assertEquals(107.0, fx.ledger.getBalances(id).getUnits(ResourceType.FOOD), 0.01);
        // water: 0.12/tick produced, 10 people x 0.01 drunk
        assertEquals(102.0, fx.ledger.getBalances(id).getUnits(ResourceType.WATER), 0.01);
        assertEquals(EventType.RESOURCES_UPDATED, result.events().get(0).type());
    }

    @Test
    @DisplayName("Partial ticks carry over to the next collection")
    void testFractionalTickCarriesOver() {
        service.collect(context, T0 + 1_500);
        assertEquals(T0 + 1_000, context.getSettlement().getLastCollectedAt());

        ProductionService.CollectionResult second = service.collect(context, T0 + 2_000);
        assertEquals(1, second.elapsedTicks());
    }

    @Test
    void testCreditClampedToStorage() {
        fx.ledger.restore(id, ResourceAmounts.of(ResourceType.FOOD, 999.9));

        service.collect(context, T0 + 100_000);

        assertEquals(1000.0, fx.ledger.getBalances(id).getUnits(ResourceType.FOOD), 1e-9);
    }

    @Test
    void testUpkeepFloorsAtZeroAndReportsUnmet() {
        fx.ledger.restore(id, ResourceAmounts.ZERO);
        fx.addBuilding(context, "house", 1);
        fx.addBuilding(context, "warehouse", 1);

        ProductionService.CollectionResult result = service.collect(context, T0 + 1_000_000);

        // wood is produced (quality 50) but stone upkeep also runs; no balance goes negative
        for (ResourceType type : ResourceType.values()) {
            assertTrue(fx.ledger.getBalances(id).getMillis(type) >= 0);
        }
        assertNotNull(result.unmet());
    }

    @Test
    void testExtractorRaisesOutputAtHigherLevels() {
        fx.addExtractor(context, "farm", 0, 11, T0);

        ProductionService.CollectionResult result = service.collect(context, T0 + 10_000);

        // level 11 tier multiplier 1.6 applied to base 0.12
        assertEquals(0.12 * 1.6 * 10, result.breakdown().productionOf(ResourceType.FOOD), 1e-6);
    }

    @Test
    void testModifierSourceApplies() {
        service.setModifierSource((settlement, now) -> Map.of(ResourceType.FOOD, 0.5));

        ProductionService.CollectionResult result = service.collect(context, T0 + 10_000);

        assertEquals(0.06 * 10, result.breakdown().productionOf(ResourceType.FOOD), 1e-6);
        assertEquals(0.12 * 10, result.breakdown().productionOf(ResourceType.WATER), 1e-6);
    }
}
