package com.davisodom.settlementsim.settlements;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SettlementServiceTest {

    private SimulationFixture fx;
    private UUID owner;

    @BeforeEach
    void setUp() {
        fx = SimulationFixture.create();
        owner = UUID.randomUUID();
    }

    @Test
    @DisplayName("A founding population above base capacity is cut down to it")
    void testFoundingPopulationClampedToCapacity() {
        SettlementContext context = fx.settlement(owner, 50, SimulationFixture.plenty());

        assertEquals(10, fx.settlements.populationCapacity(context.getSettlement()));
        assertEquals(10, context.getSettlement().getPopulation().getCount());
        assertEquals(500.0, fx.ledger.getBalances(context.getSettlement().getId()).getUnits(ResourceType.FOOD), 1e-9);
    }

    @Test
    void testFoundingPopulationWithinCapacityKept() {
        SettlementContext context = fx.settlement(owner, 7, ResourceAmounts.ZERO);

        assertEquals(7, context.getSettlement().getPopulation().getCount());
    }

    @Test
    @DisplayName("Housing adds capacity per level; destroyed houses add none")
    void testPopulationCapacityFromHousing() {
        SettlementContext context = fx.settlement(owner, 10, ResourceAmounts.ZERO);
        Settlement settlement = context.getSettlement();
        fx.addBuilding(context, "house", 2);
        Structure ruined = fx.addBuilding(context, "house", 1);
        ruined.applyDamage(Structure.MAX_HEALTH);

        assertEquals(20, fx.settlements.populationCapacity(settlement));
    }

    @Test
    @DisplayName("Removing a house at full occupancy evicts the overflow")
    void testClampAfterLosingHousing() {
        SettlementContext context = fx.settlement(owner, 10, ResourceAmounts.ZERO);
        Settlement settlement = context.getSettlement();
        Structure house = fx.addBuilding(context, "house", 1);
        settlement.getPopulation().setCount(15, fx.settlements.populationCapacity(settlement));
        context.consumeStaffingDirty();

        settlement.removeStructure(house.getId());
        int evicted = fx.settlements.clampPopulation(context);

        assertEquals(5, evicted);
        assertEquals(10, settlement.getPopulation().getCount());
        assertTrue(context.consumeStaffingDirty());
        assertEquals(0, fx.settlements.clampPopulation(context));
    }

    @Test
    void testRequireUnknownSettlement() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> fx.settlements.require(UUID.randomUUID()));

        assertEquals(ErrorCode.SETTLEMENT_NOT_FOUND, e.getCode());
    }

    @Test
    void testRequireOwnerRejectsOthers() {
        SettlementContext context = fx.settlement(owner, 5, ResourceAmounts.ZERO);

        assertDoesNotThrow(() -> fx.settlements.requireOwner(context, owner));
        SimulationException e = assertThrows(SimulationException.class,
                () -> fx.settlements.requireOwner(context, UUID.randomUUID()));
        assertEquals(ErrorCode.NOT_OWNER, e.getCode());
    }
}
