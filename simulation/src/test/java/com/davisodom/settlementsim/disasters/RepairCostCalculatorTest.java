package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.catalog.StructureCategory;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.settlements.Structure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RepairCostCalculatorTest {

    private final RepairCostCalculator calculator = new RepairCostCalculator();
    private StructureDefinition house;

    @BeforeEach
    void setUp() {
        house = SimulationFixture.create().catalog.findDefinition("house").orElseThrow();
    }

    private static Structure houseAt(double health) {
        return Structure.builder()
                .settlementId(UUID.randomUUID())
                .definitionId("house")
                .category(StructureCategory.BUILDING)
                .level(1)
                .health(health)
                .build();
    }

    @Test
    void testFullHealthCostsNothing() {
        assertTrue(calculator.cost(house, houseAt(100), 0.25, 0).isEmpty());
    }

    @Test
    void testCostScalesWithMissingHealth() {
        ResourceAmounts cost = calculator.cost(house, houseAt(60), 0.25, 0);

        // 50 x 0.25 x 40 / 10 and 20 x 0.25 x 40 / 10
        assertEquals(50.0, cost.getUnits(ResourceType.WOOD), 1e-9);
        assertEquals(20.0, cost.getUnits(ResourceType.STONE), 1e-9);
        assertEquals(0.0, cost.getUnits(ResourceType.ORE), 1e-9);
    }

    @Test
    void testCostRoundsUp() {
        ResourceAmounts cost = calculator.cost(house, houseAt(67), 0.25, 0);

        // 41.25 -> 42, 16.5 -> 17
        assertEquals(42.0, cost.getUnits(ResourceType.WOOD), 1e-9);
        assertEquals(17.0, cost.getUnits(ResourceType.STONE), 1e-9);
    }

    @Test
    void testDiscountHalvesRoundedCost() {
        ResourceAmounts cost = calculator.cost(house, houseAt(67), 0.25, 0.5);

        assertEquals(21.0, cost.getUnits(ResourceType.WOOD), 1e-9);
        assertEquals(9.0, cost.getUnits(ResourceType.STONE), 1e-9);
    }

    @Test
    void testDefaultMultiplier() {
        ResourceAmounts cost = calculator.cost(house, houseAt(60), RepairCostCalculator.DEFAULT_MULTIPLIER, 0);

        assertEquals(40.0, cost.getUnits(ResourceType.WOOD), 1e-9);
    }
}
