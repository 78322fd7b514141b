package com.davisodom.settlementsim.population;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.settlements.SettlementContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static com.davisodom.settlementsim.SimulationFixture.T0;
import static org.junit.jupiter.api.Assertions.*;

class HappinessCalculatorTest {

    private static final double EPS = 1e-9;

    private SimulationFixture fx;
    private HappinessCalculator calculator;
    private SettlementContext context;

    @BeforeEach
    void setUp() {
        fx = SimulationFixture.create();
        calculator = new HappinessCalculator(fx.config.population, fx.stats);
        context = fx.settlement(UUID.randomUUID(), 10, ResourceAmounts.ZERO);
    }

    @Test
    @DisplayName("Sufficiency averages food and water hours against the 72h target")
    void testResourceSufficiency() {
        // food: 216 / (10 x 0.3) = 72h -> 100; water: 216 / (10 x 0.6) = 36h -> 50
        ResourceAmounts balances = ResourceAmounts.ofUnits(Map.of(ResourceType.FOOD, 216, ResourceType.WATER, 216));

        assertEquals(75.0, calculator.resourceSufficiency(balances, 10), EPS);
        assertEquals(0.0, calculator.resourceSufficiency(ResourceAmounts.ZERO, 10), EPS);
        assertEquals(100.0, calculator.resourceSufficiency(ResourceAmounts.ZERO, 0), EPS);
    }

    @Test
    void testHousingQuality() {
        // full occupancy penalty
        assertEquals(70.0, calculator.housingQuality(context.getSettlement(), 10, 10), EPS);
        assertEquals(85.0, calculator.housingQuality(context.getSettlement(), 8, 10), EPS);

        fx.addBuilding(context, "tent", 1);
        assertEquals(100.0, calculator.housingQuality(context.getSettlement(), 4, 10), EPS);

        fx.addBuilding(context, "house", 1);
        assertEquals(90.0, calculator.housingQuality(context.getSettlement(), 10, 10), EPS);
    }

    @Test
    void testDisasterPreparedness() {
        assertEquals(0.0, calculator.disasterPreparedness(context.getSettlement(), 10), EPS);

        fx.addBuilding(context, "watchtower", 1);
        // 15 for the tower, defense 20 x 0.2 = 4
        assertEquals(19.0, calculator.disasterPreparedness(context.getSettlement(), 10), EPS);

        fx.addBuilding(context, "emergency_shelter", 1);
        assertEquals(69.0, calculator.disasterPreparedness(context.getSettlement(), 10), EPS);
    }

    @Test
    void testTraumaRecoversLinearly() {
        assertEquals(100.0, calculator.recentTrauma(context.getSettlement(), T0), EPS);

        context.getSettlement().recordDisaster(T0, 40);
        long recovery = fx.config.population.traumaRecoveryMillis;

        assertEquals(60.0, calculator.recentTrauma(context.getSettlement(), T0), EPS);
        assertEquals(80.0, calculator.recentTrauma(context.getSettlement(), T0 + recovery / 2), EPS);
        assertEquals(100.0, calculator.recentTrauma(context.getSettlement(), T0 + recovery * 2), EPS);
    }

    @Test
    @DisplayName("Weighted blend of all factors")
    void testComputeBlendsWeights() {
        HappinessFactors factors = calculator.compute(context.getSettlement(), ResourceAmounts.ZERO, 10, T0);

        assertEquals(0.0, factors.resourceSufficiency(), EPS);
        assertEquals(70.0, factors.housingQuality(), EPS);
        assertEquals(100.0, factors.recentTrauma(), EPS);
        assertEquals(50.0, factors.baselineMorale(), EPS);
        // (70 x 20 + 100 x 15 + 50 x 15 + 50 x 5) / 100
        assertEquals(39.0, factors.happiness(), EPS);
        assertEquals(7, factors.asMap().size());
    }

    @Test
    void testMoraleBonusFromBuildings() {
        fx.addBuilding(context, "town_hall", 2);

        HappinessFactors factors = calculator.compute(context.getSettlement(), ResourceAmounts.ZERO, 10, T0);

        assertEquals(70.0, factors.baselineMorale(), EPS);
    }
}
