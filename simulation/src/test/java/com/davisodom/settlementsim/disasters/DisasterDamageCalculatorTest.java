package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.Structure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DisasterDamageCalculatorTest {

    private static final double EPS = 1e-9;

    private SimulationFixture fx;
    private DisasterDamageCalculator calculator;
    private SettlementContext context;
    private Settlement settlement;

    @BeforeEach
    void setUp() {
        fx = SimulationFixture.create();
        calculator = new DisasterDamageCalculator(fx.catalog, fx.stats, fx.config.disasters);
        context = fx.settlement(UUID.randomUUID(), 10, ResourceAmounts.ZERO);
        settlement = context.getSettlement();
    }

    @Test
    void testBareSettlementIsUnprepared() {
        assertEquals(0.0, calculator.preparedness(settlement, DisasterType.EARTHQUAKE), EPS);
    }

    @Test
    @DisplayName("Shelter, watchtower and type-specific defenses add up")
    void testPreparednessComponents() {
        fx.addBuilding(context, "emergency_shelter", 1);
        fx.addBuilding(context, "watchtower", 1);
        fx.addBuilding(context, "seismic_foundation", 1);

        // 30 shelter + 5 tower + 0.6 x 30 foundation
        assertEquals(53.0, calculator.preparedness(settlement, DisasterType.EARTHQUAKE), EPS);
        // the foundation does nothing against floods
        assertEquals(35.0, calculator.preparedness(settlement, DisasterType.FLOOD), EPS);

        settlement.setResilience(50);
        assertEquals(63.0, calculator.preparedness(settlement, DisasterType.EARTHQUAKE), EPS);
    }

    @Test
    void testPreparednessCappedAt100() {
        fx.addBuilding(context, "emergency_shelter", 1);
        fx.addBuilding(context, "watchtower", 1);
        fx.addBuilding(context, "seismic_foundation", 1);
        fx.addBuilding(context, "fortress", 1);
        settlement.setResilience(100);

        assertEquals(100.0, calculator.preparedness(settlement, DisasterType.EARTHQUAKE), EPS);
    }

    @Test
    void testNetDamageVarianceAndClamp() {
        Random random = mock(Random.class);

        when(random.nextDouble()).thenReturn(0.5);
        assertEquals(50.0, calculator.netDamage(80, 30, random), EPS);

        when(random.nextDouble()).thenReturn(0.0);
        assertEquals(40.0, calculator.netDamage(80, 30, random), EPS);

        when(random.nextDouble()).thenReturn(1.0);
        assertEquals(60.0, calculator.netDamage(80, 30, random), EPS);

        assertEquals(0.0, calculator.netDamage(20, 60, random), EPS);
    }

    @Test
    void testStructureResistsItsOwnDisasterType() {
        Structure foundation = fx.addBuilding(context, "seismic_foundation", 1);
        Structure house = fx.addBuilding(context, "house", 1);

        assertEquals(4.0, calculator.structureDamage(foundation, DisasterType.EARTHQUAKE, 10), EPS);
        assertEquals(10.0, calculator.structureDamage(foundation, DisasterType.WILDFIRE, 10), EPS);
        assertEquals(10.0, calculator.structureDamage(house, DisasterType.EARTHQUAKE, 10), EPS);
        assertEquals(0.3, DisasterDamageCalculator.resistance("FORTRESS", DisasterType.DROUGHT), EPS);
        assertEquals(0.0, DisasterDamageCalculator.resistance(null, DisasterType.DROUGHT), EPS);
    }

    @Test
    @DisplayName("Casualties fall on the unsheltered and a working hospital saves some")
    void testCasualties() {
        // 10 unsheltered x 50% x 1.0
        assertEquals(5.0, calculator.casualties(settlement, DisasterType.EARTHQUAKE, 50), EPS);
        assertEquals(7.5, calculator.casualties(settlement, DisasterType.TSUNAMI, 50), EPS);

        Structure hospital = fx.addBuilding(context, "hospital", 1);
        assertEquals(0.5, calculator.hospitalSaveRate(settlement), EPS);
        assertEquals(2.5, calculator.casualties(settlement, DisasterType.EARTHQUAKE, 50), EPS);

        hospital.applyDamage(85);
        assertEquals(0.0, calculator.hospitalSaveRate(settlement), EPS);

        fx.addBuilding(context, "emergency_shelter", 1);
        assertEquals(0.0, calculator.casualties(settlement, DisasterType.EARTHQUAKE, 50), EPS);
    }

    @Test
    void testHospitalSaveRateGrowsWithLevel() {
        fx.addBuilding(context, "hospital", 5);

        assertEquals(0.7, calculator.hospitalSaveRate(settlement), EPS);
    }
}
