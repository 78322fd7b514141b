package com.davisodom.settlementsim.construction;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.Structure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SettlementAreaValidatorTest {

    private SimulationFixture fx;
    private SettlementAreaValidator validator;
    private SettlementContext context;

    @BeforeEach
    void setUp() {
        fx = SimulationFixture.create();
        validator = new SettlementAreaValidator(fx.catalog, fx.config.construction);
        context = fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());
    }

    private StructureDefinition def(String id) {
        return fx.catalog.findDefinition(id).orElseThrow();
    }

    @Test
    void testAreaCapacityGrowsWithTownHall() {
        assertEquals(500, validator.areaCapacity(context.getSettlement()));

        fx.addBuilding(context, "town_hall", 2);

        assertEquals(700, validator.areaCapacity(context.getSettlement()));
        assertEquals(2, SettlementAreaValidator.townHallLevel(fx.catalog, context.getSettlement()));
    }

    @Test
    void testExtractorsUseNoArea() {
        fx.addExtractor(context, "farm", 0, 1, SimulationFixture.T0);
        fx.addBuilding(context, "house", 1);

        assertEquals(25, validator.areaUsed(context.getSettlement()));
    }

    @Test
    void testDestroyedStructuresFreeTheirArea() {
        Structure house = fx.addBuilding(context, "house", 1);
        house.applyDamage(Structure.MAX_HEALTH);

        assertEquals(0, validator.areaUsed(context.getSettlement()));
    }

    @Test
    void testUniqueBuiltStructureRejected() {
        fx.addBuilding(context, "firebreak", 1);

        SimulationException e = assertThrows(SimulationException.class,
                () -> validator.check(context.getSettlement(), def("firebreak")));
        assertEquals(ErrorCode.UNIQUE_STRUCTURE_EXISTS, e.getCode());
    }

    @Test
    void testTierGate() {
        assertThrows(SimulationException.class, () -> validator.check(context.getSettlement(), def("storm_barrier")));

        context.getSettlement().setTier(2);

        assertDoesNotThrow(() -> validator.check(context.getSettlement(), def("storm_barrier")));
    }
}
