package com.davisodom.settlementsim.construction;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.Structure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.davisodom.settlementsim.SimulationFixture.T0;
import static org.junit.jupiter.api.Assertions.*;

class ConstructionServiceTest {

    private SimulationFixture fx;
    private ConstructionService service;
    private SettlementContext context;
    private Settlement settlement;
    private UUID id;

    @BeforeEach
    void setUp() {
        fx = SimulationFixture.create();
        service = new ConstructionService(fx.logger, fx.catalog, fx.ledger,
                new SettlementAreaValidator(fx.catalog, fx.config.construction), fx.settlements, fx.config.construction);
        context = fx.settlement(UUID.randomUUID(), 10, SimulationFixture.plenty());
        settlement = context.getSettlement();
        id = settlement.getId();
    }

    private ConstructionService.SubmissionResult submit(ConstructionRequest request, long now) {
        return service.submit(context, request, now);
    }

    private SimulationException rejected(ConstructionRequest request) {
        return assertThrows(SimulationException.class, () -> submit(request, T0));
    }

    @Test
    void testFirstSubmissionStartsImmediately() {
        ConstructionService.SubmissionResult result = submit(ConstructionRequest.building(id, "house"), T0);

        assertEquals(ConstructionQueueItem.Status.IN_PROGRESS, result.item().getStatus());
        assertEquals(T0 + 600_000, result.item().getCompletesAt());
        assertEquals(EventType.CONSTRUCTION_STARTED, result.events().get(0).type());
        assertEquals(850.0, fx.ledger.getBalances(id).getUnits(ResourceType.WOOD), 1e-9);
        assertEquals(880.0, fx.ledger.getBalances(id).getUnits(ResourceType.STONE), 1e-9);
    }

    @Test
    void testSecondSubmissionIsQueued() {
        submit(ConstructionRequest.building(id, "house"), T0);
        ConstructionService.SubmissionResult second = submit(ConstructionRequest.building(id, "house"), T0);

        assertEquals(ConstructionQueueItem.Status.QUEUED, second.item().getStatus());
        assertEquals(1, second.item().getPosition());
        assertEquals(EventType.CONSTRUCTION_QUEUED, second.events().get(0).type());
    }

    @Test
    @DisplayName("The 12th item is rejected with QUEUE_FULL and nothing is debited")
    void testQueueFull() {
        for (int i = 0; i < 11; i++) {
            submit(ConstructionRequest.building(id, "house"), T0);
        }
        ResourceAmounts before = fx.ledger.getBalances(id);

        SimulationException e = rejected(ConstructionRequest.building(id, "house"));

        assertEquals(ErrorCode.QUEUE_FULL, e.getCode());
        assertEquals(before, fx.ledger.getBalances(id));
        assertEquals(11, settlement.getQueue().size());
        assertEquals(1, settlement.getQueue().activeCount());
    }

    @Test
    void testUnknownStructureType() {
        assertEquals(ErrorCode.UNKNOWN_STRUCTURE_TYPE, rejected(ConstructionRequest.building(id, "castle")).getCode());
    }

    @Test
    void testPrerequisitesNotMet() {
        SimulationException e = rejected(ConstructionRequest.building(id, "workshop"));

        assertEquals(ErrorCode.PREREQUISITES_NOT_MET, e.getCode());
        assertTrue(settlement.getQueue().isEmpty());
    }

    @Test
    void testPrerequisitesMetByTownHall() {
        fx.addBuilding(context, "town_hall", 1);

        assertDoesNotThrow(() -> submit(ConstructionRequest.building(id, "workshop"), T0));
    }

    @Test
    void testTierTooLow() {
        assertEquals(ErrorCode.TIER_TOO_LOW, rejected(ConstructionRequest.building(id, "seismic_foundation")).getCode());
    }

    @Test
    void testUniqueStructureAlreadyQueued() {
        submit(ConstructionRequest.building(id, "town_hall"), T0);

        assertEquals(ErrorCode.UNIQUE_STRUCTURE_EXISTS, rejected(ConstructionRequest.building(id, "town_hall")).getCode());
    }

    @Test
    void testAreaExceeded() {
        fx.config.construction.baseAreaCapacity = 30;
        submit(ConstructionRequest.building(id, "house"), T0);

        SimulationException e = rejected(ConstructionRequest.building(id, "house"));

        assertEquals(ErrorCode.AREA_EXCEEDED, e.getCode());
        assertEquals(25, e.getDetails().get("areaUsed"));
    }

    @Test
    void testInsufficientResourcesLeavesStateUntouched() {
        fx.ledger.restore(id, ResourceAmounts.of(ResourceType.WOOD, 10));

        SimulationException e = rejected(ConstructionRequest.building(id, "house"));

        assertEquals(ErrorCode.INSUFFICIENT_RESOURCES, e.getCode());
        assertEquals(10.0, fx.ledger.getBalances(id).getUnits(ResourceType.WOOD), 1e-9);
        assertTrue(settlement.getQueue().isEmpty());
    }

    @Test
    void testExtractorSlotValidation() {
        UUID tileId = settlement.getTile().id();

        assertEquals(ErrorCode.TILE_REQUIRED,
                rejected(new ConstructionRequest(id, "farm", null, null, null, false)).getCode());
        assertEquals(ErrorCode.TILE_NOT_IN_SETTLEMENT,
                rejected(ConstructionRequest.extractor(id, "farm", UUID.randomUUID(), 0)).getCode());
        assertEquals(ErrorCode.SLOT_OUT_OF_RANGE,
                rejected(ConstructionRequest.extractor(id, "farm", tileId, 4)).getCode());

        submit(ConstructionRequest.extractor(id, "farm", tileId, 0), T0);
        assertEquals(ErrorCode.SLOT_RESERVED,
                rejected(ConstructionRequest.extractor(id, "well", tileId, 0)).getCode());

        service.advance(context, T0 + 180_000);
        assertEquals(ErrorCode.SLOT_OCCUPIED,
                rejected(ConstructionRequest.extractor(id, "well", tileId, 0)).getCode());
    }

    @Test
    @DisplayName("Completion materializes the structure and promotes the next item")
    void testAdvanceCompletesAndPromotes() {
        submit(ConstructionRequest.building(id, "house"), T0);
        ConstructionQueueItem second = submit(ConstructionRequest.building(id, "warehouse"), T0).item();

        assertTrue(service.advance(context, T0 + 599_999).isEmpty());

        List<SimulationEvent> events = service.advance(context, T0 + 600_000);

        assertEquals(List.of(EventType.STRUCTURE_BUILT, EventType.CONSTRUCTION_STARTED),
                events.stream().map(SimulationEvent::type).collect(Collectors.toList()));
        assertEquals(1, settlement.getActiveStructures().size());
        ConstructionQueueItem promoted = settlement.getQueue().find(second.getId()).orElseThrow();
        assertEquals(ConstructionQueueItem.Status.IN_PROGRESS, promoted.getStatus());
        assertEquals(0, promoted.getPosition());
        assertEquals(T0 + 600_000 + 300_000, promoted.getCompletesAt());
    }

    @Test
    void testZeroDurationCompletesOnNextAdvance() {
        submit(ConstructionRequest.building(id, "tent"), T0);

        List<SimulationEvent> events = service.advance(context, T0);

        assertEquals(EventType.STRUCTURE_BUILT, events.get(0).type());
        assertEquals(1, settlement.highestLevelOf("tent"));
    }

    @Test
    @DisplayName("One advance keeps completing and promoting while items are due")
    void testAdvanceChainsPromotions() {
        submit(ConstructionRequest.building(id, "tent"), T0);
        submit(ConstructionRequest.building(id, "tent"), T0);
        ConstructionQueueItem house = submit(ConstructionRequest.building(id, "house"), T0).item();

        long now = T0 + 3_600_000;
        service.advance(context, now);

        assertEquals(2, settlement.getActiveStructures().size());
        ConstructionQueueItem active = settlement.getQueue().find(house.getId()).orElseThrow();
        assertEquals(ConstructionQueueItem.Status.IN_PROGRESS, active.getStatus());
        assertEquals(now + 600_000, active.getCompletesAt());
    }

    @Test
    void testStorageCapacityRaisedByWarehouse() {
        submit(ConstructionRequest.building(id, "warehouse"), T0);
        service.advance(context, T0 + 300_000);

        assertEquals(1500.0, fx.ledger.getAccount(id).getCapacity().getUnits(ResourceType.FOOD), 1e-9);
    }

    @Test
    void testCancelRefundsInFull() {
        submit(ConstructionRequest.building(id, "house"), T0);
        ResourceAmounts afterFirst = fx.ledger.getBalances(id);
        ConstructionQueueItem queued = submit(ConstructionRequest.building(id, "house"), T0).item();

        ConstructionService.CancellationResult result = service.cancel(context, queued.getId(), T0 + 10);

        assertEquals(afterFirst, fx.ledger.getBalances(id));
        assertEquals(ConstructionQueueItem.Status.CANCELLED, result.item().getStatus());
        assertEquals(EventType.CONSTRUCTION_CANCELLED, result.events().get(0).type());
        assertEquals(1, settlement.getQueue().size());
    }

    @Test
    void testCancelInProgressRejected() {
        ConstructionQueueItem active = submit(ConstructionRequest.building(id, "house"), T0).item();

        SimulationException e = assertThrows(SimulationException.class,
                () -> service.cancel(context, active.getId(), T0));

        assertEquals(ErrorCode.ITEM_NOT_CANCELLABLE, e.getCode());
    }

    @Test
    void testCancelUnknownItem() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> service.cancel(context, UUID.randomUUID(), T0));

        assertEquals(ErrorCode.QUEUE_ITEM_NOT_FOUND, e.getCode());
    }

    @Test
    @DisplayName("Positions stay dense after a middle item is cancelled")
    void testPositionsDenseAfterCancel() {
        submit(ConstructionRequest.building(id, "house"), T0);
        ConstructionQueueItem middle = submit(ConstructionRequest.building(id, "house"), T0).item();
        submit(ConstructionRequest.building(id, "house"), T0);
        submit(ConstructionRequest.building(id, "house"), T0);

        service.cancel(context, middle.getId(), T0);

        List<ConstructionQueueItem> items = settlement.getQueue().getItems();
        for (int i = 0; i < items.size(); i++) {
            assertEquals(i, items.get(i).getPosition());
        }
    }

    @Test
    void testUpgradeRaisesLevelWithScaledCost() {
        Structure farm = fx.addExtractor(context, "farm", 0, 1, T0);
        ResourceAmounts before = fx.ledger.getBalances(id);

        ConstructionQueueItem item = submit(ConstructionRequest.upgrade(id, "farm", farm.getId()), T0).item();

        assertEquals(2, item.getTargetLevel());
        assertEquals(225_000, item.getDurationMillis());
        assertEquals(before.getUnits(ResourceType.WOOD) - 30, fx.ledger.getBalances(id).getUnits(ResourceType.WOOD), 1e-9);
        assertEquals(before.getUnits(ResourceType.STONE) - 15, fx.ledger.getBalances(id).getUnits(ResourceType.STONE), 1e-9);

        List<SimulationEvent> events = service.advance(context, T0 + 225_000);

        assertEquals(EventType.STRUCTURE_UPGRADED, events.get(0).type());
        assertEquals(2, farm.getLevel());
    }

    @Test
    @DisplayName("An upgrade whose structure was destroyed while queued is refunded")
    void testUpgradeOfDestroyedStructureRefunded() {
        Structure farm = fx.addExtractor(context, "farm", 0, 1, T0);
        ResourceAmounts before = fx.ledger.getBalances(id);
        submit(ConstructionRequest.upgrade(id, "farm", farm.getId()), T0);
        farm.applyDamage(Structure.MAX_HEALTH);

        List<SimulationEvent> events = service.advance(context, T0 + 225_000);

        assertEquals(1, events.size());
        assertEquals(EventType.CONSTRUCTION_FAILED, events.get(0).type());
        assertEquals("target_lost", events.get(0).payload().get("reason"));
        assertEquals(farm.getId().toString(), events.get(0).payload().get("structureId"));
        assertEquals(before, fx.ledger.getBalances(id));
        assertEquals(1, farm.getLevel());
        assertTrue(settlement.getQueue().isEmpty());
    }

    @Test
    void testUpgradeBeyondMaxLevelRejected() {
        Structure tent = fx.addBuilding(context, "tent", 3);

        assertEquals(ErrorCode.MAX_LEVEL_REACHED,
                rejected(ConstructionRequest.upgrade(id, "tent", tent.getId())).getCode());
    }

    @Test
    void testQueuedUpgradesCountTowardsMaxLevel() {
        Structure tent = fx.addBuilding(context, "tent", 2);
        submit(ConstructionRequest.upgrade(id, "tent", tent.getId()), T0);

        assertEquals(ErrorCode.MAX_LEVEL_REACHED,
                rejected(ConstructionRequest.upgrade(id, "tent", tent.getId())).getCode());
    }

    @Test
    void testEmergencyBuildIsFasterAndDearer() {
        ConstructionQueueItem item = submit(ConstructionRequest.building(id, "house").asEmergency(), T0).item();

        assertEquals(300_000, item.getDurationMillis());
        assertEquals(125.0, item.getDeductedResources().getUnits(ResourceType.WOOD), 1e-9);
        assertEquals(50.0, item.getDeductedResources().getUnits(ResourceType.STONE), 1e-9);
    }

    @Test
    @DisplayName("Debited resources equal refunds plus the cost of finished work")
    void testResourceConservation() {
        ResourceAmounts start = fx.ledger.getBalances(id);
        submit(ConstructionRequest.building(id, "house"), T0);
        ConstructionQueueItem cancelled = submit(ConstructionRequest.building(id, "warehouse"), T0).item();
        service.cancel(context, cancelled.getId(), T0);

        ResourceAmounts houseCost = fx.catalog.findDefinition("house").orElseThrow().getCosts();
        assertEquals(start.getMillis(ResourceType.WOOD) - houseCost.getMillis(ResourceType.WOOD),
                fx.ledger.getBalances(id).getMillis(ResourceType.WOOD));
        assertEquals(start.getMillis(ResourceType.STONE) - houseCost.getMillis(ResourceType.STONE),
                fx.ledger.getBalances(id).getMillis(ResourceType.STONE));
    }

    @Test
    void testCostForScalesWithLevel() {
        StructureDefinition house = fx.catalog.findDefinition("house").orElseThrow();

        assertEquals(ResourceAmounts.ofUnits(Map.of(ResourceType.WOOD, 112.5, ResourceType.STONE, 45)),
                service.costFor(house, 3, false));
    }
}
