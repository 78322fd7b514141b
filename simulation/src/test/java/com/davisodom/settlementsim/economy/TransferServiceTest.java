package com.davisodom.settlementsim.economy;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.settlements.SettlementContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.davisodom.settlementsim.SimulationFixture.T0;
import static org.junit.jupiter.api.Assertions.*;

class TransferServiceTest {

    private SimulationFixture fx;
    private Set<String> worldsInDisaster;
    private TransferService service;
    private SettlementContext source;
    private SettlementContext destination;

    @BeforeEach
    void setUp() {
        fx = SimulationFixture.create();
        worldsInDisaster = new HashSet<>();
        service = new TransferService(fx.logger, fx.settlements, fx.ledger, fx.config.transfers, worldsInDisaster::contains);
        source = fx.settlement(UUID.randomUUID(), SimulationFixture.grassland(0, 0), 10,
                ResourceAmounts.of(ResourceType.STONE, 500));
        destination = fx.settlement(UUID.randomUUID(), SimulationFixture.grassland(300, 400), 10, ResourceAmounts.ZERO);
    }

    private UUID sourceId() {
        return source.getSettlement().getId();
    }

    private UUID destinationId() {
        return destination.getSettlement().getId();
    }

    @Test
    @DisplayName("Sender is debited in full; receiver gets floor(sent x (1 - loss))")
    void testTransferLifecycle() {
        TransferService.TransferResult result = service.initiate(source, destinationId(), ResourceType.STONE, 101, T0);
        ResourceTransfer transfer = result.transfer();

        assertEquals(500, transfer.getDistance());
        assertEquals(25.0, transfer.getLossPercent(), 1e-9);
        assertEquals(75, transfer.getReceivedUnits(), "floor(101 x 0.75) = 75");
        assertEquals(T0 + 500 * 6_000L, transfer.getArrivesAt());
        assertEquals(399.0, fx.ledger.getBalances(sourceId()).getUnits(ResourceType.STONE), 1e-9);
        assertEquals(EventType.TRANSFER_STARTED, result.events().get(0).type());

        assertTrue(service.completeDue(transfer.getArrivesAt() - 1).isEmpty());

        List<SimulationEvent> events = service.completeDue(transfer.getArrivesAt());

        assertEquals(1, events.size());
        assertEquals(EventType.TRANSFER_COMPLETED, events.get(0).type());
        assertEquals(destinationId().toString(), events.get(0).scopeId());
        assertEquals(75.0, fx.ledger.getBalances(destinationId()).getUnits(ResourceType.STONE), 1e-9);
        assertTrue(service.getInTransit().isEmpty());
    }

    @Test
    void testLossCappedAndRaisedByDisaster() {
        assertEquals(5.0, service.lossPercent(100, false), 1e-9);
        assertEquals(15.0, service.lossPercent(100, true), 1e-9);
        assertEquals(50.0, service.lossPercent(5_000, true), 1e-9);
    }

    @Test
    void testActiveDisasterInSenderWorldAddsLoss() {
        worldsInDisaster.add("overworld");

        ResourceTransfer transfer = service.initiate(source, destinationId(), ResourceType.STONE, 100, T0).transfer();

        assertEquals(35.0, transfer.getLossPercent(), 1e-9);
        assertEquals(65, transfer.getReceivedUnits());
    }

    @Test
    void testRejectsNonPositiveAmount() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> service.initiate(source, destinationId(), ResourceType.STONE, 0, T0));
        assertEquals(ErrorCode.INVALID_AMOUNT, e.getCode());
    }

    @Test
    void testRejectsSameSettlement() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> service.initiate(source, sourceId(), ResourceType.STONE, 10, T0));
        assertEquals(ErrorCode.SAME_SETTLEMENT, e.getCode());
    }

    @Test
    void testRejectsUnknownDestination() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> service.initiate(source, UUID.randomUUID(), ResourceType.STONE, 10, T0));
        assertEquals(ErrorCode.SETTLEMENT_NOT_FOUND, e.getCode());
        assertEquals(500.0, fx.ledger.getBalances(sourceId()).getUnits(ResourceType.STONE), 1e-9);
    }

    @Test
    void testRejectsInsufficientStock() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> service.initiate(source, destinationId(), ResourceType.ORE, 1, T0));
        assertEquals(ErrorCode.INSUFFICIENT_RESOURCES, e.getCode());
        assertTrue(service.getInTransit().isEmpty());
    }

    @Test
    void testDiscardDropsTransfer() {
        ResourceTransfer transfer = service.initiate(source, destinationId(), ResourceType.STONE, 10, T0).transfer();

        service.discard(transfer.getId());

        assertTrue(service.completeDue(Long.MAX_VALUE).isEmpty());
    }

    @Test
    void testRestoreOnlyKeepsInTransit() {
        ResourceTransfer transfer = new ResourceTransfer(UUID.randomUUID(), sourceId(), destinationId(),
                ResourceType.WOOD, 10, 9, 10.0, 200, T0, T0 + 1000, ResourceTransfer.Status.IN_TRANSIT);

        service.restore(transfer);
        service.restore(transfer.asCompleted());

        assertEquals(1, service.getInTransit().size());
        service.completeDue(T0 + 1000);
        assertEquals(9.0, fx.ledger.getBalances(destinationId()).getUnits(ResourceType.WOOD), 1e-9);
    }
}
