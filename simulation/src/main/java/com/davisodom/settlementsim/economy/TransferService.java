package com.davisodom.settlementsim.economy;

import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementService;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Moves resources between settlements with travel time and distance-based loss.
 *
 * The sender is debited in full when the transfer starts. On arrival the receiver is credited
 * {@code floor(sent x (1 - loss))}; the remainder is lost in transit.
 */
public class TransferService {

    private final Logger logger;
    private final SettlementService settlementService;
    private final ResourceLedger ledger;
    private final SimulationConfig.TransferSettings settings;
    private final Predicate<String> worldHasActiveDisaster;
    private final Map<UUID, ResourceTransfer> inTransit = new ConcurrentHashMap<>();

    public TransferService(Logger logger, SettlementService settlementService, ResourceLedger ledger,
                           SimulationConfig.TransferSettings settings, Predicate<String> worldHasActiveDisaster) {
        this.logger = logger;
        this.settlementService = settlementService;
        this.ledger = ledger;
        this.settings = settings;
        this.worldHasActiveDisaster = worldHasActiveDisaster;
    }

    /**
     * Start a transfer. Caller holds the source settlement's lock.
     *
     * @throws SimulationException VALIDATION for a bad amount, PRECONDITION for the same settlement
     *         or insufficient stock, NOT_FOUND for an unknown destination
     */
    public TransferResult initiate(SettlementContext source, UUID destinationId, ResourceType resource,
                                   long units, long now) {
        Objects.requireNonNull(resource, "resource cannot be null");
        Settlement from = source.getSettlement();
        if (units <= 0) {
            throw new SimulationException(ErrorCode.INVALID_AMOUNT, "Transfer amount must be positive: " + units,
                    Map.of("amount", units));
        }
        if (from.getId().equals(destinationId)) {
            throw new SimulationException(ErrorCode.SAME_SETTLEMENT, "Cannot transfer to the same settlement",
                    Map.of("settlementId", from.getId().toString()));
        }
        Settlement to = settlementService.require(destinationId).getSettlement();

        ResourceAmounts amount = ResourceAmounts.of(resource, units);
        LedgerResult debit = ledger.debit(from.getId(), amount, "transfer to " + destinationId);
        if (!debit.isSuccess()) {
            throw debit.toException();
        }

        int distance = from.getTile().distanceTo(to.getTile());
        double lossPercent = lossPercent(distance, worldHasActiveDisaster.test(from.getWorldName()));
        long received = (long) Math.floor(units * (1.0 - lossPercent / 100.0));
        ResourceTransfer transfer = new ResourceTransfer(UUID.randomUUID(), from.getId(), destinationId, resource,
                units, received, lossPercent, distance, now, now + distance * settings.millisPerTile,
                ResourceTransfer.Status.IN_TRANSIT);
        inTransit.put(transfer.getId(), transfer);

        logger.info(String.format("Transfer %s started: %d %s from %s to %s, distance %d, loss %.1f%%",
                transfer.getId(), units, resource.id(), from.getId(), destinationId, distance, lossPercent));
        return new TransferResult(transfer, List.of(SimulationEvent.settlement(EventType.TRANSFER_STARTED,
                from.getId(), now, payload(transfer))));
    }

    /**
     * Loss percentage: {@code distance / 100 x perHundred}, plus the disaster surcharge, capped.
     */
    public double lossPercent(int distance, boolean activeDisaster) {
        double loss = distance / 100.0 * settings.lossPercentPerHundredTiles;
        if (activeDisaster) {
            loss += settings.disasterLossPercent;
        }
        return Math.min(settings.maxLossPercent, loss);
    }

    /**
     * Deliver every transfer that has arrived, in arrival order.
     *
     * @return delivery events; destination ids are the settlements whose balances changed
     */
    public List<SimulationEvent> completeDue(long now) {
        List<ResourceTransfer> due = inTransit.values().stream()
                .filter(t -> t.isDue(now))
                .sorted(Comparator.comparingLong(ResourceTransfer::getArrivesAt).thenComparing(ResourceTransfer::getId))
                .collect(Collectors.toList());
        List<SimulationEvent> events = new ArrayList<>();
        for (ResourceTransfer transfer : due) {
            if (inTransit.remove(transfer.getId()) == null) {
                continue;
            }
            ResourceTransfer completed = transfer.asCompleted();
            Optional<SettlementContext> destination = settlementService.get(transfer.getToSettlementId());
            if (destination.isEmpty()) {
                logger.warning(String.format("Transfer %s destination %s is gone; returning %d %s to sender",
                        transfer.getId(), transfer.getToSettlementId(), transfer.getSentUnits(), transfer.getResource().id()));
                ledger.refund(transfer.getFromSettlementId(),
                        ResourceAmounts.of(transfer.getResource(), transfer.getSentUnits()), "transfer returned");
                continue;
            }
            ResourceAmounts credited = destination.get().withLock(() -> ledger.credit(transfer.getToSettlementId(),
                    ResourceAmounts.of(transfer.getResource(), transfer.getReceivedUnits()),
                    "transfer from " + transfer.getFromSettlementId()));
            Map<String, Object> payload = payload(completed);
            payload.put("credited", credited.getUnits(transfer.getResource()));
            events.add(SimulationEvent.settlement(EventType.TRANSFER_COMPLETED, transfer.getToSettlementId(),
                    transfer.getArrivesAt(), payload));
        }
        return events;
    }

    public List<ResourceTransfer> getInTransit() {
        return inTransit.values().stream()
                .sorted(Comparator.comparingLong(ResourceTransfer::getArrivesAt))
                .collect(Collectors.toList());
    }

    /**
     * Reinstate a persisted in-transit transfer; the sender was already debited.
     */
    public void restore(ResourceTransfer transfer) {
        if (transfer.getStatus() == ResourceTransfer.Status.IN_TRANSIT) {
            inTransit.put(transfer.getId(), transfer);
        }
    }

    /**
     * Drop a transfer that was started by a command whose save failed.
     */
    public void discard(UUID transferId) {
        inTransit.remove(transferId);
    }

    private static Map<String, Object> payload(ResourceTransfer transfer) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("transferId", transfer.getId().toString());
        payload.put("from", transfer.getFromSettlementId().toString());
        payload.put("to", transfer.getToSettlementId().toString());
        payload.put("resource", transfer.getResource().id());
        payload.put("sent", transfer.getSentUnits());
        payload.put("received", transfer.getReceivedUnits());
        payload.put("lossPercent", transfer.getLossPercent());
        payload.put("distance", transfer.getDistance());
        payload.put("arrivesAt", transfer.getArrivesAt());
        payload.put("status", transfer.getStatus().name());
        return payload;
    }

    public record TransferResult(ResourceTransfer transfer, List<SimulationEvent> events) {
    }
}
