package com.davisodom.settlementsim.construction;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Ordered non-terminal construction items of one settlement.
 *
 * Positions are kept dense and zero-based after every removal. Not thread-safe; the owning
 * settlement's lock guards it.
 */
public class ConstructionQueue {

    private final List<ConstructionQueueItem> items = new ArrayList<>();

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int activeCount() {
        return (int) items.stream().filter(ConstructionQueueItem::isActive).count();
    }

    public List<ConstructionQueueItem> getItems() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    public Optional<ConstructionQueueItem> find(UUID itemId) {
        return items.stream().filter(i -> i.getId().equals(itemId)).findFirst();
    }

    /**
     * QUEUED items in position order.
     */
    public List<ConstructionQueueItem> waiting() {
        return items.stream()
                .filter(i -> i.getStatus() == ConstructionQueueItem.Status.QUEUED)
                .sorted(Comparator.comparingInt(ConstructionQueueItem::getPosition))
                .collect(Collectors.toList());
    }

    public List<ConstructionQueueItem> due(long now) {
        return items.stream()
                .filter(i -> i.isDue(now))
                .sorted(Comparator.comparingLong(ConstructionQueueItem::getCompletesAt)
                        .thenComparingInt(ConstructionQueueItem::getPosition))
                .collect(Collectors.toList());
    }

    public boolean isReserved(UUID tileId, int slot) {
        return items.stream().anyMatch(i -> i.reserves(tileId, slot));
    }

    public long pendingUpgrades(UUID structureId) {
        return items.stream().filter(i -> structureId.equals(i.getExistingStructureId())).count();
    }

    public boolean containsDefinition(String definitionId) {
        return items.stream().anyMatch(i -> !i.isUpgrade() && i.getDefinitionId().equals(definitionId));
    }

    public void append(ConstructionQueueItem item) {
        if (item.isTerminal()) {
            throw new IllegalArgumentException("Terminal items are not queued: " + item);
        }
        if (item.getPosition() != items.size()) {
            throw new IllegalArgumentException(String.format("Position %d breaks dense ordering (size %d)",
                    item.getPosition(), items.size()));
        }
        items.add(item);
    }

    public void replace(ConstructionQueueItem item) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getId().equals(item.getId())) {
                items.set(i, item);
                return;
            }
        }
        throw new NoSuchElementException("Queue item not found: " + item.getId());
    }

    /**
     * Remove an item and renumber the rest.
     */
    public ConstructionQueueItem remove(UUID itemId) {
        Iterator<ConstructionQueueItem> it = items.iterator();
        while (it.hasNext()) {
            ConstructionQueueItem item = it.next();
            if (item.getId().equals(itemId)) {
                it.remove();
                renumber();
                return item;
            }
        }
        throw new NoSuchElementException("Queue item not found: " + itemId);
    }

    /**
     * Replace the whole queue (persistence load and rollback).
     */
    public void restore(List<ConstructionQueueItem> restored) {
        items.clear();
        restored.stream()
                .filter(i -> !i.isTerminal())
                .sorted(Comparator.comparingInt(ConstructionQueueItem::getPosition))
                .forEach(items::add);
        renumber();
    }

    private void renumber() {
        items.sort(Comparator.comparingInt(ConstructionQueueItem::getPosition));
        for (int i = 0; i < items.size(); i++) {
            items.set(i, items.get(i).withPosition(i));
        }
    }
}
