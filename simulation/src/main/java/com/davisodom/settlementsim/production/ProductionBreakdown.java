package com.davisodom.settlementsim.production;

import com.davisodom.settlementsim.economy.ResourceType;

import java.util.*;

/**
 * Result of a production/consumption evaluation, resource by resource.
 *
 * Resources with tile quality 0 have no production line at all.
 */
public class ProductionBreakdown {

    /**
     * How one resource's production was composed.
     */
    public record ResourceLine(ResourceType resource, int quality, double base, double tierMultiplier,
                               double healthModifier, double staffingMultiplier, UUID extractorId,
                               double production) {
    }

    private final long elapsedTicks;
    private final Map<ResourceType, ResourceLine> lines;
    private final Map<ResourceType, Double> consumption;

    public ProductionBreakdown(long elapsedTicks, Map<ResourceType, ResourceLine> lines,
                               Map<ResourceType, Double> consumption) {
        this.elapsedTicks = elapsedTicks;
        Map<ResourceType, ResourceLine> lineCopy = new EnumMap<>(ResourceType.class);
        lineCopy.putAll(lines);
        Map<ResourceType, Double> consumptionCopy = new EnumMap<>(ResourceType.class);
        consumptionCopy.putAll(consumption);
        this.lines = Collections.unmodifiableMap(lineCopy);
        this.consumption = Collections.unmodifiableMap(consumptionCopy);
    }

    public long getElapsedTicks() {
        return elapsedTicks;
    }

    public Optional<ResourceLine> line(ResourceType type) {
        return Optional.ofNullable(lines.get(type));
    }

    public Collection<ResourceLine> getLines() {
        return lines.values();
    }

    public double productionOf(ResourceType type) {
        ResourceLine line = lines.get(type);
        return line != null ? line.production() : 0.0;
    }

    public double consumptionOf(ResourceType type) {
        return consumption.getOrDefault(type, 0.0);
    }

    /**
     * Production minus consumption; may be negative.
     */
    public double netOf(ResourceType type) {
        return productionOf(type) - consumptionOf(type);
    }

    public Map<ResourceType, Double> net() {
        Map<ResourceType, Double> net = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            net.put(type, netOf(type));
        }
        return net;
    }

    @Override
    public String toString() {
        return String.format("ProductionBreakdown{ticks=%d, net=%s}", elapsedTicks, net());
    }
}
