package com.davisodom.settlementsim.production;

import com.davisodom.settlementsim.catalog.BiomeEfficiency;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.settlements.Tile;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one production/consumption evaluation depends on.
 *
 * @param resourceModifiers extra per-resource multipliers on the tile base (e.g. disaster penalties)
 */
public record ProductionInput(Tile tile,
                              BiomeEfficiency biomeEfficiency,
                              List<ExtractorSnapshot> extractors,
                              int population,
                              int structureCount,
                              double worldProductionMultiplier,
                              double worldConsumptionMultiplier,
                              long elapsedTicks,
                              Map<ResourceType, Double> resourceModifiers) {

    public ProductionInput {
        extractors = List.copyOf(extractors);
        resourceModifiers = resourceModifiers == null || resourceModifiers.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(resourceModifiers));
        if (elapsedTicks < 0) {
            throw new IllegalArgumentException("elapsedTicks cannot be negative: " + elapsedTicks);
        }
        if (population < 0 || structureCount < 0) {
            throw new IllegalArgumentException("population and structureCount cannot be negative");
        }
    }

    public double resourceModifier(ResourceType type) {
        return resourceModifiers.getOrDefault(type, 1.0);
    }
}
