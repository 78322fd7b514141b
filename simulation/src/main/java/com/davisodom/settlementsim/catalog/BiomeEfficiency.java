package com.davisodom.settlementsim.catalog;

import com.davisodom.settlementsim.economy.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-resource production efficiency of a biome. Resources without an entry run at 1.0.
 */
public record BiomeEfficiency(String biome, Map<ResourceType, Double> efficiency) {

    public BiomeEfficiency {
        efficiency = efficiency.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(efficiency));
    }

    public static BiomeEfficiency neutral(String biome) {
        return new BiomeEfficiency(biome, Collections.emptyMap());
    }

    public double forResource(ResourceType type) {
        return efficiency.getOrDefault(type, 1.0);
    }
}
