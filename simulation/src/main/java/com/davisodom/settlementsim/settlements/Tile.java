package com.davisodom.settlementsim.settlements;

import com.davisodom.settlementsim.economy.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * The map tile a settlement sits on.
 *
 * @param id tile id
 * @param biome biome name, looked up in the catalog's efficiency table
 * @param region region name used for disaster targeting
 * @param x grid column
 * @param y grid row
 * @param quality per-resource quality 0-100; absent means 0
 * @param baseProductionModifier tile-wide production modifier
 * @param slotCount number of extractor slots on the tile
 */
public record Tile(UUID id, String biome, String region, int x, int y,
                   Map<ResourceType, Integer> quality, double baseProductionModifier, int slotCount) {

    public Tile {
        quality = quality == null || quality.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(quality));
        if (slotCount < 0) {
            throw new IllegalArgumentException("slotCount must be non-negative: " + slotCount);
        }
    }

    public int qualityFor(ResourceType type) {
        return quality.getOrDefault(type, 0);
    }

    /**
     * Rounded Euclidean distance to another tile, in tiles.
     */
    public int distanceTo(Tile other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return (int) Math.round(Math.sqrt(dx * dx + dy * dy));
    }
}
