package com.davisodom.settlementsim.economy;

import java.util.Locale;

/**
 * The five settlement resources.
 */
public enum ResourceType {
    FOOD,
    WATER,
    WOOD,
    STONE,
    ORE;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a resource id case-insensitively.
     *
     * @throws IllegalArgumentException if the id names no resource
     */
    public static ResourceType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Resource id cannot be null");
        }
        return ResourceType.valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
