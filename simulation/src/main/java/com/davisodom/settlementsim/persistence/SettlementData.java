package com.davisodom.settlementsim.persistence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized settlement aggregate: settlement fields, balances, structures and queue.
 * Resource maps are keyed by resource id and hold milli-units.
 */
public class SettlementData {
    public String id;
    public String ownerId;
    public String name;
    public String worldName;
    public TileData tile;
    public int tier;
    public long createdAt;
    public long lastCollectedAt;
    public long lastPassiveRepairAt;
    public double resilience;
    public long lastDisasterAt;
    public double lastDisasterSeverity;
    public PopulationData population;
    public Map<String, Long> balances = new LinkedHashMap<>();
    public List<String> research = new ArrayList<>();
    public List<StructureData> structures = new ArrayList<>();
    public List<QueueItemData> queue = new ArrayList<>();

    public SettlementData() {} // For Jackson

    public static class TileData {
        public String id;
        public String biome;
        public String region;
        public int x;
        public int y;
        public Map<String, Integer> quality = new LinkedHashMap<>();
        public double baseProductionModifier = 1.0;
        public int slotCount;

        public TileData() {} // For Jackson
    }

    public static class PopulationData {
        public int count;
        public double happiness;
        public long lastGrowthAt;
        public int lowHappinessStreak;

        public PopulationData() {} // For Jackson
    }

    public static class StructureData {
        public String id;
        public String definitionId;
        public String category;
        public String tileId;
        public Integer slotPosition;
        public long createdAt;
        public int level;
        public double health;
        public int populationAssigned;
        public boolean destroyed;

        public StructureData() {} // For Jackson
    }

    public static class QueueItemData {
        public String id;
        public String definitionId;
        public String existingStructureId;
        public int targetLevel;
        public Map<String, Long> deductedResources = new LinkedHashMap<>();
        public String status;
        public int position;
        public long durationMillis;
        public long createdAt;
        public long startedAt;
        public long completesAt;
        public String tileId;
        public Integer slotPosition;
        public boolean emergency;

        public QueueItemData() {} // For Jackson
    }
}
