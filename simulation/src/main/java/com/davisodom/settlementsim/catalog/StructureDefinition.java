package com.davisodom.settlementsim.catalog;

import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Catalog entry describing a buildable structure type.
 * Immutable value object with validation.
 */
public class StructureDefinition {

    private final String id;
    private final String name;
    private final StructureCategory category;
    private final String buildingType;
    private final ResourceType producedResource;
    private final ResourceAmounts costs;
    private final long constructionMillis;
    private final int tier;
    private final int maxLevel;
    private final List<Prerequisite> prerequisites;
    private final int populationRequired;
    private final int areaCost;
    private final boolean unique;
    private final int populationCapacity;
    private final int storageCapacity;
    private final int shelterCapacity;
    private final int defenseRating;
    private final int moraleBonus;

    private StructureDefinition(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id cannot be null");
        this.name = b.name != null ? b.name : b.id;
        this.category = Objects.requireNonNull(b.category, "category cannot be null");
        this.buildingType = b.buildingType != null ? b.buildingType : b.id.toUpperCase();
        this.producedResource = b.producedResource;
        this.costs = Objects.requireNonNull(b.costs, "costs cannot be null");
        this.constructionMillis = b.constructionMillis;
        this.tier = b.tier;
        this.maxLevel = b.maxLevel;
        this.prerequisites = Collections.unmodifiableList(new ArrayList<>(b.prerequisites));
        this.populationRequired = b.populationRequired;
        this.areaCost = b.areaCost;
        this.unique = b.unique;
        this.populationCapacity = b.populationCapacity;
        this.storageCapacity = b.storageCapacity;
        this.shelterCapacity = b.shelterCapacity;
        this.defenseRating = b.defenseRating;
        this.moraleBonus = b.moraleBonus;

        if (category == StructureCategory.EXTRACTOR && producedResource == null) {
            throw new IllegalArgumentException("Extractor " + id + " must declare a produced resource");
        }
        if (constructionMillis < 0) {
            throw new IllegalArgumentException("constructionMillis must be non-negative: " + id);
        }
        if (tier < 1 || maxLevel < 1) {
            throw new IllegalArgumentException("tier and maxLevel must be at least 1: " + id);
        }
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public StructureCategory getCategory() { return category; }
    public String getBuildingType() { return buildingType; }
    public ResourceType getProducedResource() { return producedResource; }
    public ResourceAmounts getCosts() { return costs; }
    public long getConstructionMillis() { return constructionMillis; }
    public int getTier() { return tier; }
    public int getMaxLevel() { return maxLevel; }
    public List<Prerequisite> getPrerequisites() { return prerequisites; }
    public int getPopulationRequired() { return populationRequired; }
    public int getAreaCost() { return areaCost; }
    public boolean isUnique() { return unique; }
    public int getPopulationCapacity() { return populationCapacity; }
    public int getStorageCapacity() { return storageCapacity; }
    public int getShelterCapacity() { return shelterCapacity; }
    public int getDefenseRating() { return defenseRating; }
    public int getMoraleBonus() { return moraleBonus; }

    public boolean isExtractor() {
        return category == StructureCategory.EXTRACTOR;
    }

    public boolean isBuildingType(String type) {
        return buildingType.equalsIgnoreCase(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructureDefinition)) return false;
        return id.equals(((StructureDefinition) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("StructureDefinition{id=%s, category=%s, tier=%d, maxLevel=%d}",
                id, category, tier, maxLevel);
    }

    public static class Builder {
        private String id;
        private String name;
        private StructureCategory category;
        private String buildingType;
        private ResourceType producedResource;
        private ResourceAmounts costs = ResourceAmounts.ZERO;
        private long constructionMillis;
        private int tier = 1;
        private int maxLevel = 1;
        private final List<Prerequisite> prerequisites = new ArrayList<>();
        private int populationRequired;
        private int areaCost;
        private boolean unique;
        private int populationCapacity;
        private int storageCapacity;
        private int shelterCapacity;
        private int defenseRating;
        private int moraleBonus;

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder category(StructureCategory category) { this.category = category; return this; }
        public Builder buildingType(String buildingType) { this.buildingType = buildingType; return this; }
        public Builder producedResource(ResourceType producedResource) { this.producedResource = producedResource; return this; }
        public Builder costs(ResourceAmounts costs) { this.costs = costs; return this; }
        public Builder constructionMillis(long constructionMillis) { this.constructionMillis = constructionMillis; return this; }
        public Builder tier(int tier) { this.tier = tier; return this; }
        public Builder maxLevel(int maxLevel) { this.maxLevel = maxLevel; return this; }
        public Builder prerequisite(Prerequisite prerequisite) { this.prerequisites.add(prerequisite); return this; }
        public Builder populationRequired(int populationRequired) { this.populationRequired = populationRequired; return this; }
        public Builder areaCost(int areaCost) { this.areaCost = areaCost; return this; }
        public Builder unique(boolean unique) { this.unique = unique; return this; }
        public Builder populationCapacity(int populationCapacity) { this.populationCapacity = populationCapacity; return this; }
        public Builder storageCapacity(int storageCapacity) { this.storageCapacity = storageCapacity; return this; }
        public Builder shelterCapacity(int shelterCapacity) { this.shelterCapacity = shelterCapacity; return this; }
        public Builder defenseRating(int defenseRating) { this.defenseRating = defenseRating; return this; }
        public Builder moraleBonus(int moraleBonus) { this.moraleBonus = moraleBonus; return this; }

        public StructureDefinition build() {
            return new StructureDefinition(this);
        }
    }
}
