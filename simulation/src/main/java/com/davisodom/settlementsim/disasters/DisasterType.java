package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.economy.ResourceType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Disaster kinds with their casualty, repair and production characteristics.
 */
public enum DisasterType {
    EARTHQUAKE(1.0, 0.25,
            penalties(0, 0, 0.8, 0.5, 0.5),
            List.of("Reinforce structures with seismic foundations", "Review emergency shelter capacity")),
    TSUNAMI(1.5, 0.30,
            penalties(0.5, 0.8, 0.6, 0, 0),
            List.of("Evacuate coastal areas", "Ensure population shelter capacity")),
    HURRICANE(1.2, 0.35,
            penalties(0.7, 0.8, 0.6, 0, 0),
            List.of("Build storm barriers", "Stockpile food and water")),
    FLOOD(0.8, 0.30,
            penalties(0.7, 0.7, 0.7, 0.7, 0.7),
            List.of("Build storm barriers", "Move stockpiles to higher ground")),
    WILDFIRE(0.9, 0.15,
            penalties(0.8, 0, 0.6, 0, 0),
            List.of("Clear firebreaks around the settlement", "Stockpile water")),
    DROUGHT(0.6, 0.20,
            penalties(0.5, 0.7, 0, 0, 0),
            List.of("Build a reservoir", "Ration water consumption"));

    private final double casualtyMultiplier;
    private final double repairMultiplier;
    private final Map<ResourceType, Double> productionPenalties;
    private final List<String> recommendedActions;

    DisasterType(double casualtyMultiplier, double repairMultiplier,
                 Map<ResourceType, Double> productionPenalties, List<String> recommendedActions) {
        this.casualtyMultiplier = casualtyMultiplier;
        this.repairMultiplier = repairMultiplier;
        this.productionPenalties = productionPenalties;
        this.recommendedActions = recommendedActions;
    }

    public double getCasualtyMultiplier() {
        return casualtyMultiplier;
    }

    public double getRepairMultiplier() {
        return repairMultiplier;
    }

    /**
     * Production multiplier at full intensity; 1.0 when the resource is unaffected.
     */
    public double productionPenalty(ResourceType resource) {
        return productionPenalties.getOrDefault(resource, 1.0);
    }

    public Map<ResourceType, Double> getProductionPenalties() {
        return productionPenalties;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    // Zero means unaffected
    private static Map<ResourceType, Double> penalties(double food, double water, double wood, double stone, double ore) {
        EnumMap<ResourceType, Double> map = new EnumMap<>(ResourceType.class);
        double[] values = {food, water, wood, stone, ore};
        ResourceType[] types = {ResourceType.FOOD, ResourceType.WATER, ResourceType.WOOD, ResourceType.STONE, ResourceType.ORE};
        for (int i = 0; i < types.length; i++) {
            if (values[i] > 0) {
                map.put(types[i], values[i]);
            }
        }
        return map;
    }
}
