package com.davisodom.settlementsim.population;

import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementStats;

/**
 * Computes the happiness factors of a settlement and blends them with the configured weights.
 */
public class HappinessCalculator {

    static final String HOUSE = "HOUSE";
    static final String TENT = "TENT";
    static final String WATCHTOWER = "WATCHTOWER";
    static final String HOSPITAL = "HOSPITAL";

    private final SimulationConfig.PopulationSettings settings;
    private final SettlementStats stats;

    public HappinessCalculator(SimulationConfig.PopulationSettings settings, SettlementStats stats) {
        this.settings = settings;
        this.stats = stats;
    }

    public HappinessFactors compute(Settlement settlement, ResourceAmounts balances, int capacity, long now) {
        int population = settlement.getPopulation().getCount();
        double sufficiency = resourceSufficiency(balances, population);
        double housing = housingQuality(settlement, population, capacity);
        double preparedness = disasterPreparedness(settlement, population);
        double trauma = recentTrauma(settlement, now);
        double morale = clamp(settings.baseMorale + stats.moraleBonus(settlement));
        double relations = clamp(settings.externalRelations);

        SimulationConfig.HappinessWeights w = settings.weights;
        double happiness = (sufficiency * w.sufficiency
                + housing * w.housing
                + preparedness * w.preparedness
                + trauma * w.trauma
                + morale * w.morale
                + relations * w.relations) / 100.0;

        return new HappinessFactors(sufficiency, housing, preparedness, trauma, morale, relations, clamp(happiness));
    }

    /**
     * Average of food and water supply, each as hours of supply against the target horizon.
     */
    public double resourceSufficiency(ResourceAmounts balances, int population) {
        if (population <= 0) {
            return 100.0;
        }
        double foodHours = balances.getUnits(ResourceType.FOOD) / (population * settings.foodPerPersonHour);
        double waterHours = balances.getUnits(ResourceType.WATER) / (population * settings.waterPerPersonHour);
        double food = Math.min(100.0, foodHours / settings.sufficiencyTargetHours * 100.0);
        double water = Math.min(100.0, waterHours / settings.sufficiencyTargetHours * 100.0);
        return (food + water) / 2.0;
    }

    public double housingQuality(Settlement settlement, int population, int capacity) {
        double score = 100.0;
        double occupancy = capacity > 0 ? (double) population / capacity : 1.0;
        if (occupancy > 0.9) {
            score -= 30;
        } else if (occupancy > 0.75) {
            score -= 15;
        } else if (occupancy < 0.5) {
            score += 10;
        }
        if (stats.hasBuildingType(settlement, HOUSE)) {
            score += 20;
        } else if (stats.hasBuildingType(settlement, TENT)) {
            score += 10;
        }
        return clamp(score);
    }

    public double disasterPreparedness(Settlement settlement, int population) {
        double score = 0;
        if (population > 0) {
            score += Math.min(1.0, (double) stats.shelterCapacity(settlement) / population) * 50;
        } else {
            score += 50;
        }
        if (stats.hasBuildingType(settlement, WATCHTOWER)) {
            score += 15;
        }
        if (stats.hasBuildingType(settlement, HOSPITAL)) {
            score += 15;
        }
        score += Math.min(20, stats.defenseRating(settlement) * 0.2);
        return clamp(score);
    }

    /**
     * 100 means untroubled. A disaster lowers it by its severity, recovering linearly.
     */
    public double recentTrauma(Settlement settlement, long now) {
        if (settlement.getLastDisasterAt() <= 0 || settlement.getLastDisasterSeverity() <= 0) {
            return 100.0;
        }
        long elapsed = Math.max(0, now - settlement.getLastDisasterAt());
        double recovery = Math.min(1.0, (double) elapsed / settings.traumaRecoveryMillis);
        return clamp(100.0 - settlement.getLastDisasterSeverity() * (1.0 - recovery));
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
