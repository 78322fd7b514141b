package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementStats;
import com.davisodom.settlementsim.settlements.Structure;

import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Damage and casualty formulas.
 *
 * Net damage for a settlement is {@code (severity - preparedness)} with a symmetric random
 * variance, clamped to 0-100. Each structure takes that damage reduced by the resistance of its
 * own building type. Casualties fall on the population not covered by shelters and are reduced
 * by a working hospital.
 */
public class DisasterDamageCalculator {

    static final String SHELTER = "SHELTER";
    static final String WATCHTOWER = "WATCHTOWER";
    static final String FORTRESS = "FORTRESS";
    static final String HOSPITAL = "HOSPITAL";

    private static final Map<String, Map<DisasterType, Double>> RESISTANCES = Map.of(
            "SEISMIC_FOUNDATION", Map.of(DisasterType.EARTHQUAKE, 0.6),
            "STORM_BARRIER", Map.of(DisasterType.FLOOD, 0.5, DisasterType.HURRICANE, 0.5),
            "FIREBREAK", Map.of(DisasterType.WILDFIRE, 0.6),
            "RESERVOIR", Map.of(DisasterType.DROUGHT, 0.5));
    private static final double FORTRESS_RESISTANCE = 0.3;

    private static final double HOSPITAL_BASE_SAVE_RATE = 0.5;
    private static final double HOSPITAL_SAVE_RATE_PER_LEVEL = 0.05;
    private static final double HOSPITAL_MAX_SAVE_RATE = 0.75;
    private static final double HOSPITAL_MIN_HEALTH = 20;

    private final StructureCatalog catalog;
    private final SettlementStats stats;
    private final SimulationConfig.DisasterSettings settings;

    public DisasterDamageCalculator(StructureCatalog catalog, SettlementStats stats,
                                    SimulationConfig.DisasterSettings settings) {
        this.catalog = catalog;
        this.stats = stats;
        this.settings = settings;
    }

    /**
     * Preparedness 0-100: shelter coverage (30), watchtower (5), type-specific defenses (30),
     * fortress (30), resilience (20).
     */
    public double preparedness(Settlement settlement, DisasterType type) {
        double score = 0;
        int population = settlement.getPopulation().getCount();
        if (population > 0) {
            double coverage = Math.min(1.0, (double) stats.shelterCapacity(settlement) / population);
            score += coverage * 30;
        }
        if (stats.hasBuildingType(settlement, WATCHTOWER)) {
            score += 5;
        }
        double defense = 0;
        for (Structure structure : settlement.getActiveStructures()) {
            defense += resistance(buildingTypeOf(structure), type) * 30;
        }
        score += Math.min(30, defense);
        if (stats.hasBuildingType(settlement, FORTRESS)) {
            score += 30;
        }
        score += Math.min(100, settlement.getResilience()) / 100.0 * 20;
        return Math.min(100, score);
    }

    /**
     * Total damage this disaster deals to the settlement over the whole impact phase.
     */
    public double netDamage(double severity, double preparedness, Random random) {
        double variance = (random.nextDouble() * 2 - 1) * settings.damageVariance;
        double damage = (severity - preparedness) * (1 + variance);
        return Math.max(0, Math.min(100, damage));
    }

    /**
     * Damage reduction for a building type, 0 when it has none.
     */
    public static double resistance(String buildingType, DisasterType type) {
        if (buildingType == null) {
            return 0;
        }
        if (FORTRESS.equals(buildingType)) {
            return FORTRESS_RESISTANCE;
        }
        Map<DisasterType, Double> specific = RESISTANCES.get(buildingType);
        return specific == null ? 0 : specific.getOrDefault(type, 0.0);
    }

    public double structureDamage(Structure structure, DisasterType type, double damage) {
        return damage * (1 - resistance(buildingTypeOf(structure), type));
    }

    /**
     * Expected casualties for a share of the net damage, before rounding.
     */
    public double casualties(Settlement settlement, DisasterType type, double damage) {
        int unsheltered = Math.max(0, settlement.getPopulation().getCount() - stats.shelterCapacity(settlement));
        double base = unsheltered * (damage / 100.0) * type.getCasualtyMultiplier();
        return base * (1 - hospitalSaveRate(settlement));
    }

    public double hospitalSaveRate(Settlement settlement) {
        Optional<Structure> hospital = stats.bestOfType(settlement, HOSPITAL);
        if (hospital.isEmpty() || hospital.get().getHealth() <= HOSPITAL_MIN_HEALTH) {
            return 0;
        }
        double rate = HOSPITAL_BASE_SAVE_RATE + (hospital.get().getLevel() - 1) * HOSPITAL_SAVE_RATE_PER_LEVEL;
        return Math.min(HOSPITAL_MAX_SAVE_RATE, rate);
    }

    private String buildingTypeOf(Structure structure) {
        return catalog.findDefinition(structure.getDefinitionId())
                .map(StructureDefinition::getBuildingType)
                .orElse(null);
    }
}
