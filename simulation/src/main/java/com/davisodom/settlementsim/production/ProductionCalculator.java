package com.davisodom.settlementsim.production;

import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.economy.ResourceType;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pure production/consumption math. No side effects, no clamping.
 *
 * Per resource with non-zero tile quality:
 * <pre>
 * base       = quality/100 * biomeEfficiency * tileModifier * resourceModifier * baseRate
 * production = base * tier * health/100 * staffing * elapsedTicks * worldMultiplier
 * </pre>
 * Only the best extractor of a resource counts: highest level, then earliest creation, then
 * lowest id. Without an extractor tier, health and staffing are all 1, so the base rate alone
 * keeps a settlement from producing nothing.
 *
 * Consumption is population-driven for food and water and structure-count-driven for wood,
 * stone and ore.
 */
public class ProductionCalculator {

    static final Comparator<ExtractorSnapshot> BEST_EXTRACTOR = Comparator
            .comparingInt(ExtractorSnapshot::level).reversed()
            .thenComparingLong(ExtractorSnapshot::createdAt)
            .thenComparing(ExtractorSnapshot::structureId);

    private final SimulationConfig.ProductionSettings settings;

    public ProductionCalculator(SimulationConfig.ProductionSettings settings) {
        this.settings = settings;
    }

    public ProductionBreakdown calculate(ProductionInput input) {
        Map<ResourceType, ProductionBreakdown.ResourceLine> lines = new EnumMap<>(ResourceType.class);
        long ticks = input.elapsedTicks();

        for (ResourceType type : ResourceType.values()) {
            int quality = input.tile().qualityFor(type);
            if (quality <= 0) {
                continue;
            }
            double base = (quality / 100.0)
                    * input.biomeEfficiency().forResource(type)
                    * input.tile().baseProductionModifier()
                    * input.resourceModifier(type)
                    * settings.baseRate;

            Optional<ExtractorSnapshot> best = selectExtractor(input, type);
            double tier = best.map(e -> TierMultiplier.forLevel(e.level())).orElse(1.0);
            double health = best.map(e -> healthModifier(e.health())).orElse(1.0);
            double staffing = best.map(ExtractorSnapshot::staffingMultiplier).orElse(1.0);

            double production = base * tier * health * staffing * ticks * input.worldProductionMultiplier();
            lines.put(type, new ProductionBreakdown.ResourceLine(type, quality, base, tier, health, staffing,
                    best.map(ExtractorSnapshot::structureId).orElse(null), production));
        }

        return new ProductionBreakdown(ticks, lines, consumption(input));
    }

    /**
     * The extractor whose level counts for a resource, if any.
     */
    public Optional<ExtractorSnapshot> selectExtractor(ProductionInput input, ResourceType type) {
        return input.extractors().stream()
                .filter(e -> e.resource() == type)
                .min(BEST_EXTRACTOR);
    }

    public static double healthModifier(double health) {
        return Math.max(0.0, Math.min(100.0, health)) / 100.0;
    }

    private Map<ResourceType, Double> consumption(ProductionInput input) {
        Map<ResourceType, Double> consumption = new EnumMap<>(ResourceType.class);
        double scale = input.elapsedTicks() * input.worldConsumptionMultiplier();
        int people = input.population();
        int structures = input.structureCount();
        consumption.put(ResourceType.FOOD, people * settings.foodPerPerson * scale);
        consumption.put(ResourceType.WATER, people * settings.waterPerPerson * scale);
        consumption.put(ResourceType.WOOD, structures * settings.woodPerStructure * scale);
        consumption.put(ResourceType.STONE, structures * settings.stonePerStructure * scale);
        consumption.put(ResourceType.ORE, structures * settings.orePerStructure * scale);
        return consumption;
    }
}
