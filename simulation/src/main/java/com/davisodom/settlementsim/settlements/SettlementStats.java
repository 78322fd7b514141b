package com.davisodom.settlementsim.settlements;

import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.catalog.StructureDefinition;

import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Derived figures over a settlement's active structures, read from catalog modifiers.
 * Modifier contributions scale with structure level.
 */
public class SettlementStats {

    private final StructureCatalog catalog;

    public SettlementStats(StructureCatalog catalog) {
        this.catalog = catalog;
    }

    public int housingCapacity(Settlement settlement) {
        return sum(settlement, StructureDefinition::getPopulationCapacity);
    }

    public int shelterCapacity(Settlement settlement) {
        return sum(settlement, StructureDefinition::getShelterCapacity);
    }

    public int defenseRating(Settlement settlement) {
        return sum(settlement, StructureDefinition::getDefenseRating);
    }

    public int moraleBonus(Settlement settlement) {
        return sum(settlement, StructureDefinition::getMoraleBonus);
    }

    public boolean hasBuildingType(Settlement settlement, String buildingType) {
        return highestLevelOfType(settlement, buildingType) > 0;
    }

    /**
     * Highest level among active structures of a building type, 0 if none.
     */
    public int highestLevelOfType(Settlement settlement, String buildingType) {
        return bestOfType(settlement, buildingType).map(Structure::getLevel).orElse(0);
    }

    /**
     * Highest-level active structure of a building type.
     */
    public Optional<Structure> bestOfType(Settlement settlement, String buildingType) {
        Structure best = null;
        for (Structure structure : settlement.getActiveStructures()) {
            boolean matches = catalog.findDefinition(structure.getDefinitionId())
                    .map(d -> d.isBuildingType(buildingType))
                    .orElse(false);
            if (matches && (best == null || structure.getLevel() > best.getLevel())) {
                best = structure;
            }
        }
        return Optional.ofNullable(best);
    }

    private int sum(Settlement settlement, ToIntFunction<StructureDefinition> modifier) {
        int total = 0;
        for (Structure structure : settlement.getActiveStructures()) {
            Optional<StructureDefinition> definition = catalog.findDefinition(structure.getDefinitionId());
            if (definition.isPresent()) {
                total += modifier.applyAsInt(definition.get()) * structure.getLevel();
            }
        }
        return total;
    }
}
