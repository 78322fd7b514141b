package com.davisodom.settlementsim.construction;

import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.Structure;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default area accounting.
 *
 * Area capacity is {@code baseAreaCapacity + areaPerTownHallLevel * townHallLevel}; area used
 * counts active buildings and buildings already queued. Queued items count so two submissions
 * cannot both claim the last free area.
 */
public class SettlementAreaValidator implements AreaValidator {

    public static final String TOWN_HALL = "TOWN_HALL";

    private final StructureCatalog catalog;
    private final SimulationConfig.ConstructionSettings settings;

    public SettlementAreaValidator(StructureCatalog catalog, SimulationConfig.ConstructionSettings settings) {
        this.catalog = catalog;
        this.settings = settings;
    }

    @Override
    public void check(Settlement settlement, StructureDefinition definition) {
        if (definition.getTier() > settlement.getTier()) {
            throw new SimulationException(ErrorCode.TIER_TOO_LOW,
                    String.format("%s requires tier %d, settlement is tier %d",
                            definition.getName(), definition.getTier(), settlement.getTier()),
                    Map.of("requiredTier", definition.getTier(), "settlementTier", settlement.getTier()));
        }

        if (definition.isUnique()
                && (settlement.highestLevelOf(definition.getId()) > 0
                    || settlement.getQueue().containsDefinition(definition.getId()))) {
            throw new SimulationException(ErrorCode.UNIQUE_STRUCTURE_EXISTS,
                    definition.getName() + " can only be built once",
                    Map.of("structureId", definition.getId()));
        }

        int used = areaUsed(settlement);
        int capacity = areaCapacity(settlement);
        if (used + definition.getAreaCost() > capacity) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("areaUsed", used);
            details.put("areaCapacity", capacity);
            details.put("areaRequired", definition.getAreaCost());
            throw new SimulationException(ErrorCode.AREA_EXCEEDED,
                    String.format("Not enough area for %s: %d used of %d, needs %d",
                            definition.getName(), used, capacity, definition.getAreaCost()),
                    details);
        }
    }

    public int areaUsed(Settlement settlement) {
        int used = 0;
        for (Structure structure : settlement.getActiveStructures()) {
            used += areaCostOf(structure.getDefinitionId());
        }
        for (ConstructionQueueItem item : settlement.getQueue().getItems()) {
            if (!item.isUpgrade()) {
                used += areaCostOf(item.getDefinitionId());
            }
        }
        return used;
    }

    public int areaCapacity(Settlement settlement) {
        return settings.baseAreaCapacity + settings.areaPerTownHallLevel * townHallLevel(catalog, settlement);
    }

    /**
     * Level of the settlement's active town hall, 0 without one.
     */
    public static int townHallLevel(StructureCatalog catalog, Settlement settlement) {
        return settlement.getActiveStructures().stream()
                .filter(s -> catalog.findDefinition(s.getDefinitionId())
                        .map(d -> d.isBuildingType(TOWN_HALL))
                        .orElse(false))
                .mapToInt(Structure::getLevel)
                .max()
                .orElse(0);
    }

    private int areaCostOf(String definitionId) {
        return catalog.findDefinition(definitionId)
                .filter(d -> !d.isExtractor())
                .map(StructureDefinition::getAreaCost)
                .orElse(0);
    }
}
