package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.economy.ResourceAmounts;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Totals reported when a disaster enters its aftermath.
 */
public record DisasterSummary(UUID eventId, DisasterType type, double severity, SeverityTier tier,
                              double totalDamage, int structuresDamaged, int structuresDestroyed,
                              int casualties, ResourceAmounts estimatedRepairCost, long repairWindowEndsAt) {

    public static DisasterSummary of(DisasterEvent event) {
        return new DisasterSummary(event.getId(), event.getType(), event.getSeverity(), event.getTier(),
                event.getTotalDamage(), event.getDamagedStructures().size(), event.getDestroyedStructures().size(),
                event.getCasualties(), event.getEstimatedRepairCost(), event.getRepairWindowEndsAt());
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("eventId", eventId.toString());
        map.put("type", type.name());
        map.put("severity", severity);
        map.put("tier", tier.name());
        map.put("totalDamage", totalDamage);
        map.put("structuresDamaged", structuresDamaged);
        map.put("structuresDestroyed", structuresDestroyed);
        map.put("casualties", casualties);
        map.put("estimatedRepairCost", estimatedRepairCost.toUnitsMap());
        map.put("repairWindowEndsAt", repairWindowEndsAt);
        return map;
    }
}
