package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.settlements.Structure;

/**
 * Repair pricing: {@code ceil(baseCost x multiplier x healthMissing / 10)} per resource.
 */
public class RepairCostCalculator {

    /** Multiplier when no disaster is on record for the settlement. */
    public static final double DEFAULT_MULTIPLIER = 0.2;

    public ResourceAmounts cost(StructureDefinition definition, Structure structure, double multiplier, double discount) {
        double missing = Structure.MAX_HEALTH - structure.getHealth();
        if (missing <= 0) {
            return ResourceAmounts.ZERO;
        }
        ResourceAmounts.Builder builder = ResourceAmounts.builder();
        for (ResourceType type : ResourceType.values()) {
            double base = definition.getCosts().getUnits(type);
            if (base <= 0) continue;
            double units = Math.ceil(base * multiplier * missing / 10.0);
            if (discount > 0) {
                units = Math.ceil(units * (1 - discount));
            }
            builder.units(type, units);
        }
        return builder.build();
    }
}
