package com.davisodom.settlementsim.production;

import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.settlements.Settlement;

import java.util.Map;

/**
 * Supplies temporary per-resource production multipliers for a settlement.
 */
@FunctionalInterface
public interface ProductionModifierSource {

    ProductionModifierSource NONE = (settlement, now) -> Map.of();

    Map<ResourceType, Double> productionModifiers(Settlement settlement, long now);
}
