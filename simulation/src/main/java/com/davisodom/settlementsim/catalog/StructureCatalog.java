package com.davisodom.settlementsim.catalog;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only source of structure definitions, biome efficiency and staffing tables.
 */
public interface StructureCatalog {

    Optional<StructureDefinition> findDefinition(String structureId);

    Collection<StructureDefinition> allDefinitions();

    /**
     * Efficiency table for a biome; unknown biomes are neutral.
     */
    BiomeEfficiency biomeEfficiency(String biome);

    Optional<StaffingRequirement> staffingRequirement(String structureId);

    /**
     * Version of the loaded tables, so callers can cache lookups.
     */
    int getVersion();
}
