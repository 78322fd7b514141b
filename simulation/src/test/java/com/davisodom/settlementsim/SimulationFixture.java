package com.davisodom.settlementsim;

import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.catalog.YamlStructureCatalog;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementService;
import com.davisodom.settlementsim.settlements.SettlementStats;
import com.davisodom.settlementsim.settlements.Structure;
import com.davisodom.settlementsim.settlements.Tile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Shared wiring for tests: default config, the bundled catalog, a ledger and a settlement registry.
 */
public class SimulationFixture {

    public static final long T0 = 1_700_000_000_000L;

    public final Logger logger = Logger.getLogger("SimulationTest");
    public final SimulationConfig config;
    public final YamlStructureCatalog catalog;
    public final ResourceLedger ledger;
    public final SettlementService settlements;
    public final SettlementStats stats;

    private SimulationFixture(SimulationConfig config) {
        this.config = config;
        try {
            this.catalog = new YamlStructureCatalog(logger).loadFromClasspath("catalog/structures.yml");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        this.ledger = new ResourceLedger(logger);
        this.settlements = new SettlementService(logger, catalog, ledger, config);
        this.stats = new SettlementStats(catalog);
    }

    public static SimulationFixture create() {
        try {
            return new SimulationFixture(SimulationConfig.loadDefaults());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Tile tile(String biome, int x, int y, Map<ResourceType, Integer> quality) {
        return new Tile(UUID.randomUUID(), biome, "heartland", x, y, quality, 1.0, 4);
    }

    public static Tile grassland(int x, int y) {
        return tile("GRASSLAND", x, y, Map.of(ResourceType.FOOD, 60, ResourceType.WATER, 60,
                ResourceType.WOOD, 50, ResourceType.STONE, 40, ResourceType.ORE, 20));
    }

    public SettlementContext settlement(UUID ownerId, int population, ResourceAmounts starting) {
        return settlements.createSettlement(ownerId, "Testburg", "overworld", grassland(0, 0), population, starting, T0);
    }

    public SettlementContext settlement(UUID ownerId, Tile tile, int population, ResourceAmounts starting) {
        return settlements.createSettlement(ownerId, "Testburg", "overworld", tile, population, starting, T0);
    }

    /**
     * Add a finished building directly, bypassing the construction queue.
     */
    public Structure addBuilding(SettlementContext context, String definitionId, int level) {
        StructureDefinition definition = catalog.findDefinition(definitionId).orElseThrow();
        Structure structure = Structure.builder()
                .settlementId(context.getSettlement().getId())
                .definitionId(definitionId)
                .category(definition.getCategory())
                .level(level)
                .createdAt(T0)
                .build();
        context.getSettlement().addStructure(structure);
        settlements.refreshStorageCapacity(context);
        context.markStaffingDirty();
        return structure;
    }

    /**
     * Add a finished extractor on the settlement's own tile.
     */
    public Structure addExtractor(SettlementContext context, String definitionId, int slot, int level, long createdAt) {
        StructureDefinition definition = catalog.findDefinition(definitionId).orElseThrow();
        Structure structure = Structure.builder()
                .settlementId(context.getSettlement().getId())
                .definitionId(definitionId)
                .category(definition.getCategory())
                .tileId(context.getSettlement().getTile().id())
                .slotPosition(slot)
                .level(level)
                .createdAt(createdAt)
                .build();
        context.getSettlement().addStructure(structure);
        context.markStaffingDirty();
        return structure;
    }

    public static ResourceAmounts plenty() {
        return ResourceAmounts.ofUnits(Map.of(ResourceType.FOOD, 500, ResourceType.WATER, 500,
                ResourceType.WOOD, 900, ResourceType.STONE, 900, ResourceType.ORE, 500));
    }
}
