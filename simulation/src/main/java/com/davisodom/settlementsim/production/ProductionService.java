package com.davisodom.settlementsim.production;

import com.davisodom.settlementsim.DebugFlags;
import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.Structure;

import java.util.*;

/**
 * Applies production and consumption for the whole ticks elapsed since a settlement's last
 * collection.
 *
 * Partial ticks are carried forward: the collection timestamp advances by exactly
 * {@code ticks * tickMillis}, never to "now". Positive net is credited through the ledger
 * (subject to storage capacity); negative net is consumed through the ledger, flooring at zero.
 */
public class ProductionService {

    private final StructureCatalog catalog;
    private final ResourceLedger ledger;
    private final ProductionCalculator calculator;
    private final SimulationConfig config;
    private volatile ProductionModifierSource modifierSource = ProductionModifierSource.NONE;

    public ProductionService(StructureCatalog catalog, ResourceLedger ledger,
                             ProductionCalculator calculator, SimulationConfig config) {
        this.catalog = catalog;
        this.ledger = ledger;
        this.calculator = calculator;
        this.config = config;
    }

    public void setModifierSource(ProductionModifierSource modifierSource) {
        this.modifierSource = Objects.requireNonNull(modifierSource, "modifierSource cannot be null");
    }

    /**
     * Whole ticks between two instants, truncated.
     */
    public long elapsedTicks(long fromMillis, long toMillis) {
        if (toMillis <= fromMillis) {
            return 0;
        }
        return (toMillis - fromMillis) / config.tick.tickMillis;
    }

    /**
     * Build the calculator input for a settlement. Caller holds the settlement lock.
     */
    public ProductionInput buildInput(Settlement settlement, long elapsedTicks, long now) {
        List<ExtractorSnapshot> extractors = new ArrayList<>();
        for (Structure structure : settlement.getActiveStructures()) {
            if (!structure.isExtractor()) continue;
            Optional<StructureDefinition> definition = catalog.findDefinition(structure.getDefinitionId());
            if (definition.isEmpty() || definition.get().getProducedResource() == null) continue;
            extractors.add(new ExtractorSnapshot(structure.getId(), definition.get().getProducedResource(),
                    structure.getLevel(), structure.getHealth(), structure.getCreatedAt(),
                    settlement.getStaffingMultiplier(structure.getId())));
        }
        SimulationConfig.WorldSettings world = config.world(settlement.getWorldName());
        return new ProductionInput(
                settlement.getTile(),
                catalog.biomeEfficiency(settlement.getTile().biome()),
                extractors,
                settlement.getPopulation().getCount(),
                settlement.getActiveStructures().size(),
                world.productionMultiplier,
                world.consumptionMultiplier,
                elapsedTicks,
                modifierSource.productionModifiers(settlement, now));
    }

    /**
     * Collect production up to {@code now}. Caller holds the settlement lock.
     */
    public CollectionResult collect(SettlementContext context, long now) {
        Settlement settlement = context.getSettlement();
        long ticks = elapsedTicks(settlement.getLastCollectedAt(), now);
        if (ticks == 0) {
            return CollectionResult.empty();
        }

        ProductionBreakdown breakdown = calculator.calculate(buildInput(settlement, ticks, now));

        ResourceAmounts.Builder gains = ResourceAmounts.builder();
        ResourceAmounts.Builder upkeep = ResourceAmounts.builder();
        for (Map.Entry<ResourceType, Double> entry : breakdown.net().entrySet()) {
            double net = entry.getValue();
            if (net > 0) {
                gains.millis(entry.getKey(), (long) Math.floor(net * ResourceAmounts.SCALE));
            } else if (net < 0) {
                upkeep.millis(entry.getKey(), (long) Math.ceil(-net * ResourceAmounts.SCALE));
            }
        }

        UUID id = settlement.getId();
        ResourceAmounts credited = ledger.credit(id, gains.build(), "production");
        ResourceAmounts consumed = upkeep.build();
        ResourceAmounts unmet = ledger.consume(id, consumed, "upkeep");
        settlement.setLastCollectedAt(settlement.getLastCollectedAt() + ticks * config.tick.tickMillis);

        DebugFlags.debugProduction(String.format("%s: %d tick(s), credited %s, consumed %s, unmet %s",
                id, ticks, credited, consumed, unmet));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticks", ticks);
        payload.put("credited", credited.toUnitsMap());
        payload.put("consumed", consumed.toUnitsMap());
        payload.put("unmet", unmet.toUnitsMap());
        payload.put("balances", ledger.getBalances(id).toUnitsMap());
        SimulationEvent event = SimulationEvent.settlement(EventType.RESOURCES_UPDATED, id, now, payload);

        return new CollectionResult(ticks, breakdown, credited, consumed, unmet, List.of(event));
    }

    /**
     * Outcome of one collection.
     */
    public record CollectionResult(long elapsedTicks, ProductionBreakdown breakdown, ResourceAmounts credited,
                                   ResourceAmounts consumed, ResourceAmounts unmet,
                                   List<SimulationEvent> events) {

        public static CollectionResult empty() {
            return new CollectionResult(0, new ProductionBreakdown(0, Map.of(), Map.of()),
                    ResourceAmounts.ZERO, ResourceAmounts.ZERO, ResourceAmounts.ZERO, List.of());
        }
    }
}
