package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementStats;
import com.davisodom.settlementsim.settlements.Structure;

import java.util.*;
import java.util.logging.Logger;

/**
 * Slow free repair for settlements with a workshop.
 *
 * Every repair interval each damaged structure at or above the minimum health regains a fixed
 * amount, capped at full health. Badly damaged structures need a paid repair. Nothing is restored
 * while a disaster is in impact over the settlement; those rounds are skipped, not deferred.
 */
public class PassiveRepairService {

    static final String WORKSHOP = "WORKSHOP";

    private final Logger logger;
    private final SettlementStats stats;
    private final DisasterCoordinator disasterCoordinator;
    private final SimulationConfig.DisasterSettings settings;

    public PassiveRepairService(Logger logger, SettlementStats stats, DisasterCoordinator disasterCoordinator,
                                SimulationConfig.DisasterSettings settings) {
        this.logger = logger;
        this.stats = stats;
        this.disasterCoordinator = disasterCoordinator;
        this.settings = settings;
    }

    public static boolean isEligible(Structure structure, double minHealth) {
        return !structure.isDestroyed()
                && structure.getHealth() >= minHealth
                && structure.getHealth() < Structure.MAX_HEALTH;
    }

    /**
     * Apply the repair rounds due since the last one. Caller holds the settlement lock.
     */
    public List<SimulationEvent> apply(SettlementContext context, long now) {
        Settlement settlement = context.getSettlement();
        long rounds = (now - settlement.getLastPassiveRepairAt()) / settings.passiveRepairIntervalMillis;
        if (rounds <= 0) {
            return List.of();
        }
        settlement.setLastPassiveRepairAt(settlement.getLastPassiveRepairAt() + rounds * settings.passiveRepairIntervalMillis);

        if (!stats.hasBuildingType(settlement, WORKSHOP) || disasterCoordinator.isUnderImpact(settlement.getId())) {
            return List.of();
        }

        double amount = rounds * settings.passiveRepairAmount;
        List<Map<String, Object>> repaired = new ArrayList<>();
        for (Structure structure : settlement.getActiveStructures()) {
            if (!isEligible(structure, settings.passiveRepairMinHealth)) continue;
            double before = structure.getHealth();
            double restored = structure.restoreHealth(amount);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("structureId", structure.getId().toString());
            entry.put("definitionId", structure.getDefinitionId());
            entry.put("previousHealth", before);
            entry.put("health", structure.getHealth());
            entry.put("restored", restored);
            repaired.add(entry);
        }
        if (repaired.isEmpty()) {
            return List.of();
        }
        logger.fine(String.format("Passive repair restored %d structure(s) in %s", repaired.size(), settlement.getId()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rounds", rounds);
        payload.put("structures", repaired);
        return List.of(SimulationEvent.settlement(EventType.PASSIVE_REPAIR_APPLIED, settlement.getId(), now, payload));
    }
}
