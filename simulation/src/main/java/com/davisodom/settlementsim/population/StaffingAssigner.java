package com.davisodom.settlementsim.population;

import com.davisodom.settlementsim.catalog.StaffingRequirement;
import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.Structure;

import java.util.*;

/**
 * Assigns a settlement's headcount to structures that need workers.
 *
 * Pass one fills required slots by descending priority (ties: earliest built first) and records
 * any shortfall as understaffed. Pass two spends the remaining headcount on optional slots by
 * descending bonus per worker. A structure below its requirement gets multiplier 1; at or above,
 * {@code 1 + (assigned - required) * bonusPerWorker}.
 */
public class StaffingAssigner {

    private final StructureCatalog catalog;

    public StaffingAssigner(StructureCatalog catalog) {
        this.catalog = catalog;
    }

    public StaffingResult assign(Settlement settlement) {
        List<Slot> slots = new ArrayList<>();
        for (Structure structure : settlement.getActiveStructures()) {
            catalog.staffingRequirement(structure.getDefinitionId())
                    .ifPresent(req -> slots.add(new Slot(structure, req)));
        }
        slots.sort(Comparator.comparingInt((Slot s) -> s.requirement.priority()).reversed()
                .thenComparingLong(s -> s.structure.getCreatedAt())
                .thenComparing(s -> s.structure.getId()));

        int available = settlement.getPopulation().getCount();
        Map<UUID, Integer> assigned = new LinkedHashMap<>();
        Map<UUID, Integer> understaffed = new LinkedHashMap<>();

        for (Slot slot : slots) {
            int give = Math.min(slot.requirement.required(), available);
            available -= give;
            assigned.put(slot.structure.getId(), give);
            if (give < slot.requirement.required()) {
                understaffed.put(slot.structure.getId(), slot.requirement.required() - give);
            }
        }

        List<Slot> optional = new ArrayList<>(slots);
        optional.sort(Comparator.comparingDouble((Slot s) -> s.requirement.bonusPerWorker()).reversed()
                .thenComparing(Comparator.comparingInt((Slot s) -> s.requirement.priority()).reversed()));
        for (Slot slot : optional) {
            if (available == 0) break;
            if (understaffed.containsKey(slot.structure.getId())) continue;
            int give = Math.min(slot.requirement.optional(), available);
            available -= give;
            assigned.merge(slot.structure.getId(), give, Integer::sum);
        }

        Map<UUID, Double> multipliers = new HashMap<>();
        for (Slot slot : slots) {
            int workers = assigned.getOrDefault(slot.structure.getId(), 0);
            multipliers.put(slot.structure.getId(), multiplier(workers, slot.requirement));
        }
        return new StaffingResult(assigned, understaffed, multipliers, available);
    }

    /**
     * Compute and store assignments on the settlement. Caller holds the settlement lock.
     */
    public StaffingResult apply(Settlement settlement) {
        StaffingResult result = assign(settlement);
        for (Structure structure : settlement.getStructures()) {
            structure.setPopulationAssigned(structure.isDestroyed()
                    ? 0
                    : result.assigned().getOrDefault(structure.getId(), 0));
        }
        settlement.applyStaffing(result.multipliers(), result.understaffed());
        return result;
    }

    public static double multiplier(int workers, StaffingRequirement requirement) {
        if (workers < requirement.required()) {
            return 1.0;
        }
        int extra = Math.min(workers, requirement.maxWorkers()) - requirement.required();
        return 1.0 + extra * requirement.bonusPerWorker();
    }

    private static final class Slot {
        final Structure structure;
        final StaffingRequirement requirement;

        Slot(Structure structure, StaffingRequirement requirement) {
            this.structure = structure;
            this.requirement = requirement;
        }
    }

    /**
     * @param unassigned headcount left idle
     */
    public record StaffingResult(Map<UUID, Integer> assigned, Map<UUID, Integer> understaffed,
                                 Map<UUID, Double> multipliers, int unassigned) {
    }
}
