package com.davisodom.settlementsim.population;

import com.davisodom.settlementsim.DebugFlags;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.settlements.PopulationRecord;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementStats;

import java.util.*;
import java.util.logging.Logger;

/**
 * Population growth, immigration and emigration, evaluated once per growth interval.
 *
 * Evaluation order:
 * - happiness from the weighted factors; an empty food or water store applies the starvation
 *   penalty and caps happiness at the starvation ceiling
 * - natural growth scaled by happiness (none while starving)
 * - immigration above the high threshold while below capacity
 * - emigration after a streak of evaluations below the low threshold
 *
 * Starvation never kills directly. Headcount always ends within {@code [0, capacity]}.
 */
public class PopulationEngine {

    private final Logger logger;
    private final SimulationConfig.PopulationSettings settings;
    private final SettlementStats stats;
    private final HappinessCalculator happinessCalculator;
    private final ResourceLedger ledger;
    private final Random random;

    public PopulationEngine(Logger logger, SimulationConfig.PopulationSettings settings, SettlementStats stats,
                            HappinessCalculator happinessCalculator, ResourceLedger ledger, Random random) {
        this.logger = logger;
        this.settings = settings;
        this.stats = stats;
        this.happinessCalculator = happinessCalculator;
        this.ledger = ledger;
        this.random = random;
    }

    /**
     * Housing-derived population ceiling.
     */
    public int capacity(Settlement settlement) {
        return settings.baseCapacity + stats.housingCapacity(settlement);
    }

    public boolean isDue(Settlement settlement, long now) {
        return now - settlement.getPopulation().getLastGrowthAt() >= settings.growthIntervalMillis;
    }

    /**
     * Run one growth evaluation if the interval has elapsed. Caller holds the settlement lock.
     */
    public List<SimulationEvent> evaluate(SettlementContext context, long now) {
        Settlement settlement = context.getSettlement();
        if (!isDue(settlement, now)) {
            return List.of();
        }
        PopulationRecord record = settlement.getPopulation();
        int before = record.getCount();
        double happinessBefore = record.getHappiness();
        int capacity = capacity(settlement);
        List<String> changes = new ArrayList<>();

        if (before > capacity) {
            record.setCount(before, capacity);
            changes.add("overcrowding");
        }

        ResourceAmounts balances = ledger.getBalances(settlement.getId());
        HappinessFactors factors = happinessCalculator.compute(settlement, balances, capacity, now);
        double happiness = factors.happiness();
        boolean starving = balances.getMillis(ResourceType.FOOD) == 0 || balances.getMillis(ResourceType.WATER) == 0;
        if (starving && record.getCount() > 0) {
            happiness = Math.min(happiness - settings.starvationPenalty, settings.starvationCeiling);
            changes.add("starvation");
        } else {
            starving = false;
        }
        record.setHappiness(happiness);
        happiness = record.getHappiness();

        if (!starving) {
            int births = naturalGrowth(record.getCount(), happiness);
            if (births > 0) {
                record.setCount(record.getCount() + births, capacity);
                changes.add("growth");
            }
        }

        if (happiness > settings.highThreshold && record.getCount() < capacity) {
            double happinessFactor = (happiness - settings.highThreshold) / (100.0 - settings.highThreshold);
            double capacityFactor = 1.0 - (double) record.getCount() / capacity;
            if (random.nextDouble() < settings.immigrationChance * happinessFactor * capacityFactor) {
                int arrivals = between(settings.immigrationMin, settings.immigrationMax);
                record.setCount(record.getCount() + arrivals, capacity);
                changes.add("immigration");
            }
        }

        if (happiness < settings.lowThreshold) {
            record.setLowHappinessStreak(record.getLowHappinessStreak() + 1);
            if (record.getLowHappinessStreak() >= settings.emigrationStreak && record.getCount() > 1) {
                double unhappiness = (settings.lowThreshold - happiness) / settings.lowThreshold;
                if (random.nextDouble() < settings.emigrationChance * unhappiness) {
                    int cap = Math.max(1, (int) Math.floor(record.getCount() * settings.emigrationMaxFraction));
                    int leaving = Math.min(between(settings.emigrationMin, settings.emigrationMax), cap);
                    leaving = Math.min(leaving, record.getCount() - 1);
                    record.remove(leaving);
                    changes.add("emigration");
                }
            }
        } else {
            record.setLowHappinessStreak(0);
        }

        record.setLastGrowthAt(now);
        int after = record.getCount();
        if (after != before) {
            context.markStaffingDirty();
        }
        DebugFlags.debugPopulation(String.format("%s: %d -> %d (cap %d), happiness %.1f %s",
                settlement.getId(), before, after, capacity, happiness, changes));

        if (after == before && Math.abs(happiness - happinessBefore) < 1e-9) {
            return List.of();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("previousCount", before);
        payload.put("count", after);
        payload.put("capacity", capacity);
        payload.put("happiness", happiness);
        payload.put("factors", factors.asMap());
        payload.put("changes", changes);
        return List.of(SimulationEvent.settlement(EventType.POPULATION_CHANGED, settlement.getId(), now, payload));
    }

    /**
     * Apply disaster casualties as one decrement. Caller holds the settlement lock.
     *
     * @return people actually removed
     */
    public int applyCasualties(SettlementContext context, int casualties) {
        int removed = context.getSettlement().getPopulation().remove(casualties);
        if (removed > 0) {
            context.markStaffingDirty();
            logger.info(String.format("Settlement %s lost %d to disaster casualties",
                    context.getSettlement().getId(), removed));
        }
        return removed;
    }

    /**
     * Expected births {@code count * rate}, with the fractional part realised by chance.
     */
    int naturalGrowth(int count, double happiness) {
        double expected = count * growthRate(happiness);
        int births = (int) Math.floor(expected);
        if (random.nextDouble() < expected - births) {
            births++;
        }
        return births;
    }

    /**
     * Per-interval growth rate: none below the low threshold, half rate below 50,
     * full rate up to the high threshold and 1.5x above it.
     */
    public double growthRate(double happiness) {
        double factor;
        if (happiness < settings.lowThreshold) {
            factor = 0.0;
        } else if (happiness < 50) {
            factor = 0.5;
        } else if (happiness <= settings.highThreshold) {
            factor = 1.0;
        } else {
            factor = 1.5;
        }
        return settings.baseGrowthRate * factor;
    }

    private int between(int min, int max) {
        return max <= min ? min : min + random.nextInt(max - min + 1);
    }
}
