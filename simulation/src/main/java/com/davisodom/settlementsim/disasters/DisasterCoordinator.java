package com.davisodom.settlementsim.disasters;

import com.davisodom.settlementsim.DebugFlags;
import com.davisodom.settlementsim.catalog.StructureCatalog;
import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.events.EventType;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.population.PopulationEngine;
import com.davisodom.settlementsim.production.ProductionModifierSource;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementService;
import com.davisodom.settlementsim.settlements.Structure;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Drives disaster events through SCHEDULED, WARNING, IMPACT, AFTERMATH and RESOLVED.
 *
 * Responsibilities:
 * - Time-driven phase transitions, one phase at a time, each emitting its event
 * - A single imminent notice once impact is closer than the configured threshold
 * - Damage rounds during impact, applied under each settlement's lock
 * - Casualties applied as one decrement on entering aftermath
 * - Resilience awards and clearing the world's active disaster on resolution
 * - Production penalties for affected settlements while in impact or aftermath
 *
 * At most one unresolved disaster exists per world. Damage rounds draw from a random source
 * seeded by the event, so replays of the same event damage the same structures.
 */
public class DisasterCoordinator implements ProductionModifierSource {

    private final Logger logger;
    private final SettlementService settlementService;
    private final StructureCatalog catalog;
    private final DisasterDamageCalculator damageCalculator;
    private final RepairCostCalculator repairCostCalculator;
    private final PopulationEngine populationEngine;
    private final SimulationConfig.DisasterSettings settings;

    private final Map<UUID, DisasterEvent> events = new ConcurrentHashMap<>();
    private final Map<String, UUID> activeByWorld = new ConcurrentHashMap<>();
    private volatile List<PenaltyWindow> penaltyWindows = List.of();

    public DisasterCoordinator(Logger logger, SettlementService settlementService, StructureCatalog catalog,
                               DisasterDamageCalculator damageCalculator, RepairCostCalculator repairCostCalculator,
                               PopulationEngine populationEngine, SimulationConfig.DisasterSettings settings) {
        this.logger = logger;
        this.settlementService = settlementService;
        this.catalog = catalog;
        this.damageCalculator = damageCalculator;
        this.repairCostCalculator = repairCostCalculator;
        this.populationEngine = populationEngine;
        this.settings = settings;
    }

    /**
     * Register a new event in SCHEDULED.
     *
     * @throws SimulationException CONFLICT when the world already has an unresolved disaster
     */
    public synchronized DisasterEvent schedule(DisasterEvent event) {
        Objects.requireNonNull(event, "event cannot be null");
        if (event.getStatus() != DisasterStatus.SCHEDULED) {
            throw new IllegalArgumentException("Only SCHEDULED events can be scheduled: " + event);
        }
        UUID current = activeByWorld.get(event.getWorldName());
        if (current != null) {
            throw new SimulationException(ErrorCode.DISASTER_ALREADY_ACTIVE,
                    "World " + event.getWorldName() + " already has an active disaster",
                    Map.of("worldName", event.getWorldName(), "activeEventId", current.toString()));
        }
        events.put(event.getId(), event);
        activeByWorld.put(event.getWorldName(), event.getId());
        logger.info(String.format("Scheduled %s (severity %.1f) in %s at %d",
                event.getType(), event.getSeverity(), event.getWorldName(), event.getScheduledAt()));
        return event;
    }

    /**
     * Reinstate a persisted event without emitting anything.
     */
    public synchronized void restore(DisasterEvent event) {
        events.put(event.getId(), event);
        if (event.isActive()) {
            activeByWorld.put(event.getWorldName(), event.getId());
        }
        refreshPenaltyWindows();
    }

    /**
     * Advance every unresolved event to where {@code now} puts it.
     */
    public synchronized List<SimulationEvent> step(long now) {
        List<SimulationEvent> out = new ArrayList<>();
        List<DisasterEvent> active = events.values().stream()
                .filter(DisasterEvent::isActive)
                .sorted(Comparator.comparingLong(DisasterEvent::getScheduledAt))
                .collect(Collectors.toList());
        for (DisasterEvent event : active) {
            while (event.isActive()) {
                if (event.getStatus() == DisasterStatus.WARNING) {
                    checkImminent(event, Math.min(now, event.impactAt()), out);
                } else if (event.getStatus() == DisasterStatus.IMPACT) {
                    applyDueRounds(event, now, out);
                }
                long due = event.nextTransitionAt();
                if (due > now) {
                    break;
                }
                advance(event, due, out);
            }
        }
        refreshPenaltyWindows();
        return out;
    }

    /**
     * Operator override: move an event to its next phase immediately.
     *
     * @throws SimulationException NOT_FOUND for an unknown id, PRECONDITION once resolved
     */
    public synchronized List<SimulationEvent> forceAdvance(UUID eventId, long now) {
        DisasterEvent event = events.get(eventId);
        if (event == null) {
            throw SimulationException.notFound(ErrorCode.DISASTER_NOT_FOUND, eventId);
        }
        if (!event.isActive()) {
            throw new SimulationException(ErrorCode.DISASTER_ALREADY_RESOLVED,
                    "Disaster " + eventId + " is already resolved", Map.of("eventId", eventId.toString()));
        }
        List<SimulationEvent> out = new ArrayList<>();
        logger.info(String.format("Force-advancing disaster %s from %s", eventId, event.getStatus()));
        advance(event, now, out);
        refreshPenaltyWindows();
        return out;
    }

    public Optional<DisasterEvent> activeDisaster(String worldName) {
        UUID id = activeByWorld.get(worldName);
        return id == null ? Optional.empty() : Optional.ofNullable(events.get(id));
    }

    public Optional<DisasterEvent> getEvent(UUID eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    public List<DisasterEvent> getAll() {
        return events.values().stream()
                .sorted(Comparator.comparingLong(DisasterEvent::getScheduledAt).thenComparing(DisasterEvent::getId))
                .collect(Collectors.toList());
    }

    /**
     * Price a repair using the latest disaster that reached the settlement; the discount applies
     * while that disaster's repair window is open.
     */
    public RepairQuote repairQuote(Settlement settlement, Structure structure, StructureDefinition definition, long now) {
        Optional<DisasterEvent> latest = events.values().stream()
                .filter(e -> e.getStatus() == DisasterStatus.AFTERMATH || e.getStatus() == DisasterStatus.RESOLVED)
                .filter(e -> e.getAffectedSettlements().contains(settlement.getId()))
                .max(Comparator.comparingLong(DisasterEvent::getAftermathStartedAt));
        double multiplier = latest.map(e -> e.getType().getRepairMultiplier()).orElse(RepairCostCalculator.DEFAULT_MULTIPLIER);
        boolean discounted = latest.isPresent() && now < latest.get().getRepairWindowEndsAt();
        ResourceAmounts cost = repairCostCalculator.cost(definition, structure, multiplier,
                discounted ? settings.repairDiscount : 0);
        return new RepairQuote(cost, multiplier, discounted, latest.map(DisasterEvent::getId).orElse(null));
    }

    /**
     * Whether a disaster is currently in impact over the settlement, as of the last step.
     */
    public boolean isUnderImpact(UUID settlementId) {
        for (PenaltyWindow window : penaltyWindows) {
            if (window.status() == DisasterStatus.IMPACT && window.settlementIds().contains(settlementId)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Map<ResourceType, Double> productionModifiers(Settlement settlement, long now) {
        Map<ResourceType, Double> modifiers = new EnumMap<>(ResourceType.class);
        for (PenaltyWindow window : penaltyWindows) {
            if (!window.settlementIds().contains(settlement.getId())) continue;
            double intensity = window.intensity(now);
            for (Map.Entry<ResourceType, Double> penalty : window.type().getProductionPenalties().entrySet()) {
                double multiplier = 1.0 - (1.0 - penalty.getValue()) * intensity;
                modifiers.merge(penalty.getKey(), multiplier, (a, b) -> a * b);
            }
        }
        return modifiers;
    }

    private void advance(DisasterEvent event, long at, List<SimulationEvent> out) {
        DisasterStatus from = event.getStatus();
        DisasterStatus to = from.next();
        switch (to) {
            case WARNING:
                event.transitionTo(DisasterStatus.WARNING, at);
                out.add(worldEvent(EventType.DISASTER_WARNING, event, at, warningPayload(event, at)));
                checkImminent(event, at, out);
                break;
            case IMPACT:
                checkImminent(event, at, out);
                event.transitionTo(DisasterStatus.IMPACT, at);
                beginImpact(event);
                Map<String, Object> impact = basePayload(event);
                impact.put("affectedSettlements", ids(event.getAffectedSettlements()));
                impact.put("rounds", event.getTotalRounds());
                out.add(worldEvent(EventType.DISASTER_IMPACT_STARTED, event, at, impact));
                break;
            case AFTERMATH:
                while (event.getRoundsApplied() < event.getTotalRounds()) {
                    applyRound(event, at, out);
                }
                event.transitionTo(DisasterStatus.AFTERMATH, at);
                applyCasualties(event, at, out);
                event.setEstimatedRepairCost(estimateRepairCost(event));
                event.setRepairWindowEndsAt(at + settings.repairWindowMillis);
                Map<String, Object> aftermath = basePayload(event);
                aftermath.put("summary", DisasterSummary.of(event).asMap());
                aftermath.put("recommendedActions", event.getType().getRecommendedActions());
                out.add(worldEvent(EventType.DISASTER_AFTERMATH, event, at, aftermath));
                break;
            case RESOLVED:
                event.transitionTo(DisasterStatus.RESOLVED, at);
                double gain = awardResilience(event);
                event.clearTransientState();
                activeByWorld.remove(event.getWorldName(), event.getId());
                Map<String, Object> resolved = basePayload(event);
                resolved.put("summary", DisasterSummary.of(event).asMap());
                resolved.put("resilienceGain", gain);
                out.add(worldEvent(EventType.DISASTER_RESOLVED, event, at, resolved));
                break;
            default:
                throw new IllegalStateException("Unexpected phase " + to);
        }
        DebugFlags.logDisasterPhase(event.getId().toString(), from.name(), to.name());
    }

    private void checkImminent(DisasterEvent event, long now, List<SimulationEvent> out) {
        if (event.isImminentNotified()) {
            return;
        }
        long timeToImpact = event.impactAt() - now;
        if (timeToImpact < settings.imminentThresholdMillis) {
            event.markImminentNotified();
            Map<String, Object> payload = basePayload(event);
            payload.put("timeToImpactMillis", Math.max(0, timeToImpact));
            out.add(worldEvent(EventType.DISASTER_IMMINENT, event, now, payload));
        }
    }

    private void beginImpact(DisasterEvent event) {
        Map<UUID, Double> damage = new LinkedHashMap<>();
        for (SettlementContext context : settlementService.getInWorld(event.getWorldName())) {
            Settlement settlement = context.getSettlement();
            if (!event.covers(settlement)) continue;
            double net = context.withLock(() -> {
                double preparedness = damageCalculator.preparedness(settlement, event.getType());
                Random random = new Random(event.getSeed() ^ settlement.getId().getMostSignificantBits());
                return damageCalculator.netDamage(event.getSeverity(), preparedness, random);
            });
            damage.put(settlement.getId(), net);
            DebugFlags.debugDisaster(String.format("%s net damage for %s: %.2f", event.getId(), settlement.getId(), net));
        }
        int rounds = (int) Math.max(1, (event.getImpactMillis() + settings.damageIntervalMillis - 1) / settings.damageIntervalMillis);
        event.beginImpact(damage, rounds);
    }

    private void applyDueRounds(DisasterEvent event, long now, List<SimulationEvent> out) {
        while (event.getRoundsApplied() < event.getTotalRounds()) {
            int round = event.getRoundsApplied() + 1;
            long dueAt = event.getImpactStartedAt() + Math.min(round * settings.damageIntervalMillis, event.getImpactMillis());
            if (dueAt > now) {
                return;
            }
            applyRound(event, dueAt, out);
        }
    }

    private void applyRound(DisasterEvent event, long at, List<SimulationEvent> out) {
        int round = event.getRoundsApplied() + 1;
        for (UUID settlementId : event.getAffectedSettlements()) {
            Optional<SettlementContext> context = settlementService.get(settlementId);
            if (context.isEmpty()) {
                continue;
            }
            double share = event.netDamageFor(settlementId) / event.getTotalRounds();
            if (share <= 0) {
                continue;
            }
            SimulationEvent damaged = context.get().withLock(() -> damageSettlement(event, context.get(), round, share, at));
            if (damaged != null) {
                out.add(damaged);
            }
        }
        event.recordRound();
    }

    private SimulationEvent damageSettlement(DisasterEvent event, SettlementContext context, int round, double share, long at) {
        Settlement settlement = context.getSettlement();
        Random random = new Random(event.getSeed() * 31 + round * 1_000_003L + settlement.getId().hashCode());
        List<Map<String, Object>> hits = new ArrayList<>();
        boolean destroyedAny = false;
        for (Structure structure : settlement.getActiveStructures()) {
            if (random.nextDouble() >= settings.structureHitChance) continue;
            double before = structure.getHealth();
            double removed = structure.applyDamage(damageCalculator.structureDamage(structure, event.getType(), share));
            if (removed <= 0) continue;
            event.recordDamage(structure.getId(), removed, structure.isDestroyed());
            destroyedAny |= structure.isDestroyed();
            Map<String, Object> hit = new LinkedHashMap<>();
            hit.put("structureId", structure.getId().toString());
            hit.put("definitionId", structure.getDefinitionId());
            hit.put("previousHealth", before);
            hit.put("health", structure.getHealth());
            hit.put("destroyed", structure.isDestroyed());
            hits.add(hit);
        }
        event.addPendingCasualties(settlement.getId(), damageCalculator.casualties(settlement, event.getType(), share));
        if (destroyedAny) {
            context.markStaffingDirty();
            settlementService.refreshStorageCapacity(context);
            settlementService.clampPopulation(context);
        }
        if (hits.isEmpty()) {
            return null;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("eventId", event.getId().toString());
        payload.put("type", event.getType().name());
        payload.put("round", round);
        payload.put("structures", hits);
        return SimulationEvent.settlement(EventType.STRUCTURE_DAMAGED, settlement.getId(), at, payload);
    }

    private void applyCasualties(DisasterEvent event, long at, List<SimulationEvent> out) {
        for (UUID settlementId : event.getAffectedSettlements()) {
            Optional<SettlementContext> context = settlementService.get(settlementId);
            if (context.isEmpty()) {
                continue;
            }
            int pending = (int) Math.floor(event.getPendingCasualties().getOrDefault(settlementId, 0.0));
            SimulationEvent changed = context.get().withLock(() -> {
                Settlement settlement = context.get().getSettlement();
                settlement.recordDisaster(at, event.getSeverity());
                int before = settlement.getPopulation().getCount();
                int removed = pending > 0 ? populationEngine.applyCasualties(context.get(), pending) : 0;
                event.recordCasualties(removed);
                if (removed == 0) {
                    return null;
                }
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("previousCount", before);
                payload.put("count", settlement.getPopulation().getCount());
                payload.put("casualties", removed);
                payload.put("eventId", event.getId().toString());
                return SimulationEvent.settlement(EventType.POPULATION_CHANGED, settlementId, at, payload);
            });
            if (changed != null) {
                out.add(changed);
            }
        }
    }

    private ResourceAmounts estimateRepairCost(DisasterEvent event) {
        ResourceAmounts total = ResourceAmounts.ZERO;
        for (UUID settlementId : event.getAffectedSettlements()) {
            Optional<SettlementContext> context = settlementService.get(settlementId);
            if (context.isEmpty()) continue;
            ResourceAmounts cost = context.get().withLock(() -> {
                ResourceAmounts sum = ResourceAmounts.ZERO;
                for (Structure structure : context.get().getSettlement().getActiveStructures()) {
                    if (!event.getDamagedStructures().contains(structure.getId())) continue;
                    Optional<StructureDefinition> definition = catalog.findDefinition(structure.getDefinitionId());
                    if (definition.isPresent()) {
                        sum = sum.plus(repairCostCalculator.cost(definition.get(), structure,
                                event.getType().getRepairMultiplier(), 0));
                    }
                }
                return sum;
            });
            total = total.plus(cost);
        }
        return total;
    }

    private double awardResilience(DisasterEvent event) {
        double gain = event.getTier().getResilienceGain();
        for (UUID settlementId : event.getAffectedSettlements()) {
            settlementService.get(settlementId).ifPresent(context -> context.withLock(() -> {
                Settlement settlement = context.getSettlement();
                settlement.setResilience(Math.min(100, settlement.getResilience() + gain));
            }));
        }
        return gain;
    }

    private void refreshPenaltyWindows() {
        List<PenaltyWindow> windows = new ArrayList<>();
        for (DisasterEvent event : events.values()) {
            if (event.getStatus() == DisasterStatus.IMPACT || event.getStatus() == DisasterStatus.AFTERMATH) {
                windows.add(new PenaltyWindow(event.getType(), Set.copyOf(event.getAffectedSettlements()),
                        event.getStatus(), event.getAftermathStartedAt(), event.getAftermathMillis()));
            }
        }
        penaltyWindows = List.copyOf(windows);
    }

    private Map<String, Object> warningPayload(DisasterEvent event, long at) {
        Map<String, Object> payload = basePayload(event);
        payload.put("impactAt", event.impactAt());
        payload.put("timeToImpactMillis", Math.max(0, event.impactAt() - at));
        payload.put("affectedBiomes", new ArrayList<>(event.getAffectedBiomes()));
        payload.put("affectedRegions", new ArrayList<>(event.getAffectedRegions()));
        payload.put("recommendedActions", event.getType().getRecommendedActions());
        return payload;
    }

    private static Map<String, Object> basePayload(DisasterEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("eventId", event.getId().toString());
        payload.put("type", event.getType().name());
        payload.put("severity", event.getSeverity());
        payload.put("tier", event.getTier().name());
        return payload;
    }

    private static SimulationEvent worldEvent(EventType type, DisasterEvent event, long at, Map<String, Object> payload) {
        return SimulationEvent.world(type, event.getWorldName(), at, payload);
    }

    private static List<String> ids(Collection<UUID> ids) {
        return ids.stream().map(UUID::toString).collect(Collectors.toList());
    }

    /**
     * A priced repair.
     *
     * @param sourceEventId the disaster the price is based on, or {@code null}
     */
    public record RepairQuote(ResourceAmounts cost, double multiplier, boolean discounted, UUID sourceEventId) {
    }

    private record PenaltyWindow(DisasterType type, Set<UUID> settlementIds, DisasterStatus status,
                                 long aftermathStartedAt, long aftermathMillis) {

        // Full intensity during impact, fading linearly to zero over the aftermath
        double intensity(long now) {
            if (status == DisasterStatus.IMPACT) {
                return 1.0;
            }
            if (aftermathMillis <= 0) {
                return 0.0;
            }
            double progress = (double) (now - aftermathStartedAt) / aftermathMillis;
            return 1.0 - Math.max(0.0, Math.min(1.0, progress));
        }
    }
}
