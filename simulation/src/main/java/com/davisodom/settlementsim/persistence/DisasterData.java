package com.davisodom.settlementsim.persistence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized disaster event, including in-flight impact state.
 */
public class DisasterData {
    public String id;
    public String worldName;
    public String type;
    public double severity;
    public List<String> affectedBiomes = new ArrayList<>();
    public List<String> affectedRegions = new ArrayList<>();
    public long scheduledAt;
    public long warningMillis;
    public long impactMillis;
    public long aftermathMillis;
    public long seed;
    public String status;
    public long warningStartedAt;
    public long impactStartedAt;
    public long aftermathStartedAt;
    public long resolvedAt;
    public boolean imminentNotified;
    public int roundsApplied;
    public int totalRounds;
    public Map<String, Double> netDamage = new LinkedHashMap<>();
    public Map<String, Double> pendingCasualties = new LinkedHashMap<>();
    public List<String> damagedStructures = new ArrayList<>();
    public List<String> destroyedStructures = new ArrayList<>();
    public double totalDamage;
    public int casualties;
    public Map<String, Long> estimatedRepairCost = new LinkedHashMap<>();
    public long repairWindowEndsAt;

    public DisasterData() {} // For Jackson
}
