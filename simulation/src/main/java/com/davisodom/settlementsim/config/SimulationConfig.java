package com.davisodom.settlementsim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simulation tuning, bound from YAML.
 *
 * Defaults ship on the classpath as {@value #DEFAULT_RESOURCE}; an external file may override
 * any subset of keys. Every field has a code default so a partial document is valid.
 */
public class SimulationConfig {

    public static final String DEFAULT_RESOURCE = "settlement-sim.yml";

    public TickSettings tick = new TickSettings();
    public ProductionSettings production = new ProductionSettings();
    public ConstructionSettings construction = new ConstructionSettings();
    public PopulationSettings population = new PopulationSettings();
    public DisasterSettings disasters = new DisasterSettings();
    public TransferSettings transfers = new TransferSettings();
    public Map<String, WorldSettings> worlds = new LinkedHashMap<>();
    public PersistenceSettings persistence = new PersistenceSettings();
    public AdminSettings admin = new AdminSettings();
    public DebugSettings debug = new DebugSettings();

    public SimulationConfig() {} // For Jackson

    /**
     * Load classpath defaults only.
     */
    public static SimulationConfig loadDefaults() throws IOException {
        return load(null);
    }

    /**
     * Load classpath defaults, then apply the override file when it exists.
     */
    public static SimulationConfig load(Path overrideFile) throws IOException {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        yaml.setDefaultMergeable(true); // Overrides update nested sections instead of replacing them
        SimulationConfig config = new SimulationConfig();
        try (InputStream in = SimulationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                config = yaml.readerForUpdating(config).readValue(in);
            }
        }
        if (overrideFile != null && Files.exists(overrideFile)) {
            try (InputStream in = Files.newInputStream(overrideFile)) {
                config = yaml.readerForUpdating(config).readValue(in);
            }
        }
        config.validate();
        return config;
    }

    /**
     * @throws IllegalStateException when values are inconsistent
     */
    public void validate() {
        if (tick.tickMillis <= 0 || tick.intervalMillis <= 0) {
            throw new IllegalStateException("tick.tickMillis and tick.intervalMillis must be positive");
        }
        if (construction.maxConcurrent < 1) {
            throw new IllegalStateException("construction.maxConcurrent must be at least 1");
        }
        if (construction.maxItems < construction.maxConcurrent) {
            throw new IllegalStateException("construction.maxItems must be >= construction.maxConcurrent");
        }
        population.weights.validate();
        if (population.lowThreshold >= population.highThreshold) {
            throw new IllegalStateException("population.lowThreshold must be below population.highThreshold");
        }
        if (population.growthIntervalMillis <= 0) {
            throw new IllegalStateException("population.growthIntervalMillis must be positive");
        }
        if (disasters.damageIntervalMillis <= 0) {
            throw new IllegalStateException("disasters.damageIntervalMillis must be positive");
        }
        if (disasters.passiveRepairIntervalMillis <= 0) {
            throw new IllegalStateException("disasters.passiveRepairIntervalMillis must be positive");
        }
    }

    public WorldSettings world(String worldName) {
        WorldSettings settings = worlds.get(worldName);
        return settings != null ? settings : WorldSettings.DEFAULT;
    }

    public static class TickSettings {
        public long tickMillis = 1000;            // One simulation tick
        public long intervalMillis = 1000;        // Orchestrator period
        public int workerThreads = 4;
        public long budgetWarningMicros = 50_000;
        public long budgetCriticalMicros = 200_000;
        public long settlementBudgetMicros = 2_000;
    }

    public static class ProductionSettings {
        public double baseRate = 0.20;
        public double foodPerPerson = 0.005;
        public double waterPerPerson = 0.01;
        public double woodPerStructure = 0.001;
        public double stonePerStructure = 0.0005;
        public double orePerStructure = 0.00025;
        public long baseStorageCapacity = 1000;
    }

    public static class ConstructionSettings {
        public int maxConcurrent = 1;
        public int maxItems = 11;
        public double upgradeCostScaling = 1.5;
        public double upgradeTimeScaling = 1.25;
        public double emergencySpeedMultiplier = 2.0;
        public double emergencyCostMultiplier = 2.5;
        public int baseAreaCapacity = 500;
        public int areaPerTownHallLevel = 100;
    }

    public static class PopulationSettings {
        public long growthIntervalMillis = 1_800_000;
        public int baseCapacity = 10;
        public HappinessWeights weights = new HappinessWeights();
        public double highThreshold = 75;
        public double lowThreshold = 35;
        public double starvationCeiling = 55;
        public double starvationPenalty = 20;
        public double immigrationChance = 0.1;
        public int immigrationMin = 2;
        public int immigrationMax = 5;
        public double emigrationChance = 0.15;
        public int emigrationMin = 1;
        public int emigrationMax = 3;
        public double emigrationMaxFraction = 0.2;
        public int emigrationStreak = 2;
        public double baseGrowthRate = 0.02;
        public double sufficiencyTargetHours = 72;
        public double foodPerPersonHour = 0.3;
        public double waterPerPersonHour = 0.6;
        public long traumaRecoveryMillis = 604_800_000L;
        public double baseMorale = 50;
        public double externalRelations = 50;
    }

    /**
     * Happiness factor weights in percent; must sum to 100.
     */
    public static class HappinessWeights {
        public double sufficiency = 30;
        public double housing = 20;
        public double preparedness = 15;
        public double trauma = 15;
        public double morale = 15;
        public double relations = 5;

        public double total() {
            return sufficiency + housing + preparedness + trauma + morale + relations;
        }

        public void validate() {
            if (Math.abs(total() - 100.0) > 1e-6) {
                throw new IllegalStateException(String.format("Happiness weights must sum to 100, got %.2f", total()));
            }
        }
    }

    public static class DisasterSettings {
        public long imminentThresholdMillis = 1_800_000;
        public long damageIntervalMillis = 600_000;
        public long defaultAftermathMillis = 2_592_000_000L;
        public long repairWindowMillis = 172_800_000L;
        public double repairDiscount = 0.5;
        public double damageVariance = 0.2;
        public double structureHitChance = 0.5;
        public long passiveRepairIntervalMillis = 3_600_000;  // One passive repair round
        public double passiveRepairAmount = 1.0;              // Health restored per round
        public double passiveRepairMinHealth = 21.0;          // Below this only a paid repair helps
    }

    public static class TransferSettings {
        public long millisPerTile = 6_000;
        public double lossPercentPerHundredTiles = 5;
        public double disasterLossPercent = 10;
        public double maxLossPercent = 50;
    }

    public static class WorldSettings {
        static final WorldSettings DEFAULT = new WorldSettings();

        public double productionMultiplier = 1.0;
        public double consumptionMultiplier = 1.0;
    }

    public static class PersistenceSettings {
        public boolean enabled = true;
        public String dataFolder = "data";
    }

    public static class AdminSettings {
        public boolean enabled = false;
        public int port = 8765;
    }

    public static class DebugSettings {
        public boolean production;
        public boolean construction;
        public boolean population;
        public boolean disasters;
    }
}
