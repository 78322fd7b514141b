package com.davisodom.settlementsim;

import com.davisodom.settlementsim.config.SimulationConfig;

import java.util.logging.Logger;

/**
 * Debug flags and tagged logging for the simulation subsystems.
 * Each subsystem logs with its own marker ([PROD], [BUILD], [POP], [DISASTER]).
 */
public class DebugFlags {

    private static boolean debugProduction = false;
    private static boolean debugConstruction = false;
    private static boolean debugPopulation = false;
    private static boolean debugDisasters = false;
    private static Logger logger;

    /**
     * Initialize debug flags from configuration.
     */
    public static void initialize(SimulationConfig config, Logger log) {
        logger = log;
        debugProduction = config.debug.production;
        debugConstruction = config.debug.construction;
        debugPopulation = config.debug.population;
        debugDisasters = config.debug.disasters;

        if (isAnyDebugEnabled()) {
            logger.info("Debug flags initialized: production=" + debugProduction +
                       ", construction=" + debugConstruction +
                       ", population=" + debugPopulation +
                       ", disasters=" + debugDisasters);
        }
    }

    public static boolean isDebugProduction() { return debugProduction; }
    public static boolean isDebugConstruction() { return debugConstruction; }
    public static boolean isDebugPopulation() { return debugPopulation; }
    public static boolean isDebugDisasters() { return debugDisasters; }

    public static boolean isAnyDebugEnabled() {
        return debugProduction || debugConstruction || debugPopulation || debugDisasters;
    }

    public static void debugProduction(String message) {
        if (debugProduction && logger != null) {
            logger.info("[PROD] DEBUG: " + message);
        }
    }

    public static void debugConstruction(String message) {
        if (debugConstruction && logger != null) {
            logger.info("[BUILD] DEBUG: " + message);
        }
    }

    public static void debugPopulation(String message) {
        if (debugPopulation && logger != null) {
            logger.info("[POP] DEBUG: " + message);
        }
    }

    public static void debugDisaster(String message) {
        if (debugDisasters && logger != null) {
            logger.info("[DISASTER] DEBUG: " + message);
        }
    }

    /**
     * Log a disaster phase change; always on.
     */
    public static void logDisasterPhase(String eventId, String from, String to) {
        if (logger != null) {
            logger.info(String.format("[DISASTER] %s: %s -> %s", eventId, from, to));
        }
    }
}
