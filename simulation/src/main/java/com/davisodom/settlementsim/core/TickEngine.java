package com.davisodom.settlementsim.core;

import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.obs.Metrics;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Fixed-interval driver for the simulation's tickable systems.
 *
 * Systems run in registration order. Each tick is timed per system and in total; overruns of the
 * warning budget are logged at fine, overruns of the critical budget at warning. A system that
 * throws is logged and the remaining systems still run.
 */
public class TickEngine {

    private final Logger logger;
    private final Metrics metrics;
    private final SimulationConfig.TickSettings settings;
    private final LongSupplier clock;
    private final Map<String, TickableSystem> systems;
    private final Map<String, Long> tickTimeMicros;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private long currentTick = 0;

    public TickEngine(Logger logger, Metrics metrics, SimulationConfig.TickSettings settings, LongSupplier clock) {
        this.logger = logger;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.systems = new LinkedHashMap<>(); // Registration order is execution order
        this.tickTimeMicros = new ConcurrentHashMap<>();
    }

    /**
     * Register a tickable system.
     *
     * @param name unique system identifier
     */
    public synchronized void registerSystem(String name, TickableSystem system) {
        if (systems.containsKey(name)) {
            throw new IllegalArgumentException("System already registered: " + name);
        }
        systems.put(name, system);
        tickTimeMicros.put(name, 0L);
        logger.info("Registered tickable system: " + name);
    }

    /**
     * Start ticking every {@code tick.intervalMillis}.
     */
    public synchronized void start() {
        if (tickTask != null && !tickTask.isDone()) {
            logger.warning("Tick engine already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "settlement-sim-tick");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(this::tickSafely, settings.intervalMillis,
                settings.intervalMillis, TimeUnit.MILLISECONDS);
        logger.info(String.format("Tick engine started (interval %dms)", settings.intervalMillis));
    }

    public void stop() {
        ScheduledExecutorService stopping;
        synchronized (this) {
            if (tickTask != null) {
                tickTask.cancel(false);
                tickTask = null;
            }
            stopping = scheduler;
            scheduler = null;
        }
        // Wait outside the lock so an in-flight tick can finish
        if (stopping != null) {
            stopping.shutdown();
            try {
                if (!stopping.awaitTermination(5, TimeUnit.SECONDS)) {
                    stopping.shutdownNow();
                }
            } catch (InterruptedException e) {
                stopping.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Tick engine stopped");
    }

    /**
     * Run one tick across all systems on the calling thread.
     */
    public synchronized void tick() {
        currentTick++;
        long now = clock.getAsLong();
        long tickStart = System.nanoTime();

        for (Map.Entry<String, TickableSystem> entry : systems.entrySet()) {
            String systemName = entry.getKey();
            long systemStart = System.nanoTime();
            try {
                entry.getValue().tick(currentTick, now);
            } catch (RuntimeException e) {
                metrics.increment("tick.system_failed");
                logger.severe(String.format("Error ticking system %s: %s", systemName, e));
            }
            long systemMicros = (System.nanoTime() - systemStart) / 1000;
            tickTimeMicros.put(systemName, systemMicros);
            metrics.recordTickTime(systemName, systemMicros);
        }

        long totalMicros = (System.nanoTime() - tickStart) / 1000;
        metrics.recordTickTime("tick", totalMicros);

        if (totalMicros > settings.budgetCriticalMicros) {
            logger.warning(String.format("CRITICAL: Tick %d took %.2fms (budget: %.2fms). Systems: %s",
                    currentTick, totalMicros / 1000.0, settings.budgetCriticalMicros / 1000.0, formatSystemTimes()));
        } else if (totalMicros > settings.budgetWarningMicros) {
            logger.fine(String.format("WARNING: Tick %d took %.2fms (budget: %.2fms). Systems: %s",
                    currentTick, totalMicros / 1000.0, settings.budgetWarningMicros / 1000.0, formatSystemTimes()));
        }
    }

    // Exceptions escaping a scheduled task would cancel all future runs
    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            logger.severe("Tick " + currentTick + " failed: " + e);
        }
    }

    private String formatSystemTimes() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> entry : tickTimeMicros.entrySet()) {
            sb.append(String.format("%s=%.2fms ", entry.getKey(), entry.getValue() / 1000.0));
        }
        return sb.toString().trim();
    }

    public synchronized long getCurrentTick() {
        return currentTick;
    }

    public Map<String, Long> getTickTimeMicros() {
        return new HashMap<>(tickTimeMicros);
    }

    /**
     * A system that receives tick updates.
     */
    public interface TickableSystem {
        /**
         * Called once per tick.
         *
         * @param tick tick number, starting at 1
         * @param now simulation time in epoch millis
         */
        void tick(long tick, long now);
    }
}
