package com.davisodom.settlementsim.obs;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * Process-wide counters and timings.
 *
 * Counter names are dotted, e.g. {@code commands.rejected} or {@code tick.settlement_failed}.
 * Timings are recorded under a name ({@code tick}, a tick system name, or {@code settlement} for
 * per-settlement work) and keep a sliding window for percentiles.
 */
public class Metrics {

    public static final String SETTLEMENT_TIMING = "settlement";

    private final Logger logger;
    private final long settlementBudgetMicros;
    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, TickTimeStats> timings = new ConcurrentHashMap<>();

    public Metrics(Logger logger) {
        this(logger, 2_000);
    }

    /**
     * @param settlementBudgetMicros per-settlement tick time above which a warning is logged
     */
    public Metrics(Logger logger, long settlementBudgetMicros) {
        this.logger = logger;
        this.settlementBudgetMicros = settlementBudgetMicros;
    }

    public void increment(String counterName) {
        increment(counterName, 1);
    }

    public void increment(String counterName, long amount) {
        counters.computeIfAbsent(counterName, k -> new LongAdder()).add(amount);
    }

    public long getCounter(String counterName) {
        LongAdder adder = counters.get(counterName);
        return adder != null ? adder.sum() : 0L;
    }

    public void recordTickTime(String name, long micros) {
        timings.computeIfAbsent(name, k -> new TickTimeStats()).record(micros);
    }

    /**
     * Record one settlement's share of a tick. Over-budget settlements are counted and logged.
     */
    public void recordSettlementTickTime(UUID settlementId, long micros) {
        recordTickTime(SETTLEMENT_TIMING, micros);
        if (micros > settlementBudgetMicros) {
            increment("tick.settlement_over_budget");
            logger.warning(String.format("Settlement %s took %dus (budget %dus)",
                    settlementId, micros, settlementBudgetMicros));
        }
    }

    /**
     * @return the timing, or {@code null} if nothing was recorded under that name
     */
    public TickTimeStats getTickTimeStats(String name) {
        return timings.get(name);
    }

    /**
     * Short id tying together the log lines of one command.
     */
    public String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public Snapshot getSnapshot() {
        Map<String, Long> counterValues = new TreeMap<>();
        counters.forEach((name, adder) -> counterValues.put(name, adder.sum()));
        return new Snapshot(Collections.unmodifiableMap(counterValues),
                Collections.unmodifiableMap(new TreeMap<>(timings)));
    }

    /**
     * Count, mean, max and percentiles over the last {@value #WINDOW} samples.
     */
    public static class TickTimeStats {
        private static final int WINDOW = 128;

        private final long[] window = new long[WINDOW];
        private int next;
        private long count;
        private long totalMicros;
        private long maxMicros;

        synchronized void record(long micros) {
            window[next] = micros;
            next = (next + 1) % WINDOW;
            count++;
            totalMicros += micros;
            if (micros > maxMicros) {
                maxMicros = micros;
            }
        }

        public synchronized long getCount() { return count; }
        public synchronized long getMaxMicros() { return maxMicros; }

        public synchronized long getAverageMicros() {
            return count == 0 ? 0 : totalMicros / count;
        }

        public long getP95Micros() {
            return percentile(0.95);
        }

        public long getP99Micros() {
            return percentile(0.99);
        }

        private synchronized long percentile(double fraction) {
            int size = (int) Math.min(count, WINDOW);
            if (size == 0) {
                return 0;
            }
            long[] sorted = Arrays.copyOf(window, size);
            Arrays.sort(sorted);
            int rank = (int) Math.ceil(fraction * size);
            return sorted[Math.min(size, Math.max(1, rank)) - 1];
        }
    }

    /**
     * Point-in-time copy for the admin endpoint.
     */
    public record Snapshot(Map<String, Long> counters, Map<String, TickTimeStats> timings) {
    }
}
