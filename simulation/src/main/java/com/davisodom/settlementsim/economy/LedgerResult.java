package com.davisodom.settlementsim.economy;

import com.davisodom.settlementsim.errors.ErrorCode;
import com.davisodom.settlementsim.errors.SimulationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an all-or-nothing ledger debit.
 */
public final class LedgerResult {

    private static final LedgerResult OK = new LedgerResult(Collections.emptyMap());

    private final Map<ResourceType, Long> shortagesMillis;

    private LedgerResult(Map<ResourceType, Long> shortagesMillis) {
        this.shortagesMillis = shortagesMillis;
    }

    public static LedgerResult ok() {
        return OK;
    }

    public static LedgerResult insufficient(Map<ResourceType, Long> shortagesMillis) {
        if (shortagesMillis.isEmpty()) {
            throw new IllegalArgumentException("Insufficient result needs at least one shortage");
        }
        return new LedgerResult(Collections.unmodifiableMap(new EnumMap<>(shortagesMillis)));
    }

    public boolean isSuccess() {
        return shortagesMillis.isEmpty();
    }

    /**
     * Per-resource shortfall in milli-units; empty on success.
     */
    public Map<ResourceType, Long> getShortagesMillis() {
        return shortagesMillis;
    }

    /**
     * Convert a failed debit into the caller-facing rejection.
     */
    public SimulationException toException() {
        if (isSuccess()) {
            throw new IllegalStateException("Debit succeeded; nothing to report");
        }
        Map<String, Double> shortages = new LinkedHashMap<>();
        shortagesMillis.forEach((type, value) -> shortages.put(type.id(), value / (double) ResourceAmounts.SCALE));
        StringBuilder sb = new StringBuilder("Insufficient resources:");
        shortages.forEach((id, amount) -> sb.append(String.format(" %s short by %.3f", id, amount)));
        return new SimulationException(ErrorCode.INSUFFICIENT_RESOURCES, sb.toString(),
                Map.of("shortages", shortages));
    }

    @Override
    public String toString() {
        return isSuccess() ? "LedgerResult{ok}" : "LedgerResult{shortages=" + shortagesMillis + "}";
    }
}
