package com.davisodom.settlementsim.economy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable bundle of non-negative resource quantities.
 *
 * Quantities are stored as fixed-point longs in milli-units (1 unit = 1000 milli) so ledger
 * arithmetic is exact and deterministic. Production math works in doubles and is converted
 * at the ledger boundary.
 */
public final class ResourceAmounts {

    public static final long SCALE = 1000L;
    public static final ResourceAmounts ZERO = new ResourceAmounts(new EnumMap<>(ResourceType.class));

    private final EnumMap<ResourceType, Long> millis;

    private ResourceAmounts(EnumMap<ResourceType, Long> millis) {
        this.millis = millis;
    }

    public static ResourceAmounts ofMillis(Map<ResourceType, Long> amounts) {
        Builder builder = builder();
        amounts.forEach(builder::millis);
        return builder.build();
    }

    public static ResourceAmounts ofUnits(Map<ResourceType, ? extends Number> amounts) {
        Builder builder = builder();
        amounts.forEach((type, value) -> builder.units(type, value.doubleValue()));
        return builder.build();
    }

    public static ResourceAmounts of(ResourceType type, double units) {
        return builder().units(type, units).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static long toMillis(double units) {
        return Math.round(units * SCALE);
    }

    public long getMillis(ResourceType type) {
        return millis.getOrDefault(type, 0L);
    }

    public double getUnits(ResourceType type) {
        return getMillis(type) / (double) SCALE;
    }

    public boolean isEmpty() {
        return millis.values().stream().allMatch(v -> v == 0L);
    }

    public ResourceAmounts plus(ResourceAmounts other) {
        Builder builder = builder();
        for (ResourceType type : ResourceType.values()) {
            builder.millis(type, Math.addExact(getMillis(type), other.getMillis(type)));
        }
        return builder.build();
    }

    /**
     * Scale every quantity, rounding up to the next milli-unit.
     */
    public ResourceAmounts scale(double factor) {
        if (factor < 0) {
            throw new IllegalArgumentException("Scale factor must be non-negative: " + factor);
        }
        Builder builder = builder();
        millis.forEach((type, value) -> builder.millis(type, (long) Math.ceil(value * factor)));
        return builder.build();
    }

    public Map<ResourceType, Long> asMillisMap() {
        return Collections.unmodifiableMap(new EnumMap<>(millis));
    }

    /**
     * Unit view keyed by resource id, used for event payloads and diagnostics.
     */
    public Map<String, Double> toUnitsMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        millis.forEach((type, value) -> out.put(type.id(), value / (double) SCALE));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceAmounts)) return false;
        ResourceAmounts other = (ResourceAmounts) o;
        for (ResourceType type : ResourceType.values()) {
            if (getMillis(type) != other.getMillis(type)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        long h = 17;
        for (ResourceType type : ResourceType.values()) {
            h = 31 * h + getMillis(type);
        }
        return Long.hashCode(h);
    }

    @Override
    public String toString() {
        return "ResourceAmounts" + toUnitsMap();
    }

    public static class Builder {
        private final EnumMap<ResourceType, Long> millis = new EnumMap<>(ResourceType.class);

        public Builder millis(ResourceType type, long amount) {
            if (amount < 0) {
                throw new IllegalArgumentException("Resource amount cannot be negative: " + type + "=" + amount);
            }
            if (amount > 0) {
                millis.put(type, amount);
            } else {
                millis.remove(type);
            }
            return this;
        }

        public Builder units(ResourceType type, double units) {
            return millis(type, toMillis(units));
        }

        public ResourceAmounts build() {
            return new ResourceAmounts(new EnumMap<>(millis));
        }
    }
}
