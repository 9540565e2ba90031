package com.nemweb.scheduler;

import com.nemweb.model.ProductKind;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Timing and failure policy shared by every poller of the engine.
 *
 * @param cadences         Poll period per product
 * @param failureThreshold Consecutive failed cycles after which a key is marked stale
 * @param maxJitter        Upper bound of the random delay before a poller's first tick
 * @param shutdownGrace    How long a stopping pipeline waits for in-flight cycles
 */
public record PollerSettings(Map<ProductKind, Duration> cadences, int failureThreshold,
                             Duration maxJitter, Duration shutdownGrace) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;

    public PollerSettings {
        if (failureThreshold < 1) throw new IllegalArgumentException("Failure threshold must be at least 1");
        if (maxJitter.isNegative()) throw new IllegalArgumentException("Jitter must not be negative");
        Map<ProductKind, Duration> resolved = new EnumMap<>(ProductKind.class);
        for (ProductKind kind : ProductKind.values()) {
            Duration cadence = cadences.getOrDefault(kind, kind.getDefaultCadence());
            if (cadence.isZero() || cadence.isNegative()) {
                throw new IllegalArgumentException("Cadence for " + kind.getLabel() + " must be positive");
            }
            resolved.put(kind, cadence);
        }
        cadences = Map.copyOf(resolved);
    }

    public static PollerSettings defaults() {
        return new PollerSettings(Map.of(), DEFAULT_FAILURE_THRESHOLD, Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    public Duration cadence(ProductKind kind) {
        return cadences.get(kind);
    }

    /**
     * Random initial delay in {@code [0, min(maxJitter, cadence))}.
     */
    public Duration initialJitter(ProductKind kind) {
        long bound = Math.min(maxJitter.toMillis(), cadence(kind).toMillis());
        if (bound <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(bound));
    }
}
