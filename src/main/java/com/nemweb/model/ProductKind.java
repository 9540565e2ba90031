package com.nemweb.model;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The three price products maintained per region.
 * Each entry maps a wire label to its default poll cadence and the number of periods published.
 */
public enum ProductKind {

    REALTIME("realtime", Duration.ofSeconds(5), Integer.MAX_VALUE),
    FIVE_MINUTE("five_minute", Duration.ofSeconds(30), 12),
    PREDISPATCH("predispatch", Duration.ofMinutes(5), 96);

    private final String label;
    private final Duration defaultCadence;
    private final int maxPeriods;

    private static final Map<String, ProductKind> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(ProductKind::getLabel, Function.identity()));

    ProductKind(String label, Duration defaultCadence, int maxPeriods) {
        this.label = label;
        this.defaultCadence = defaultCadence;
        this.maxPeriods = maxPeriods;
    }

    public String getLabel() {
        return label;
    }

    public Duration getDefaultCadence() {
        return defaultCadence;
    }

    public int getMaxPeriods() {
        return maxPeriods;
    }

    /**
     * Look up a ProductKind by its label string (e.g., "five_minute").
     */
    public static Optional<ProductKind> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    public static String[] supportedLabels() {
        return Arrays.stream(values()).map(ProductKind::getLabel).toArray(String[]::new);
    }
}
