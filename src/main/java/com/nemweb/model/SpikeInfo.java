package com.nemweb.model;

import java.util.List;

/**
 * Spike metrics for the latest realtime price against the recent realtime history.
 * Informational only; nothing in the engine acts on it.
 *
 * @param spike        True when the price is more than twice the recent average and at least $20/MWh above it
 * @param negative     True when the price is below zero
 * @param ratio        Current price divided by the average of the preceding samples
 * @param magnitude    Current price minus that average, in $/MWh
 * @param currentPrice Latest realtime price in $/MWh
 * @param averagePrice Average of the preceding samples in $/MWh
 * @param samples      Number of samples considered, including the current one
 */
public record SpikeInfo(boolean spike, boolean negative, double ratio, double magnitude,
                        double currentPrice, double averagePrice, int samples) {

    static final int MIN_SAMPLES = 3;
    static final double SPIKE_RATIO = 2.0;
    static final double SPIKE_MIN_MAGNITUDE = 20.0;

    /**
     * Computes spike metrics from a price history whose last element is the current price.
     */
    public static SpikeInfo from(List<Double> history) {
        if (history.isEmpty()) {
            throw new IllegalArgumentException("History must contain the current price");
        }
        double current = history.get(history.size() - 1);
        if (history.size() < MIN_SAMPLES) {
            return new SpikeInfo(false, current < 0, 1.0, 0.0, current, current, history.size());
        }

        double sum = 0;
        for (int i = 0; i < history.size() - 1; i++) {
            sum += history.get(i);
        }
        double average = sum / (history.size() - 1);
        double ratio = average != 0 ? current / average : 1.0;
        double magnitude = current - average;

        return new SpikeInfo(
                ratio > SPIKE_RATIO && magnitude > SPIKE_MIN_MAGNITUDE,
                current < 0,
                round(ratio),
                round(magnitude),
                current,
                round(average),
                history.size());
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
