package com.nemweb.model;

import java.time.Instant;

/**
 * Committed state of one (region, product) key.
 * A new instance replaces the previous one on every store write.
 *
 * @param series               Last successfully parsed series
 * @param stale                True once consecutive failures reached the staleness threshold
 * @param lastSuccessfulUpdate When {@code series} was committed
 * @param version              Monotonic per-key write counter
 */
public record SeriesSnapshot(ForecastSeries series, boolean stale, Instant lastSuccessfulUpdate, long version) {

    public SeriesSnapshot withStale(boolean stale) {
        return new SeriesSnapshot(series, stale, lastSuccessfulUpdate, version + 1);
    }
}
