package com.nemweb.store;

import com.nemweb.model.ForecastSeries;
import com.nemweb.model.PricePoint;
import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.model.RegionSnapshot;
import com.nemweb.model.SeriesKey;
import com.nemweb.model.SeriesSnapshot;
import com.nemweb.model.SpikeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory, thread-safe store for the latest series of every (region, product) key.
 *
 * <p>Backed by a {@link ConcurrentHashMap} keyed on {@link SeriesKey}, holding immutable
 * {@link SeriesSnapshot}s. Writes replace a key's snapshot atomically; reads are lock-free and
 * always see a complete snapshot.
 *
 * <p>Also keeps the last {@value #REALTIME_HISTORY_SIZE} realtime prices per region for spike detection.
 */
@Repository
public class ForecastStore {

    private static final Logger log = LoggerFactory.getLogger(ForecastStore.class);

    static final int REALTIME_HISTORY_SIZE = 12;

    private final ConcurrentMap<SeriesKey, SeriesSnapshot> snapshots = new ConcurrentHashMap<>();
    private final ConcurrentMap<Region, List<Double>> realtimeHistory = new ConcurrentHashMap<>();
    private final Clock clock;

    public ForecastStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Commit a freshly parsed series, replacing the previous snapshot and clearing staleness.
     *
     * @return the committed snapshot
     */
    public SeriesSnapshot update(ForecastSeries series) {
        Instant now = clock.instant();
        SeriesSnapshot committed = snapshots.compute(series.key(), (key, previous) ->
                new SeriesSnapshot(series, false, now, previous == null ? 1 : previous.version() + 1));

        if (series.kind() == ProductKind.REALTIME && !series.isEmpty()) {
            double latest = series.last().price();
            realtimeHistory.compute(series.region(), (region, history) -> appendBounded(history, latest));
        }

        log.debug("Stored series: key={} points={} source={} version={}",
                series.key(), series.size(), series.sourceFile(), committed.version());
        return committed;
    }

    /**
     * Flag a key as stale, keeping its last good series.
     *
     * @return the stale snapshot, or empty if the key never had a successful update
     */
    public Optional<SeriesSnapshot> markStale(Region region, ProductKind kind) {
        SeriesSnapshot result = snapshots.computeIfPresent(new SeriesKey(region, kind),
                (key, current) -> current.stale() ? current : current.withStale(true));
        if (result != null) {
            log.debug("Marked stale: key={}/{} version={}", region, kind.getLabel(), result.version());
        }
        return Optional.ofNullable(result);
    }

    public Optional<SeriesSnapshot> read(Region region, ProductKind kind) {
        return Optional.ofNullable(snapshots.get(new SeriesKey(region, kind)));
    }

    /**
     * Returns every product currently held for a region.
     */
    public RegionSnapshot readRegion(Region region) {
        Map<ProductKind, SeriesSnapshot> products = new EnumMap<>(ProductKind.class);
        for (ProductKind kind : ProductKind.values()) {
            SeriesSnapshot snapshot = snapshots.get(new SeriesKey(region, kind));
            if (snapshot != null) {
                products.put(kind, snapshot);
            }
        }
        return new RegionSnapshot(region, products);
    }

    /**
     * Maximum price among the points of the latest series that are not yet in the past.
     */
    public OptionalDouble peak(Region region, ProductKind kind) {
        Instant now = clock.instant();
        return read(region, kind)
                .map(snapshot -> snapshot.series().points().stream()
                        .filter(point -> !point.timestamp().isBefore(now))
                        .mapToDouble(PricePoint::price)
                        .max())
                .orElse(OptionalDouble.empty());
    }

    public List<Double> realtimeHistory(Region region) {
        return realtimeHistory.getOrDefault(region, List.of());
    }

    public Optional<SpikeInfo> spikeInfo(Region region) {
        List<Double> history = realtimeHistory(region);
        return history.isEmpty() ? Optional.empty() : Optional.of(SpikeInfo.from(history));
    }

    /**
     * Drops every key of a region; used when its pipeline is removed.
     */
    public void removeRegion(Region region) {
        snapshots.keySet().removeIf(key -> key.region() == region);
        realtimeHistory.remove(region);
        log.info("Removed stored series for region={}", region);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Returns the number of keys holding a snapshot.
     */
    public int size() {
        return snapshots.size();
    }

    /**
     * Clears all data, primarily for testing.
     */
    public void clear() {
        snapshots.clear();
        realtimeHistory.clear();
    }

    private static List<Double> appendBounded(List<Double> history, double price) {
        List<Double> next = new ArrayList<>(history == null ? List.of() : history);
        next.add(price);
        if (next.size() > REALTIME_HISTORY_SIZE) {
            next = next.subList(next.size() - REALTIME_HISTORY_SIZE, next.size());
        }
        return List.copyOf(next);
    }
}
