package com.nemweb.publisher;

import com.nemweb.model.ForecastSeries;
import com.nemweb.model.PricePoint;
import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.model.SeriesSnapshot;
import com.nemweb.store.ForecastStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * {@link ForecastPublisher} backed by the {@link ForecastStore} snapshots.
 */
@Service
public class StoreForecastPublisher implements ForecastPublisher {

    static final String MERGED_KIND = "merged";

    private final ForecastStore store;

    public StoreForecastPublisher(ForecastStore store) {
        this.store = store;
    }

    @Override
    public Optional<CurrentPrice> current(Region region) {
        Optional<SeriesSnapshot> realtime = store.read(region, ProductKind.REALTIME)
                .filter(snapshot -> !snapshot.series().isEmpty());
        if (realtime.isPresent()) {
            SeriesSnapshot snapshot = realtime.get();
            return Optional.of(toCurrent(region, snapshot, snapshot.series().last(), CurrentPrice.SOURCE_DISPATCH));
        }

        // No dispatch price yet: the first 5-minute interval is the best estimate of "now"
        return store.read(region, ProductKind.FIVE_MINUTE)
                .filter(snapshot -> !snapshot.series().isEmpty())
                .map(snapshot -> toCurrent(region, snapshot, snapshot.series().first(), CurrentPrice.SOURCE_P5MIN));
    }

    @Override
    public ForecastView forecast(Region region, ProductKind kind) {
        return store.read(region, kind)
                .map(snapshot -> ForecastView.of(region, kind.getLabel(), snapshot.series().points(),
                        snapshot.stale(), snapshot.series().generatedAt(), snapshot.lastSuccessfulUpdate()))
                .orElseGet(() -> ForecastView.empty(region, kind.getLabel()));
    }

    @Override
    public OptionalDouble peak(Region region, ProductKind kind) {
        return store.peak(region, kind);
    }

    @Override
    public ForecastView merged(Region region) {
        Optional<SeriesSnapshot> fiveMinute = store.read(region, ProductKind.FIVE_MINUTE);
        Optional<SeriesSnapshot> predispatch = store.read(region, ProductKind.PREDISPATCH);
        if (fiveMinute.isEmpty() && predispatch.isEmpty()) {
            return ForecastView.empty(region, MERGED_KIND);
        }

        List<PricePoint> points = new ArrayList<>();
        Instant horizon = null;
        if (fiveMinute.isPresent() && !fiveMinute.get().series().isEmpty()) {
            ForecastSeries series = fiveMinute.get().series();
            points.addAll(series.points());
            horizon = series.last().timestamp();
        }
        if (predispatch.isPresent()) {
            for (PricePoint point : predispatch.get().series().points()) {
                if (horizon == null || point.timestamp().isAfter(horizon)) {
                    points.add(point);
                }
            }
        }

        boolean stale = fiveMinute.map(SeriesSnapshot::stale).orElse(false)
                || predispatch.map(SeriesSnapshot::stale).orElse(false);
        Instant generatedAt = latest(fiveMinute.map(s -> s.series().generatedAt()),
                predispatch.map(s -> s.series().generatedAt()));
        Instant lastUpdate = latest(fiveMinute.map(SeriesSnapshot::lastSuccessfulUpdate),
                predispatch.map(SeriesSnapshot::lastSuccessfulUpdate));

        return ForecastView.of(region, MERGED_KIND, points, stale, generatedAt, lastUpdate);
    }

    private CurrentPrice toCurrent(Region region, SeriesSnapshot snapshot, PricePoint point, String source) {
        return new CurrentPrice(
                region.getCode(),
                point.price(),
                ForecastView.marketTime(region, point.timestamp()),
                snapshot.lastSuccessfulUpdate().toString(),
                snapshot.stale(),
                source,
                store.spikeInfo(region).orElse(null));
    }

    private static Instant latest(Optional<Instant> a, Optional<Instant> b) {
        if (a.isEmpty()) {
            return b.orElse(null);
        }
        if (b.isEmpty()) {
            return a.get();
        }
        return a.get().isAfter(b.get()) ? a.get() : b.get();
    }
}
