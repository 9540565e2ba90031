package com.nemweb.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable price series for one (region, product) pair, built from a single report bundle.
 *
 * @param region      Region the prices belong to
 * @param kind        Product the series represents
 * @param points      Points in strictly ascending timestamp order
 * @param generatedAt Publish time of the source bundle
 * @param sourceFile  Identifier (file name) of the source bundle
 */
public record ForecastSeries(Region region, ProductKind kind, List<PricePoint> points,
                             Instant generatedAt, String sourceFile) {

    public ForecastSeries {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(generatedAt, "generatedAt");
        points = List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).timestamp().isAfter(points.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Timestamps must be strictly increasing at index " + i);
            }
        }
    }

    public List<Instant> timestamps() {
        return points.stream().map(PricePoint::timestamp).toList();
    }

    public List<Double> prices() {
        return points.stream().map(PricePoint::price).toList();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    public PricePoint first() {
        return points.get(0);
    }

    public PricePoint last() {
        return points.get(points.size() - 1);
    }

    public SeriesKey key() {
        return new SeriesKey(region, kind);
    }
}
