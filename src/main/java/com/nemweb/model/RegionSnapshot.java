package com.nemweb.model;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time view of every product held for a region.
 *
 * @param region   Market region
 * @param products Latest snapshot per product; products never updated are absent
 */
public record RegionSnapshot(Region region, Map<ProductKind, SeriesSnapshot> products) {

    public RegionSnapshot {
        products = Map.copyOf(products);
    }

    public Optional<SeriesSnapshot> product(ProductKind kind) {
        return Optional.ofNullable(products.get(kind));
    }

    /**
     * True if any product held for this region is stale.
     */
    public boolean stale() {
        return products.values().stream().anyMatch(SeriesSnapshot::stale);
    }

    /**
     * Most recent successful update across all products, if any.
     */
    public Optional<Instant> lastSuccessfulUpdate() {
        return products.values().stream()
                .map(SeriesSnapshot::lastSuccessfulUpdate)
                .max(Instant::compareTo);
    }
}
