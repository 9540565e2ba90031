package com.nemweb.model;

/**
 * Composite key identifying one polled product of one region.
 * Uses Java record for automatic equals/hashCode, safe for use as ConcurrentHashMap key.
 *
 * @param region Market region
 * @param kind   Price product
 */
public record SeriesKey(Region region, ProductKind kind) {

    @Override
    public String toString() {
        return region.getCode() + "/" + kind.getLabel();
    }
}
