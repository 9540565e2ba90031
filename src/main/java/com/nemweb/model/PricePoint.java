package com.nemweb.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single regional reference price for one market interval.
 *
 * @param timestamp Interval timestamp as published by AEMO
 * @param price     Regional reference price in $/MWh; negative values and the market cap are kept as-is
 */
public record PricePoint(Instant timestamp, double price) {

    public PricePoint {
        Objects.requireNonNull(timestamp, "timestamp");
        if (Double.isNaN(price) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("Price must be a finite number");
        }
    }

    /** Price in cents per kWh. */
    public double priceCents() {
        return price / 10.0;
    }

    /** Price in dollars per kWh. */
    public double pricePerKwh() {
        return price / 1000.0;
    }
}
