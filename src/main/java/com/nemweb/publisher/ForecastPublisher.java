package com.nemweb.publisher;

import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only pull interface offered to host platforms. Every call returns a copy built from
 * the latest committed snapshots; nothing here blocks the pollers.
 */
public interface ForecastPublisher {

    /**
     * Latest spot price, its interval timestamp, last update time and staleness.
     *
     * @return empty until the region has any realtime or 5-minute data
     */
    Optional<CurrentPrice> current(Region region);

    /**
     * The raw series of one product as parallel arrays. Empty arrays until the first update.
     *
     * <p>{@code forecast} is in $/MWh. Optimisers that expect the $/kWh {@code forecast} attribute
     * of the Home Assistant sensor should read {@code forecast_kwh} instead.
     */
    ForecastView forecast(Region region, ProductKind kind);

    /**
     * Maximum price among the still-future points of the latest series of {@code kind}.
     */
    OptionalDouble peak(Region region, ProductKind kind);

    /**
     * Single forward-looking series: the 5-minute points followed by the predispatch points
     * that lie beyond the 5-minute horizon.
     */
    ForecastView merged(Region region);
}
