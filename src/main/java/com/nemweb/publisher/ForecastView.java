package com.nemweb.publisher;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nemweb.model.PricePoint;
import com.nemweb.model.Region;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forecast attributes in the array layout consumed by EMHASS-style optimisers.
 *
 * <pre>
 * {
 *   "region": "NSW1",
 *   "kind": "five_minute",
 *   "forecast": [85.12, 90.4, ...],
 *   "timestamps": ["2025-12-25T15:25:00+10:00", ...],
 *   "forecast_dict": {"2025-12-25T15:25:00+10:00": 85.12, ...},
 *   ...
 * }
 * </pre>
 *
 * All arrays have the same length and follow ascending timestamp order. Prices are in $/MWh;
 * {@code forecast_kwh} and {@code forecast_cents} carry the same values in $/kWh and c/kWh.
 */
public record ForecastView(
        @JsonProperty("region") String region,
        @JsonProperty("kind") String kind,
        @JsonProperty("forecast") List<Double> forecast,
        @JsonProperty("timestamps") List<String> timestamps,
        @JsonProperty("forecast_dict") Map<String, Double> forecastDict,
        @JsonProperty("forecast_kwh") List<Double> forecastKwh,
        @JsonProperty("forecast_cents") List<Double> forecastCents,
        @JsonProperty("forecast_length") int forecastLength,
        @JsonProperty("stale") boolean stale,
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("last_update") String lastUpdate
) {

    static final DateTimeFormatter ISO = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    /**
     * Build a view from points already in ascending order.
     */
    static ForecastView of(Region region, String kind, List<PricePoint> points, boolean stale,
                           Instant generatedAt, Instant lastUpdate) {
        List<Double> prices = new ArrayList<>(points.size());
        List<String> stamps = new ArrayList<>(points.size());
        Map<String, Double> dict = new LinkedHashMap<>();
        List<Double> kwh = new ArrayList<>(points.size());
        List<Double> cents = new ArrayList<>(points.size());

        for (PricePoint point : points) {
            String iso = marketTime(region, point.timestamp());
            prices.add(point.price());
            stamps.add(iso);
            dict.put(iso, point.price());
            kwh.add(point.pricePerKwh());
            cents.add(point.priceCents());
        }

        return new ForecastView(region.getCode(), kind, List.copyOf(prices), List.copyOf(stamps),
                Collections.unmodifiableMap(dict), List.copyOf(kwh), List.copyOf(cents), prices.size(),
                stale, generatedAt == null ? null : marketTime(region, generatedAt),
                lastUpdate == null ? null : lastUpdate.toString());
    }

    /**
     * Empty view for a key that has never been updated.
     */
    static ForecastView empty(Region region, String kind) {
        return of(region, kind, List.of(), false, null, null);
    }

    static String marketTime(Region region, Instant instant) {
        return OffsetDateTime.ofInstant(instant, region.offset()).format(ISO);
    }
}
