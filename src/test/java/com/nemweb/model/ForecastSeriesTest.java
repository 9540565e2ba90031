package com.nemweb.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ForecastSeries")
class ForecastSeriesTest {

    private static final Instant T0 = Instant.parse("2025-12-25T05:20:00Z");

    private static PricePoint point(int minutes, double price) {
        return new PricePoint(T0.plusSeconds(minutes * 60L), price);
    }

    @Test
    @DisplayName("timestamps and prices are parallel views of the points")
    void parallelViews() {
        ForecastSeries series = new ForecastSeries(Region.NSW1, ProductKind.FIVE_MINUTE,
                List.of(point(0, 85.12), point(5, 90.40), point(10, -30.0)), T0, "PUBLIC_P5MIN_X.zip");

        assertThat(series.timestamps()).hasSameSizeAs(series.prices());
        assertThat(series.prices()).containsExactly(85.12, 90.40, -30.0);
        assertThat(series.first().price()).isEqualTo(85.12);
        assertThat(series.last().price()).isEqualTo(-30.0);
        assertThat(series.key()).isEqualTo(new SeriesKey(Region.NSW1, ProductKind.FIVE_MINUTE));
    }

    @Test
    @DisplayName("rejects duplicate timestamps")
    void rejectsDuplicates() {
        assertThatThrownBy(() -> new ForecastSeries(Region.NSW1, ProductKind.REALTIME,
                List.of(point(0, 1.0), point(0, 2.0)), T0, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects out-of-order timestamps")
    void rejectsUnsorted() {
        assertThatThrownBy(() -> new ForecastSeries(Region.NSW1, ProductKind.REALTIME,
                List.of(point(5, 1.0), point(0, 2.0)), T0, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("points are copied and unmodifiable")
    void immutablePoints() {
        List<PricePoint> source = new ArrayList<>(List.of(point(0, 1.0)));
        ForecastSeries series = new ForecastSeries(Region.NSW1, ProductKind.REALTIME, source, T0, "x");
        source.add(point(5, 2.0));

        assertThat(series.size()).isEqualTo(1);
        assertThatThrownBy(() -> series.points().add(point(10, 3.0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("PricePoint keeps market floor and cap as-is and derives per-kWh units")
    void pricePointUnits() {
        PricePoint cap = new PricePoint(T0, 17500.0);
        PricePoint floor = new PricePoint(T0, -1000.0);

        assertThat(cap.priceCents()).isEqualTo(1750.0);
        assertThat(cap.pricePerKwh()).isEqualTo(17.5);
        assertThat(floor.price()).isEqualTo(-1000.0);
        assertThatThrownBy(() -> new PricePoint(T0, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
